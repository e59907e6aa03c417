package com.everon.link.store;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.exception.DuplicateRegistrationException;
import com.everon.link.exception.StoreConflictException;
import com.everon.link.exception.StoreUnavailableException;
import com.everon.link.model.domain.RegistrationRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import lombok.extern.slf4j.Slf4j;

/**
 * Store backed by a single {@code registration.json} document.
 *
 * Every write is a whole-document read-modify-write, held under a JVM-wide
 * lock for the document path and an OS lock on a {@code .lock} file next to
 * it, so several processes may share one document. The per-record version
 * gives callers a compare-and-swap: a save carrying a stale version is
 * rejected. The new document is written to a temporary file and moved over
 * the old one.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@Component
@ConditionalOnProperty(prefix = "everon.link.store", name = "type", havingValue = "file")
@Slf4j
public class JsonFileRegistrationStore implements RegistrationStore {

    /**
     * FileChannel locks are held per JVM, so instances on the same path share one in-process lock.
     */
    private static final Map<Path, ReentrantLock> DOCUMENT_LOCKS = new ConcurrentHashMap<>();

    private final Path documentPath;
    private final Path lockPath;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock documentLock;

    @Autowired
    public JsonFileRegistrationStore(EveronLinkProperties properties, ObjectMapper objectMapper, Clock clock) {
        this(Path.of(properties.getStore().getFilePath()), objectMapper, clock);
    }

    public JsonFileRegistrationStore(Path documentPath, ObjectMapper objectMapper, Clock clock) {
        this.documentPath = documentPath.toAbsolutePath().normalize();
        this.lockPath = this.documentPath.resolveSibling(this.documentPath.getFileName() + ".lock");
        this.clock = clock;
        this.documentLock = DOCUMENT_LOCKS.computeIfAbsent(this.documentPath, path -> new ReentrantLock());
        this.objectMapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("STORE: Using registration document {}", this.documentPath);
    }

    @Override
    public String getType() {
        return "file";
    }

    @Override
    public Optional<RegistrationRecord> findByCodeHash(String codeHash) {
        documentLock.lock();
        try {
            RegistrationDocument.Entry entry = read().find(codeHash);
            return Optional.ofNullable(entry).map(RegistrationDocument.Entry::toRecord);
        } finally {
            documentLock.unlock();
        }
    }

    @Override
    public List<RegistrationRecord> findByBoundChannelId(String channelId) {
        documentLock.lock();
        try {
            return read().getRegistrations().stream()
                    .filter(entry -> Objects.equals(channelId, entry.getTelegramChatId()))
                    .map(RegistrationDocument.Entry::toRecord)
                    .toList();
        } finally {
            documentLock.unlock();
        }
    }

    @Override
    public List<RegistrationRecord> findAll() {
        documentLock.lock();
        try {
            return read().getRegistrations().stream()
                    .map(RegistrationDocument.Entry::toRecord)
                    .toList();
        } finally {
            documentLock.unlock();
        }
    }

    @Override
    public RegistrationRecord create(RegistrationRecord record) {
        return exclusively(() -> {
            RegistrationDocument document = read();
            if (document.find(record.getCodeHash()) != null) {
                throw new DuplicateRegistrationException(record.getCodeHash());
            }
            Instant now = clock.instant();
            RegistrationDocument.Entry entry = RegistrationDocument.Entry.fromRecord(record);
            entry.setCreatedAt(record.getCreatedAt() != null ? record.getCreatedAt() : now);
            entry.setUpdatedAt(now);
            entry.setVersion(0L);
            document.getRegistrations().add(entry);
            write(document);
            return entry.toRecord();
        });
    }

    @Override
    public RegistrationRecord save(RegistrationRecord record) {
        return exclusively(() -> {
            RegistrationDocument document = read();
            RegistrationDocument.Entry entry = document.find(record.getCodeHash());
            if (entry == null) {
                throw new StoreConflictException(record.getCodeHash());
            }
            long stored = entry.getVersion() != null ? entry.getVersion() : 0L;
            long expected = record.getVersion() != null ? record.getVersion() : 0L;
            if (stored != expected) {
                throw new StoreConflictException(record.getCodeHash());
            }
            entry.apply(record);
            entry.setVersion(stored + 1);
            entry.setUpdatedAt(clock.instant());
            write(document);
            return entry.toRecord();
        });
    }

    @Override
    public boolean isAvailable() {
        return !Files.exists(documentPath) || Files.isReadable(documentPath);
    }

    /**
     * Run a read-check-write with the document locked against this JVM and other processes.
     */
    private <T> T exclusively(Supplier<T> action) {
        documentLock.lock();
        try {
            Files.createDirectories(lockPath.getParent());
            try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock fileLock = channel.lock()) {
                return action.get();
            }
        } catch (IOException e) {
            log.error("STORE: Failed to lock {}: {}", lockPath, e.getMessage());
            throw new StoreUnavailableException("Registration document lock unavailable", e);
        } finally {
            documentLock.unlock();
        }
    }

    private RegistrationDocument read() {
        if (!Files.exists(documentPath)) {
            return new RegistrationDocument();
        }
        try {
            RegistrationDocument document = objectMapper.readValue(documentPath.toFile(), RegistrationDocument.class);
            if (document.getRegistrations() == null) {
                document.setRegistrations(new ArrayList<>());
            }
            return document;
        } catch (IOException e) {
            log.error("STORE: Failed to read {}: {}", documentPath, e.getMessage());
            throw new StoreUnavailableException("Registration document unreadable", e);
        }
    }

    private void write(RegistrationDocument document) {
        try {
            Path parent = documentPath.getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, "registration", ".json.tmp");
            objectMapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, documentPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, documentPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("STORE: Failed to write {}: {}", documentPath, e.getMessage());
            throw new StoreUnavailableException("Registration document not writable", e);
        }
    }
}
