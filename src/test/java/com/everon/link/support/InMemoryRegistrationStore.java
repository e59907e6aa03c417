package com.everon.link.support;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import com.everon.link.exception.DuplicateRegistrationException;
import com.everon.link.exception.StoreConflictException;
import com.everon.link.exception.StoreUnavailableException;
import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.store.RegistrationStore;

/**
 * Versioned in-memory store with lookup counters and fault injection.
 */
public class InMemoryRegistrationStore implements RegistrationStore {

    private final Map<String, RegistrationRecord> records = new LinkedHashMap<>();

    public final AtomicInteger lookups = new AtomicInteger();
    public final AtomicInteger saves = new AtomicInteger();

    private volatile boolean unavailable;
    private volatile int failSavesAfter = -1;
    private final AtomicInteger conflictsToInject = new AtomicInteger();

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * Fail every save once {@code count} saves have succeeded; negative disables.
     */
    public void failSavesAfter(int count) {
        this.failSavesAfter = count;
    }

    /**
     * Make the next {@code count} saves fail as if another writer won the race.
     */
    public void injectConflicts(int count) {
        conflictsToInject.set(count);
    }

    public synchronized RegistrationRecord put(RegistrationRecord record) {
        RegistrationRecord stored = record.copy();
        if (stored.getVersion() == null) {
            stored.setVersion(0L);
        }
        records.put(stored.getCodeHash(), stored);
        return stored.copy();
    }

    public synchronized RegistrationRecord get(String codeHash) {
        RegistrationRecord record = records.get(codeHash);
        return record == null ? null : record.copy();
    }

    @Override
    public String getType() {
        return "memory";
    }

    @Override
    public synchronized Optional<RegistrationRecord> findByCodeHash(String codeHash) {
        checkAvailable();
        lookups.incrementAndGet();
        return Optional.ofNullable(records.get(codeHash)).map(RegistrationRecord::copy);
    }

    @Override
    public synchronized List<RegistrationRecord> findByBoundChannelId(String channelId) {
        checkAvailable();
        lookups.incrementAndGet();
        List<RegistrationRecord> result = new ArrayList<>();
        for (RegistrationRecord record : records.values()) {
            if (Objects.equals(channelId, record.getBoundChannelId())) {
                result.add(record.copy());
            }
        }
        return result;
    }

    @Override
    public synchronized List<RegistrationRecord> findAll() {
        checkAvailable();
        return records.values().stream().map(RegistrationRecord::copy).toList();
    }

    @Override
    public synchronized RegistrationRecord create(RegistrationRecord record) {
        checkAvailable();
        if (records.containsKey(record.getCodeHash())) {
            throw new DuplicateRegistrationException(record.getCodeHash());
        }
        return put(record);
    }

    @Override
    public synchronized RegistrationRecord save(RegistrationRecord record) {
        checkAvailable();
        if (failSavesAfter >= 0 && saves.get() >= failSavesAfter) {
            throw new StoreUnavailableException("store went offline mid-write");
        }
        if (conflictsToInject.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StoreConflictException(record.getCodeHash());
        }
        RegistrationRecord stored = records.get(record.getCodeHash());
        if (stored == null || !Objects.equals(stored.getVersion(), record.getVersion())) {
            throw new StoreConflictException(record.getCodeHash());
        }
        RegistrationRecord updated = record.copy();
        updated.setVersion(stored.getVersion() + 1);
        records.put(updated.getCodeHash(), updated);
        saves.incrementAndGet();
        return updated.copy();
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new StoreUnavailableException("store offline");
        }
    }
}
