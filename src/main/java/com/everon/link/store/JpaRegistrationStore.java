package com.everon.link.store;

import java.util.List;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import com.everon.link.exception.DuplicateRegistrationException;
import com.everon.link.exception.StoreConflictException;
import com.everon.link.exception.StoreUnavailableException;
import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.repository.RegistrationRecordRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Database-backed store. The entity's {@code @Version} column provides the
 * compare-and-swap, so concurrent writers in other processes are covered too.
 */
@Component
@ConditionalOnProperty(prefix = "everon.link.store", name = "type", havingValue = "jpa", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JpaRegistrationStore implements RegistrationStore {

    private final RegistrationRecordRepository repository;

    @Override
    public String getType() {
        return "jpa";
    }

    @Override
    public Optional<RegistrationRecord> findByCodeHash(String codeHash) {
        try {
            return repository.findByCodeHash(codeHash).map(RegistrationRecord::copy);
        } catch (DataAccessException e) {
            throw unavailable("read", e);
        }
    }

    @Override
    public List<RegistrationRecord> findByBoundChannelId(String channelId) {
        try {
            return repository.findByBoundChannelIdOrderByBoundAtDesc(channelId).stream()
                    .map(RegistrationRecord::copy)
                    .toList();
        } catch (DataAccessException e) {
            throw unavailable("read", e);
        }
    }

    @Override
    public List<RegistrationRecord> findAll() {
        try {
            return repository.findAll().stream().map(RegistrationRecord::copy).toList();
        } catch (DataAccessException e) {
            throw unavailable("read", e);
        }
    }

    @Override
    public RegistrationRecord create(RegistrationRecord record) {
        try {
            if (repository.existsByCodeHash(record.getCodeHash())) {
                throw new DuplicateRegistrationException(record.getCodeHash());
            }
            return repository.save(record.copy()).copy();
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateRegistrationException(record.getCodeHash());
        } catch (DataAccessException e) {
            throw unavailable("create", e);
        }
    }

    @Override
    public RegistrationRecord save(RegistrationRecord record) {
        if (record.getId() == null) {
            throw new IllegalArgumentException("Record was not read from this store");
        }
        try {
            return repository.saveAndFlush(record.copy()).copy();
        } catch (OptimisticLockingFailureException e) {
            throw new StoreConflictException(record.getCodeHash(), e);
        } catch (DataAccessException e) {
            throw unavailable("write", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            repository.count();
            return true;
        } catch (DataAccessException e) {
            log.warn("STORE: Database unreachable: {}", e.getMessage());
            return false;
        }
    }

    private StoreUnavailableException unavailable(String operation, DataAccessException e) {
        log.error("STORE: Database {} failed: {}", operation, e.getMessage());
        return new StoreUnavailableException("Registration database " + operation + " failed", e);
    }
}
