package com.everon.link.store;

import java.util.List;
import java.util.Optional;

import com.everon.link.exception.DuplicateRegistrationException;
import com.everon.link.exception.StoreConflictException;
import com.everon.link.exception.StoreUnavailableException;
import com.everon.link.model.domain.RegistrationRecord;

/**
 * Durable keyed collection of registration records.
 *
 * Records handed out are detached copies; changing one has no effect until it
 * is passed to {@link #save}. Saving is a compare-and-swap on the record's
 * version: if another writer saved the record since it was read, the save is
 * rejected with {@link StoreConflictException} and nothing is written.
 *
 * Every method may throw {@link StoreUnavailableException} on I/O failure.
 */
public interface RegistrationStore {

    /**
     * Short identifier of the backing storage ("jpa", "file").
     */
    String getType();

    /**
     * Find a record by its code hash.
     */
    Optional<RegistrationRecord> findByCodeHash(String codeHash);

    /**
     * Records currently bound to a chat.
     */
    List<RegistrationRecord> findByBoundChannelId(String channelId);

    List<RegistrationRecord> findAll();

    /**
     * Add a newly provisioned record.
     *
     * @throws DuplicateRegistrationException if the code hash is taken
     */
    RegistrationRecord create(RegistrationRecord record);

    /**
     * Write back a modified record.
     *
     * @param record a copy previously read from this store, with its version untouched
     * @return the record as stored, carrying its new version
     * @throws StoreConflictException if the stored version no longer matches
     */
    RegistrationRecord save(RegistrationRecord record);

    /**
     * Lightweight reachability check for health reporting.
     */
    default boolean isAvailable() {
        try {
            findByCodeHash("");
            return true;
        } catch (StoreUnavailableException e) {
            return false;
        }
    }
}
