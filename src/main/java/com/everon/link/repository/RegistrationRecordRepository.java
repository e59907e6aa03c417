package com.everon.link.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.everon.link.model.domain.RegistrationRecord;

/**
 * Repository for RegistrationRecord entity.
 */
@Repository
public interface RegistrationRecordRepository extends JpaRepository<RegistrationRecord, Long> {

    /**
     * Find a registration by its code hash.
     */
    Optional<RegistrationRecord> findByCodeHash(String codeHash);

    boolean existsByCodeHash(String codeHash);

    /**
     * Registrations held by a chat, most recent binding first.
     */
    List<RegistrationRecord> findByBoundChannelIdOrderByBoundAtDesc(String boundChannelId);
}
