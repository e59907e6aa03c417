package com.everon.link.model.domain;

import java.time.Instant;
import java.time.LocalDate;

import com.everon.link.model.enums.RegistrationStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A pre-provisioned device registration that a chat can claim.
 *
 * The record is looked up by {@code codeHash}, the SHA-256 of the registration
 * code and the shared secret. The plain code is never stored.
 *
 * A record is bound to at most one chat. {@code boundChannelId} and
 * {@code boundAt} are only written by the binding service and are always set
 * or cleared together.
 */
@Entity
@Table(name = "registration_records", indexes = {
    @Index(name = "idx_registration_code_hash", columnList = "code_hash", unique = true),
    @Index(name = "idx_registration_channel", columnList = "bound_channel_id"),
    @Index(name = "idx_registration_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RegistrationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Hex SHA-256 of (code + secret). Lookup key, never rewritten.
     */
    @NotBlank
    @Size(min = 64, max = 64)
    @Column(name = "code_hash", nullable = false, unique = true, updatable = false, length = 64)
    private String codeHash;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 15)
    @Builder.Default
    private RegistrationStatus status = RegistrationStatus.ACTIVE;

    /**
     * First day the registration can be claimed (inclusive). Null = no lower bound.
     */
    @Column(name = "valid_from")
    private LocalDate validFrom;

    /**
     * Last day the registration can be claimed (inclusive). Null = no upper bound.
     */
    @Column(name = "valid_until")
    private LocalDate validUntil;

    /**
     * Chat currently holding the registration, null when unbound.
     */
    @Column(name = "bound_channel_id", length = 64)
    private String boundChannelId;

    /**
     * When the current binding was made.
     */
    @Column(name = "bound_at")
    private Instant boundAt;

    /**
     * Free-text note from provisioning (e.g. device serial).
     */
    @Column(name = "label", length = 120)
    private String label;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Optimistic lock counter. A save with a stale version is rejected.
     */
    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isBound() {
        return boundChannelId != null;
    }

    public boolean isBoundTo(String channelId) {
        return boundChannelId != null && boundChannelId.equals(channelId);
    }

    /**
     * Bind this record to a chat.
     */
    public void bindTo(String channelId, Instant at) {
        this.boundChannelId = channelId;
        this.boundAt = at;
    }

    /**
     * Clear the binding.
     */
    public void unbind() {
        this.boundChannelId = null;
        this.boundAt = null;
    }

    /**
     * Detached copy, so a rejected transition never touches the caller's instance.
     */
    public RegistrationRecord copy() {
        return toBuilder().build();
    }
}
