package com.everon.link.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.springframework.stereotype.Service;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.exception.StoreConflictException;
import com.everon.link.exception.StoreUnavailableException;
import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.model.dto.BindingResult;
import com.everon.link.model.dto.InboundEvent;
import com.everon.link.model.enums.BindingOutcome;
import com.everon.link.store.RegistrationStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Binds chats to registrations.
 *
 * A registration is either unbound or bound to exactly one chat:
 * <ul>
 *   <li>unbound + bind from C: bound to C, token issued</li>
 *   <li>bound to C + bind from C: unchanged, fresh token issued</li>
 *   <li>bound to D + bind from C: rejected, unchanged</li>
 *   <li>bound to C + unbind from C: unbound, no token</li>
 *   <li>unbind from anyone else: rejected, unchanged</li>
 * </ul>
 *
 * Each transition runs under the registration's lock and commits with a
 * version compare-and-swap. When another process wins the race the record is
 * re-read and the transition decided again. Records are only written after
 * every check has passed.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistrationBindingService {

    private final RegistrationCodeNormalizer normalizer;
    private final RecordMatcher matcher;
    private final EligibilityChecker eligibilityChecker;
    private final LinkTokenIssuer tokenIssuer;
    private final RecordLockRegistry lockRegistry;
    private final RegistrationStore store;
    private final EveronLinkProperties properties;
    private final Clock clock;

    /**
     * Run one inbound event through the pipeline.
     */
    public BindingResult handle(InboundEvent event) {
        return switch (event.kind()) {
            case BIND_ATTEMPT -> bind(event.channelId(), event.rawText());
            case UNBIND -> unbind(event.channelId(), event.rawText());
            case REISSUE_TOKEN -> reissueToken(event.channelId());
        };
    }

    /**
     * Claim the registration identified by a user-supplied code.
     */
    public BindingResult bind(String channelId, String rawText) {
        Optional<String> code = normalizer.normalize(rawText);
        if (code.isEmpty()) {
            log.debug("BINDING: Rejected malformed code from chat {}", channelId);
            return BindingResult.failure(BindingOutcome.INVALID_FORMAT, channelId);
        }

        String codeHash = matcher.digest(code.get());
        return lockRegistry.withLock(codeHash, () -> commit(codeHash, channelId, record -> {
            var eligibility = eligibilityChecker.check(record);
            if (!eligibility.eligible()) {
                log.info("BINDING: Registration {} not eligible for chat {}: {}",
                        abbreviate(codeHash), channelId, eligibility.reason());
                return BindingResult.failure(eligibility.reason(), channelId, record);
            }

            if (record.isBoundTo(channelId)) {
                log.info("BINDING: Chat {} re-confirmed registration {}", channelId, abbreviate(codeHash));
                return BindingResult.success(BindingOutcome.ALREADY_BOUND_TO_CHANNEL, channelId,
                        List.of(record), tokenIssuer.issue(channelId));
            }

            if (record.isBound()) {
                log.warn("BINDING: Chat {} tried to claim registration {} held by another chat",
                        channelId, abbreviate(codeHash));
                return BindingResult.failure(BindingOutcome.ALREADY_LINKED_ELSEWHERE, channelId, record);
            }

            RegistrationRecord updated = record.copy();
            updated.bindTo(channelId, clock.instant());
            RegistrationRecord saved = store.save(updated);

            log.info("BINDING: Registration {} bound to chat {}", abbreviate(codeHash), channelId);
            return BindingResult.success(BindingOutcome.BOUND, channelId, List.of(saved), tokenIssuer.issue(channelId));
        }));
    }

    /**
     * Release a binding held by the chat.
     *
     * @param rawText registration code naming the binding; when blank every
     *                registration the chat holds is released. If the store fails
     *                part way, the records released so far are returned as
     *                {@code UNBOUND}; repeating the request releases the rest.
     */
    public BindingResult unbind(String channelId, String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return unbindAll(channelId);
        }

        Optional<String> code = normalizer.normalize(rawText);
        if (code.isEmpty()) {
            return BindingResult.failure(BindingOutcome.INVALID_FORMAT, channelId);
        }

        String codeHash = matcher.digest(code.get());
        return lockRegistry.withLock(codeHash, () -> commit(codeHash, channelId, record -> {
            if (!record.isBound()) {
                return BindingResult.failure(BindingOutcome.NOT_BOUND, channelId, record);
            }
            if (!record.isBoundTo(channelId)) {
                log.warn("BINDING: Chat {} tried to unbind registration {} it does not hold",
                        channelId, abbreviate(codeHash));
                return BindingResult.failure(BindingOutcome.NOT_OWNER, channelId, record);
            }
            return BindingResult.success(BindingOutcome.UNBOUND, channelId, List.of(release(record)), null);
        }));
    }

    /**
     * Issue a fresh link token for the chat's existing binding.
     */
    public BindingResult reissueToken(String channelId) {
        List<RegistrationRecord> held;
        try {
            held = store.findByBoundChannelId(channelId);
        } catch (StoreUnavailableException e) {
            return BindingResult.failure(BindingOutcome.STORE_UNAVAILABLE, channelId);
        }

        if (held.isEmpty()) {
            return BindingResult.failure(BindingOutcome.NOT_BOUND, channelId);
        }

        for (RegistrationRecord record : held) {
            if (eligibilityChecker.check(record).eligible()) {
                log.info("BINDING: Re-issued link token for chat {}", channelId);
                return BindingResult.success(BindingOutcome.TOKEN_REISSUED, channelId,
                        List.of(record), tokenIssuer.issue(channelId));
            }
        }

        RegistrationRecord first = held.get(0);
        return BindingResult.failure(eligibilityChecker.check(first).reason(), channelId, first);
    }

    /**
     * Registrations currently held by a chat. Empty when the store is down.
     */
    public List<RegistrationRecord> findBindings(String channelId) {
        try {
            return store.findByBoundChannelId(channelId);
        } catch (StoreUnavailableException e) {
            return List.of();
        }
    }

    /**
     * Operator release of a binding, regardless of which chat holds it.
     */
    public BindingResult releaseByOperator(String codeHash) {
        return lockRegistry.withLock(codeHash, () -> commit(codeHash, null, record -> {
            if (!record.isBound()) {
                return BindingResult.failure(BindingOutcome.NOT_BOUND, null, record);
            }
            String holder = record.getBoundChannelId();
            RegistrationRecord saved = release(record);
            log.info("BINDING: Operator released registration {} from chat {}", abbreviate(codeHash), holder);
            return BindingResult.success(BindingOutcome.UNBOUND, holder, List.of(saved), null);
        }));
    }

    private BindingResult unbindAll(String channelId) {
        List<RegistrationRecord> held;
        try {
            held = store.findByBoundChannelId(channelId);
        } catch (StoreUnavailableException e) {
            return BindingResult.failure(BindingOutcome.STORE_UNAVAILABLE, channelId);
        }

        List<RegistrationRecord> released = new ArrayList<>();
        for (RegistrationRecord candidate : held) {
            String codeHash = candidate.getCodeHash();
            BindingResult result = lockRegistry.withLock(codeHash, () -> commit(codeHash, channelId, record -> {
                if (!record.isBoundTo(channelId)) {
                    return BindingResult.failure(BindingOutcome.NOT_BOUND, channelId, record);
                }
                return BindingResult.success(BindingOutcome.UNBOUND, channelId, List.of(release(record)), null);
            }));
            if (result.outcome() == BindingOutcome.STORE_UNAVAILABLE) {
                if (released.isEmpty()) {
                    return result;
                }
                log.warn("BINDING: Store failed after releasing {} of {} registrations for chat {}",
                        released.size(), held.size(), channelId);
                break;
            }
            if (result.isSuccess()) {
                released.addAll(result.records());
            }
        }

        if (released.isEmpty()) {
            return BindingResult.failure(BindingOutcome.NOT_BOUND, channelId);
        }
        return BindingResult.success(BindingOutcome.UNBOUND, channelId, released, null);
    }

    private RegistrationRecord release(RegistrationRecord record) {
        RegistrationRecord updated = record.copy();
        updated.unbind();
        RegistrationRecord saved = store.save(updated);
        log.info("BINDING: Registration {} unbound", abbreviate(record.getCodeHash()));
        return saved;
    }

    /**
     * Read the record, decide the transition and commit it, re-reading when a
     * concurrent writer got there first. Must be called holding the record lock.
     */
    private BindingResult commit(String codeHash, String channelId,
                                 Function<RegistrationRecord, BindingResult> transition) {
        int maxAttempts = Math.max(1, properties.getBinding().getMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Optional<RegistrationRecord> match = matcher.match(codeHash);
                if (match.isEmpty()) {
                    log.info("BINDING: No registration matches code from chat {}", channelId);
                    return BindingResult.failure(BindingOutcome.NOT_FOUND, channelId);
                }
                return transition.apply(match.get());

            } catch (StoreConflictException e) {
                log.debug("BINDING: Concurrent update on {} (attempt {}/{})",
                        abbreviate(codeHash), attempt, maxAttempts);
            } catch (StoreUnavailableException e) {
                log.error("BINDING: Store unavailable for chat {}: {}", channelId, e.getMessage());
                return BindingResult.failure(BindingOutcome.STORE_UNAVAILABLE, channelId);
            }
        }

        log.warn("BINDING: Gave up on {} after {} conflicting attempts", abbreviate(codeHash), maxAttempts);
        return BindingResult.failure(BindingOutcome.STORE_UNAVAILABLE, channelId);
    }

    private static String abbreviate(String codeHash) {
        return codeHash.substring(0, Math.min(8, codeHash.length()));
    }
}
