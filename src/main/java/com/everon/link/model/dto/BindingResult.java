package com.everon.link.model.dto;

import java.util.List;

import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.model.enums.BindingOutcome;

/**
 * Outcome of one inbound event.
 *
 * @param outcome   what happened
 * @param channelId requesting chat
 * @param records   records as they are after the operation (copies); empty on
 *                  failures that never matched a record
 * @param token     fresh link token on BOUND, ALREADY_BOUND_TO_CHANNEL and
 *                  TOKEN_REISSUED, otherwise null
 */
public record BindingResult(
        BindingOutcome outcome,
        String channelId,
        List<RegistrationRecord> records,
        LinkToken token
) {

    public static BindingResult success(BindingOutcome outcome, String channelId,
                                        List<RegistrationRecord> records, LinkToken token) {
        return new BindingResult(outcome, channelId, List.copyOf(records), token);
    }

    public static BindingResult failure(BindingOutcome outcome, String channelId) {
        return new BindingResult(outcome, channelId, List.of(), null);
    }

    public static BindingResult failure(BindingOutcome outcome, String channelId, RegistrationRecord record) {
        return new BindingResult(outcome, channelId, List.of(record.copy()), null);
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public boolean hasToken() {
        return token != null;
    }

    /**
     * The single record this result is about, or null.
     */
    public RegistrationRecord record() {
        return records.isEmpty() ? null : records.get(0);
    }
}
