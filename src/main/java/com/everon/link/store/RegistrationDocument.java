package com.everon.link.store;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.model.enums.RegistrationStatus;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk shape of {@code registration.json}:
 * <pre>
 * { "registrations": [ { "reg_hash": "...", "telegram_chat_id": 42, "telegram_bound_at": "..." } ] }
 * </pre>
 * Fields this service does not know about are kept and written back unchanged.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegistrationDocument {

    private List<Entry> registrations = new ArrayList<>();

    @JsonIgnore
    private Map<String, Object> other = new LinkedHashMap<>();

    @JsonAnySetter
    public void setOther(String name, Object value) {
        other.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getOther() {
        return other;
    }

    public Entry find(String codeHash) {
        for (Entry entry : registrations) {
            if (codeHash.equals(entry.getRegHash())) {
                return entry;
            }
        }
        return null;
    }

    @Data
    @NoArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {

        @JsonProperty("reg_hash")
        private String regHash;

        /**
         * Missing in documents written before statuses existed; read as ACTIVE.
         */
        private RegistrationStatus status;

        @JsonProperty("valid_from")
        private LocalDate validFrom;

        @JsonProperty("valid_until")
        private LocalDate validUntil;

        @JsonIgnore
        private String telegramChatId;

        @JsonProperty("telegram_bound_at")
        private Instant telegramBoundAt;

        private String label;

        @JsonProperty("created_at")
        private Instant createdAt;

        @JsonProperty("updated_at")
        private Instant updatedAt;

        private Long version;

        @JsonIgnore
        private Map<String, Object> other = new LinkedHashMap<>();

        /**
         * Telegram chat ids are numbers; keep writing them as numbers so older
         * readers of the document still match them.
         */
        @JsonGetter("telegram_chat_id")
        public Object getTelegramChatIdValue() {
            if (telegramChatId != null && telegramChatId.matches("-?\\d{1,18}")) {
                return Long.parseLong(telegramChatId);
            }
            return telegramChatId;
        }

        @JsonSetter("telegram_chat_id")
        public void setTelegramChatIdValue(Object value) {
            this.telegramChatId = value == null ? null : String.valueOf(value);
        }

        @JsonAnySetter
        public void setOther(String name, Object value) {
            other.put(name, value);
        }

        @JsonAnyGetter
        public Map<String, Object> getOther() {
            return other;
        }

        public static Entry fromRecord(RegistrationRecord record) {
            Entry entry = new Entry();
            entry.setRegHash(record.getCodeHash());
            entry.setCreatedAt(record.getCreatedAt());
            entry.apply(record);
            return entry;
        }

        /**
         * Copy every mutable field from the record. The hash is left alone.
         */
        public void apply(RegistrationRecord record) {
            this.status = record.getStatus();
            this.validFrom = record.getValidFrom();
            this.validUntil = record.getValidUntil();
            this.telegramChatId = record.getBoundChannelId();
            this.telegramBoundAt = record.getBoundAt();
            this.label = record.getLabel();
        }

        public RegistrationRecord toRecord() {
            return RegistrationRecord.builder()
                    .codeHash(regHash)
                    .status(status != null ? status : RegistrationStatus.ACTIVE)
                    .validFrom(validFrom)
                    .validUntil(validUntil)
                    .boundChannelId(telegramChatId)
                    .boundAt(telegramBoundAt)
                    .label(label)
                    .createdAt(createdAt)
                    .updatedAt(updatedAt)
                    .version(version != null ? version : 0L)
                    .build();
        }
    }
}
