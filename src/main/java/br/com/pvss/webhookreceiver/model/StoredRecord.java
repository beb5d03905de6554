package br.com.pvss.webhookreceiver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredRecord(
        @JsonProperty("key")
        String key,
        @JsonProperty("received_at")
        Instant receivedAt,
        @JsonProperty("payload")
        JsonNode payload,
        @JsonProperty("service_id")
        String serviceId,
        @JsonProperty("event_id")
        String eventId,
        @JsonProperty("message_id")
        String messageId,
        @JsonProperty("text")
        String text,
        @JsonProperty("by")
        String sentBy,
        @JsonProperty("created_at")
        String createdAt,
        @JsonProperty("sent_at")
        String sentAt
) {

    public static StoredRecord verbatim(String key, Instant receivedAt, JsonNode payload) {
        return new StoredRecord(key, receivedAt, payload, null, null, null, null, null, null, null);
    }
}
