package br.com.pvss.webhookreceiver.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionResult(
        @JsonProperty("status")
        String status,
        @JsonProperty("reason")
        String reason,
        @JsonProperty("backend")
        String backend,
        @JsonProperty("to")
        String to,
        @JsonProperty("service_id")
        String serviceId,
        @JsonProperty("ttl_seconds")
        Long ttlSeconds
) {

    public static final String STATUS_STORED = "stored";
    public static final String STATUS_OK = "ok";
    public static final String STATUS_IGNORED = "ignored";

    public static IngestionResult ignored(String reason) {
        return new IngestionResult(STATUS_IGNORED, reason, null, null, null, null);
    }

    public static IngestionResult storedTo(String to, long ttlSeconds) {
        return new IngestionResult(STATUS_STORED, null, null, to, null, ttlSeconds);
    }

    public static IngestionResult storedSession(String backend, String serviceId) {
        return new IngestionResult(STATUS_OK, null, backend, null, serviceId, null);
    }

    @JsonIgnore
    public boolean isIgnored() {
        return STATUS_IGNORED.equals(status);
    }
}
