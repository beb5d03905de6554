package br.com.pvss.webhookreceiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record HealthResponse(
        @JsonProperty("status")
        String status,
        @JsonProperty("now_utc")
        Instant nowUtc,
        @JsonProperty("ttl_seconds")
        long ttlSeconds,
        @JsonProperty("backend")
        String backend,
        @JsonProperty("backend_reachable")
        boolean backendReachable,
        @JsonProperty("backend_url")
        String backendUrl,
        @JsonProperty("max_history")
        int maxHistory
) {
}
