package br.com.pvss.webhookreceiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record ServiceInfoResponse(
        @JsonProperty("service")
        String service,
        @JsonProperty("now_utc")
        Instant nowUtc,
        @JsonProperty("endpoints")
        Map<String, String> endpoints
) {
}
