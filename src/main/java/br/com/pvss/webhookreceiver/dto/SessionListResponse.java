package br.com.pvss.webhookreceiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SessionListResponse(
        @JsonProperty("count")
        int count,
        @JsonProperty("service_ids")
        List<String> serviceIds
) {
}
