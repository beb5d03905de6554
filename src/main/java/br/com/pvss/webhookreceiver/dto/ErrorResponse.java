package br.com.pvss.webhookreceiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
        @JsonProperty("detail")
        String detail
) {
}
