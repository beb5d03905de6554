package br.com.pvss.webhookreceiver.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CloudEventMessage(
        @NotNull
        String specversion,
        @NotNull
        String id,
        @NotNull
        String type,
        @NotNull
        String source,
        @NotNull
        String subject,
        @NotNull
        String time,
        @NotNull
        String datacontenttype,
        @NotNull
        @Valid
        MessageData data
) {
}
