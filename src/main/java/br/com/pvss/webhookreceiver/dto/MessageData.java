package br.com.pvss.webhookreceiver.dto;

import jakarta.validation.constraints.NotNull;

public record MessageData(
        @NotNull
        String id,
        @NotNull
        String type,
        @NotNull
        String createdAt,
        @NotNull
        String sentAt,
        @NotNull
        String by,
        @NotNull
        String serviceId,
        String text
) {
}
