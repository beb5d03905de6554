package br.com.pvss.webhookreceiver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeleteResponse(
        @JsonProperty("status")
        String status,
        @JsonProperty("backend")
        String backend,
        @JsonProperty("to")
        String to,
        @JsonProperty("service_id")
        String serviceId
) {

    public static DeleteResponse ofTo(String backend, String to) {
        return new DeleteResponse("deleted", backend, to, null);
    }

    public static DeleteResponse ofSession(String backend, String serviceId) {
        return new DeleteResponse("deleted", backend, null, serviceId);
    }
}
