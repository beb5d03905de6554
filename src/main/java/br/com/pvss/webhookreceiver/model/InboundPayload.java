package br.com.pvss.webhookreceiver.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

public final class InboundPayload {

    public static final String WRAPPER_FIELD = "payload";

    private InboundPayload() {
    }

    public static ObjectNode normalize(JsonNode body) {
        if (body instanceof ObjectNode object) {
            return object;
        }
        ObjectNode wrapper = JsonNodeFactory.instance.objectNode();
        wrapper.set(WRAPPER_FIELD, body == null ? NullNode.getInstance() : body);
        return wrapper;
    }
}
