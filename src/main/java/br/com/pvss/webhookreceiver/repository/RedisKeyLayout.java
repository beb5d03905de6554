package br.com.pvss.webhookreceiver.repository;

import br.com.pvss.webhookreceiver.model.StoreShape;

public record RedisKeyLayout(String namespace, String segment) {

    public static final String TO_SEGMENT = "to";
    public static final String SESSION_SEGMENT = "session";
    public static final String EVENT_SEGMENT = "event";

    public String keyFor(String correlationKey, StoreShape shape) {
        String base = namespace + ":" + segment + ":" + correlationKey;
        return shape == StoreShape.HISTORY ? base + ":messages" : base;
    }

    public String keyFor(String id) {
        return namespace + ":" + segment + ":" + id;
    }
}
