package br.com.pvss.webhookreceiver.service;

import br.com.pvss.webhookreceiver.model.StoredRecord;
import br.com.pvss.webhookreceiver.repository.EventStore;
import reactor.core.publisher.Mono;

import java.util.List;

public class CorrelationQueryService {

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 500;

    private final EventStore store;

    public CorrelationQueryService(EventStore store) {
        this.store = store;
    }

    public String backend() {
        return store.backend();
    }

    public Mono<StoredRecord> getLatest(String key) {
        return store.getLatest(key);
    }

    public Mono<List<StoredRecord>> getAll(String key) {
        return store.getAll(key).filter(records -> !records.isEmpty());
    }

    public Mono<Boolean> delete(String key) {
        return store.delete(key).filter(Boolean::booleanValue);
    }

    public Mono<List<String>> list(int limit) {
        return store.listKeys(clampLimit(limit)).collectList();
    }

    static int clampLimit(int limit) {
        return Math.max(MIN_LIMIT, Math.min(limit, MAX_LIMIT));
    }
}
