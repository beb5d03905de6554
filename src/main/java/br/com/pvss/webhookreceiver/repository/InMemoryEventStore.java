package br.com.pvss.webhookreceiver.repository;

import br.com.pvss.webhookreceiver.model.StoreHealth;
import br.com.pvss.webhookreceiver.model.StoreShape;
import br.com.pvss.webhookreceiver.model.StoredRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryEventStore implements EventStore {

    public static final String BACKEND = "memory";
    public static final String LOCATION = "in-process";

    private final StoreShape shape;
    private final int maxEntries;
    private final Duration configuredTtl;
    private final Clock clock;

    // ordem de inserção da primeira escrita; guardado pelo monitor da instância
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public InMemoryEventStore(StoreShape shape, int maxEntries, Duration configuredTtl, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries deve ser >= 1");
        }
        this.shape = shape;
        this.maxEntries = maxEntries;
        this.configuredTtl = configuredTtl;
        this.clock = clock;
    }

    @Override
    public StoreShape shape() {
        return shape;
    }

    @Override
    public String backend() {
        return BACKEND;
    }

    @Override
    public Mono<Void> put(String key, StoredRecord record, Duration ttl) {
        return Mono.fromRunnable(() -> write(key, record, ttl));
    }

    @Override
    public Mono<StoredRecord> getLatest(String key) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Entry entry = live(key);
                return entry == null ? null : entry.records.peekLast();
            }
        });
    }

    @Override
    public Mono<List<StoredRecord>> getAll(String key) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                Entry entry = live(key);
                if (entry == null || entry.records.isEmpty()) {
                    return null;
                }
                return List.copyOf(entry.records);
            }
        });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                return live(key) != null && entries.remove(key) != null;
            }
        });
    }

    @Override
    public Mono<StoreHealth> health() {
        return Mono.fromSupplier(() -> new StoreHealth(BACKEND, LOCATION, configuredTtl, true, clock.instant()));
    }

    @Override
    public Flux<String> listKeys(int limit) {
        return Mono.fromCallable(() -> {
                    synchronized (this) {
                        purgeExpired();
                        List<String> keys = new ArrayList<>(Math.max(0, Math.min(limit, entries.size())));
                        for (String key : entries.keySet()) {
                            if (keys.size() >= limit) {
                                break;
                            }
                            keys.add(key);
                        }
                        return keys;
                    }
                })
                .flatMapMany(Flux::fromIterable);
    }

    synchronized int size() {
        return entries.size();
    }

    private synchronized void write(String key, StoredRecord record, Duration ttl) {
        purgeExpired();
        Instant expiresAt = clock.instant().plus(ttl);
        Entry entry = entries.get(key);
        if (entry == null || shape == StoreShape.LATEST) {
            Deque<StoredRecord> records = new ArrayDeque<>();
            records.addLast(record);
            entries.put(key, new Entry(records, expiresAt));
            return;
        }
        entry.records.addLast(record);
        while (entry.records.size() > maxEntries) {
            entry.records.pollFirst();
        }
        entries.put(key, new Entry(entry.records, expiresAt));
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
            }
        }
    }

    private record Entry(Deque<StoredRecord> records, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
