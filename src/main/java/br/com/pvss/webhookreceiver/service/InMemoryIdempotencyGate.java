package br.com.pvss.webhookreceiver.service;

import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryIdempotencyGate implements IdempotencyGate {

    private final Map<String, Instant> marks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdempotencyGate(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Boolean> seen(String eventId) {
        return Mono.fromSupplier(() -> {
            Instant expiresAt = marks.get(eventId);
            if (expiresAt == null) {
                return false;
            }
            if (!clock.instant().isBefore(expiresAt)) {
                marks.remove(eventId, expiresAt);
                return false;
            }
            return true;
        });
    }

    @Override
    public Mono<Void> mark(String eventId, Duration ttl) {
        return Mono.fromRunnable(() -> {
            Instant now = clock.instant();
            marks.values().removeIf(expiresAt -> !now.isBefore(expiresAt));
            marks.put(eventId, now.plus(ttl));
        });
    }

    int size() {
        return marks.size();
    }
}
