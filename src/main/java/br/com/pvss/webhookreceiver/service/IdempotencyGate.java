package br.com.pvss.webhookreceiver.service;

import reactor.core.publisher.Mono;

import java.time.Duration;

public interface IdempotencyGate {

    Mono<Boolean> seen(String eventId);

    Mono<Void> mark(String eventId, Duration ttl);
}
