package br.com.pvss.webhookreceiver.service;

import br.com.pvss.webhookreceiver.exception.StoreUnavailableException;
import br.com.pvss.webhookreceiver.repository.RedisKeyLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

public class RedisIdempotencyGate implements IdempotencyGate {

    private static final Logger log = LoggerFactory.getLogger(RedisIdempotencyGate.class);

    private final ReactiveStringRedisTemplate redis;
    private final RedisKeyLayout layout;
    private final Clock clock;

    public RedisIdempotencyGate(ReactiveStringRedisTemplate redis, String namespace, Clock clock) {
        this.redis = redis;
        this.layout = new RedisKeyLayout(namespace, RedisKeyLayout.EVENT_SEGMENT);
        this.clock = clock;
    }

    @Override
    public Mono<Boolean> seen(String eventId) {
        String key = layout.keyFor(eventId);
        return redis.hasKey(key)
                .defaultIfEmpty(false)
                .onErrorMap(DataAccessException.class, e -> unavailable(key, e));
    }

    @Override
    public Mono<Void> mark(String eventId, Duration ttl) {
        String key = layout.keyFor(eventId);
        return redis.opsForValue().set(key, clock.instant().toString(), ttl)
                .then()
                .onErrorMap(DataAccessException.class, e -> unavailable(key, e));
    }

    private StoreUnavailableException unavailable(String key, DataAccessException e) {
        log.warn("Redis indisponível ao acessar marca de idempotência {}.", key, e);
        return new StoreUnavailableException("Redis indisponível", e);
    }
}
