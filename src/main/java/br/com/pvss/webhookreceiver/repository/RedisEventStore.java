package br.com.pvss.webhookreceiver.repository;

import br.com.pvss.webhookreceiver.exception.RecordSerializationException;
import br.com.pvss.webhookreceiver.exception.StoreUnavailableException;
import br.com.pvss.webhookreceiver.model.StoreHealth;
import br.com.pvss.webhookreceiver.model.StoreShape;
import br.com.pvss.webhookreceiver.model.StoredRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

public class RedisEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(RedisEventStore.class);

    public static final String BACKEND = "redis";

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final RedisKeyLayout layout;
    private final String location;
    private final StoreShape shape;
    private final int maxEntries;
    private final Duration configuredTtl;
    private final Clock clock;
    private final RedisScript<Long> appendScript;

    public RedisEventStore(
            ReactiveStringRedisTemplate redis,
            ObjectMapper objectMapper,
            RedisKeyLayout layout,
            String location,
            StoreShape shape,
            int maxEntries,
            Duration configuredTtl,
            Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries deve ser >= 1");
        }
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.layout = layout;
        this.location = location;
        this.shape = shape;
        this.maxEntries = maxEntries;
        this.configuredTtl = configuredTtl;
        this.clock = clock;
        this.appendScript = new DefaultRedisScript<>(
                """
                        -- Anexa ao final, renova TTL e descarta as entradas mais antigas
                        redis.call('RPUSH', KEYS[1], ARGV[1])
                        redis.call('EXPIRE', KEYS[1], ARGV[2])
                        redis.call('LTRIM', KEYS[1], -tonumber(ARGV[3]), -1)
                        return redis.call('LLEN', KEYS[1])
                        """, Long.class
        );
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
        String redisKey = layout.keyFor(key, shape);
        return Mono.fromCallable(() -> serialize(record))
                .flatMap(json -> {
                    if (shape == StoreShape.LATEST) {
                        return redis.opsForValue().set(redisKey, json, ttl).then();
                    }
                    return redis.execute(appendScript, List.of(redisKey),
                                    List.of(json, String.valueOf(ttl.toSeconds()), String.valueOf(maxEntries)))
                            .next()
                            .doOnNext(size -> log.debug("Chave {} com {} entradas retidas.", redisKey, size))
                            .then();
                })
                .onErrorMap(DataAccessException.class, e -> unavailable(redisKey, e));
    }

    @Override
    public Mono<StoredRecord> getLatest(String key) {
        String redisKey = layout.keyFor(key, shape);
        Mono<String> raw = shape == StoreShape.LATEST
                ? redis.opsForValue().get(redisKey)
                : redis.opsForList().index(redisKey, -1);
        return raw.map(this::deserialize)
                .onErrorMap(DataAccessException.class, e -> unavailable(redisKey, e));
    }

    @Override
    public Mono<List<StoredRecord>> getAll(String key) {
        String redisKey = layout.keyFor(key, shape);
        if (shape == StoreShape.LATEST) {
            return getLatest(key).map(List::of);
        }
        return redis.opsForList().range(redisKey, 0, -1)
                .map(this::deserialize)
                .collectList()
                .filter(records -> !records.isEmpty())
                .onErrorMap(DataAccessException.class, e -> unavailable(redisKey, e));
    }

    @Override
    public Mono<Boolean> delete(String key) {
        String redisKey = layout.keyFor(key, shape);
        return redis.delete(redisKey)
                .map(deleted -> deleted > 0)
                .onErrorMap(DataAccessException.class, e -> unavailable(redisKey, e));
    }

    @Override
    public Mono<StoreHealth> health() {
        return redis.execute(connection -> connection.ping())
                .next()
                .map(pong -> true)
                .defaultIfEmpty(false)
                .onErrorResume(DataAccessException.class, e -> {
                    log.warn("Ping no Redis falhou: {}", e.getMessage());
                    return Mono.just(false);
                })
                .map(reachable -> new StoreHealth(BACKEND, location, configuredTtl, reachable, clock.instant()));
    }

    private String serialize(StoredRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException("Falha ao serializar registro da chave " + record.key(), e);
        }
    }

    private StoredRecord deserialize(String json) {
        try {
            return objectMapper.readValue(json, StoredRecord.class);
        } catch (JsonProcessingException e) {
            log.warn("Registro ilegível no Redis: {}", e.getOriginalMessage());
            throw new RecordSerializationException("Registro armazenado ilegível", e);
        }
    }

    private StoreUnavailableException unavailable(String redisKey, DataAccessException e) {
        log.warn("Redis indisponível ao acessar {}.", redisKey, e);
        return new StoreUnavailableException("Redis indisponível", e);
    }
}
