package br.com.pvss.webhookreceiver.config;

import br.com.pvss.webhookreceiver.repository.EventStore;
import br.com.pvss.webhookreceiver.repository.RedisEventStore;
import br.com.pvss.webhookreceiver.repository.RedisKeyLayout;
import br.com.pvss.webhookreceiver.service.IdempotencyGate;
import br.com.pvss.webhookreceiver.service.RedisIdempotencyGate;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.RedisURI;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(RedisProperties.class)
@ConditionalOnProperty(name = "webhook.backend", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties props) {
        var cfg = standaloneConfiguration(props);
        var builder = LettuceClientConfiguration.builder()
                .commandTimeout(props.getTimeout() != null ? props.getTimeout() : Duration.ofSeconds(2));
        if (usesSsl(props)) {
            builder.useSsl();
        }
        return new LettuceConnectionFactory(cfg, builder.build());
    }

    @Bean
    public ReactiveStringRedisTemplate reactiveStringRedisTemplate(ReactiveRedisConnectionFactory factory) {
        return new ReactiveStringRedisTemplate(factory);
    }

    @Bean
    @Qualifier("openEventStore")
    public EventStore openEventStore(ReactiveStringRedisTemplate redis, ObjectMapper objectMapper,
                                     WebhookProperties props, RedisProperties redisProps, Clock clock) {
        return new RedisEventStore(redis, objectMapper,
                new RedisKeyLayout(props.getNamespace(), RedisKeyLayout.TO_SEGMENT),
                describe(redisProps),
                props.getOpen().getShape(), props.getMaxHistory(), props.getTtl(), clock);
    }

    @Bean
    @Qualifier("sessionEventStore")
    public EventStore sessionEventStore(ReactiveStringRedisTemplate redis, ObjectMapper objectMapper,
                                        WebhookProperties props, RedisProperties redisProps, Clock clock) {
        return new RedisEventStore(redis, objectMapper,
                new RedisKeyLayout(props.getNamespace(), RedisKeyLayout.SESSION_SEGMENT),
                describe(redisProps),
                props.getSessions().getShape(), props.getMaxHistory(), props.getTtl(), clock);
    }

    @Bean
    public IdempotencyGate idempotencyGate(ReactiveStringRedisTemplate redis, WebhookProperties props, Clock clock) {
        return new RedisIdempotencyGate(redis, props.getNamespace(), clock);
    }

    static RedisStandaloneConfiguration standaloneConfiguration(RedisProperties props) {
        if (!hasUrl(props)) {
            var cfg = new RedisStandaloneConfiguration(props.getHost(), props.getPort());
            cfg.setDatabase(props.getDatabase());
            cfg.setUsername(props.getUsername());
            if (props.getPassword() != null) {
                cfg.setPassword(RedisPassword.of(props.getPassword()));
            }
            return cfg;
        }
        RedisURI uri = RedisURI.create(props.getUrl());
        var cfg = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        cfg.setDatabase(uri.getDatabase());
        cfg.setUsername(uri.getUsername());
        if (uri.getPassword() != null) {
            cfg.setPassword(RedisPassword.of(uri.getPassword()));
        }
        return cfg;
    }

    static boolean usesSsl(RedisProperties props) {
        return hasUrl(props) ? RedisURI.create(props.getUrl()).isSsl() : props.getSsl().isEnabled();
    }

    // sem usuário e senha
    static String describe(RedisProperties props) {
        var cfg = standaloneConfiguration(props);
        String scheme = usesSsl(props) ? "rediss://" : "redis://";
        return scheme + cfg.getHostName() + ":" + cfg.getPort() + "/" + cfg.getDatabase();
    }

    private static boolean hasUrl(RedisProperties props) {
        return props.getUrl() != null && !props.getUrl().isBlank();
    }
}
