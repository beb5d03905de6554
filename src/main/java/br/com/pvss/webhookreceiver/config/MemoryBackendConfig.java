package br.com.pvss.webhookreceiver.config;

import br.com.pvss.webhookreceiver.repository.EventStore;
import br.com.pvss.webhookreceiver.repository.InMemoryEventStore;
import br.com.pvss.webhookreceiver.service.IdempotencyGate;
import br.com.pvss.webhookreceiver.service.InMemoryIdempotencyGate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(name = "webhook.backend", havingValue = "memory")
public class MemoryBackendConfig {

    @Bean
    @Qualifier("openEventStore")
    public EventStore openEventStore(WebhookProperties props, Clock clock) {
        return new InMemoryEventStore(props.getOpen().getShape(), props.getMaxHistory(), props.getTtl(), clock);
    }

    @Bean
    @Qualifier("sessionEventStore")
    public EventStore sessionEventStore(WebhookProperties props, Clock clock) {
        return new InMemoryEventStore(props.getSessions().getShape(), props.getMaxHistory(), props.getTtl(), clock);
    }

    @Bean
    public IdempotencyGate idempotencyGate(Clock clock) {
        return new InMemoryIdempotencyGate(clock);
    }
}
