package br.com.pvss.webhookreceiver.config;

import br.com.pvss.webhookreceiver.repository.EventStore;
import br.com.pvss.webhookreceiver.service.CorrelationKeyDeriver;
import br.com.pvss.webhookreceiver.service.CorrelationQueryService;
import br.com.pvss.webhookreceiver.service.IdempotencyGate;
import br.com.pvss.webhookreceiver.service.IngestionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Qualifier("openPipeline")
    public IngestionPipeline openPipeline(WebhookProperties props,
                                          @Qualifier("openEventStore") EventStore store,
                                          Clock clock) {
        var profile = props.getOpen();
        log.info("Fluxo aberto em {} (backend {}, formato {}, ttl {}s).",
                profile.getPath(), props.getBackend(), profile.getShape(), props.getTtl().toSeconds());
        return IngestionPipeline.open(
                new CorrelationKeyDeriver(profile.getKeyFields(), profile.getFallbackKey()),
                store, props.getTtl(), clock);
    }

    @Bean
    @Qualifier("sessionPipeline")
    public IngestionPipeline sessionPipeline(WebhookProperties props,
                                             @Qualifier("sessionEventStore") EventStore store,
                                             IdempotencyGate gate,
                                             Clock clock) {
        var profile = props.getSessions();
        log.info("Fluxo CloudEvents em {} (backend {}, formato {}, ttl {}s).",
                profile.getPath(), props.getBackend(), profile.getShape(), props.getTtl().toSeconds());
        return IngestionPipeline.cloudEvents(
                new CorrelationKeyDeriver(profile.getKeyFields(), profile.getFallbackKey()),
                gate, store, props.getTtl(), props.getEventTtl(), clock);
    }

    @Bean
    @Qualifier("openQueries")
    public CorrelationQueryService openQueries(@Qualifier("openEventStore") EventStore store) {
        return new CorrelationQueryService(store);
    }

    @Bean
    @Qualifier("sessionQueries")
    public CorrelationQueryService sessionQueries(@Qualifier("sessionEventStore") EventStore store) {
        return new CorrelationQueryService(store);
    }
}
