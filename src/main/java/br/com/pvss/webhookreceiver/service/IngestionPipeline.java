package br.com.pvss.webhookreceiver.service;

import br.com.pvss.webhookreceiver.dto.IngestionResult;
import br.com.pvss.webhookreceiver.model.InboundPayload;
import br.com.pvss.webhookreceiver.model.StoredRecord;
import br.com.pvss.webhookreceiver.repository.EventStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    public static final String SUPPORTED_EVENT_TYPE = "amber.service:conversation:message";
    public static final String SUPPORTED_DATA_TYPE = "text";

    public static final String REASON_UNSUPPORTED_TYPE = "unsupported type";
    public static final String REASON_DUPLICATE_EVENT = "duplicate event";
    public static final String REASON_UNSUPPORTED_DATA_TYPE = "unsupported data.type";

    private final PipelineMode mode;
    private final CorrelationKeyDeriver deriver;
    private final IdempotencyGate gate;
    private final EventStore store;
    private final Duration ttl;
    private final Duration eventTtl;
    private final Clock clock;

    private IngestionPipeline(
            PipelineMode mode,
            CorrelationKeyDeriver deriver,
            IdempotencyGate gate,
            EventStore store,
            Duration ttl,
            Duration eventTtl,
            Clock clock) {
        this.mode = mode;
        this.deriver = Objects.requireNonNull(deriver, "deriver");
        this.gate = gate;
        this.store = Objects.requireNonNull(store, "store");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.eventTtl = eventTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static IngestionPipeline open(CorrelationKeyDeriver deriver, EventStore store, Duration ttl, Clock clock) {
        return new IngestionPipeline(PipelineMode.OPEN, deriver, null, store, ttl, null, clock);
    }

    public static IngestionPipeline cloudEvents(
            CorrelationKeyDeriver deriver,
            IdempotencyGate gate,
            EventStore store,
            Duration ttl,
            Duration eventTtl,
            Clock clock) {
        return new IngestionPipeline(PipelineMode.CLOUD_EVENTS, deriver,
                Objects.requireNonNull(gate, "gate"), store, ttl,
                Objects.requireNonNull(eventTtl, "eventTtl"), clock);
    }

    public Mono<IngestionResult> ingest(JsonNode payload) {
        ObjectNode body = InboundPayload.normalize(payload);
        return mode == PipelineMode.OPEN ? ingestOpen(body) : ingestCloudEvent(body);
    }

    private Mono<IngestionResult> ingestOpen(ObjectNode body) {
        String key = deriver.derive(body);
        StoredRecord record = StoredRecord.verbatim(key, clock.instant(), body);
        return store.put(key, record, ttl)
                .doOnSuccess(v -> log.info("chave: {}. Payload armazenado via {}.", key, store.backend()))
                .thenReturn(IngestionResult.storedTo(key, ttl.toSeconds()));
    }

    private Mono<IngestionResult> ingestCloudEvent(ObjectNode body) {
        String type = text(body, "type");
        if (!SUPPORTED_EVENT_TYPE.equals(type)) {
            log.debug("Evento ignorado, tipo não suportado: {}", type);
            return Mono.just(IngestionResult.ignored(REASON_UNSUPPORTED_TYPE));
        }

        String eventId = text(body, "id");
        // seen + mark não são atômicos: entregas concorrentes do mesmo id podem gravar duas vezes
        return gate.seen(eventId)
                .flatMap(seen -> {
                    if (seen) {
                        log.debug("eventId: {}. Evento duplicado ignorado.", eventId);
                        return Mono.just(IngestionResult.ignored(REASON_DUPLICATE_EVENT));
                    }
                    return gate.mark(eventId, eventTtl)
                            .then(Mono.defer(() -> storeMessage(body, eventId)));
                });
    }

    private Mono<IngestionResult> storeMessage(ObjectNode body, String eventId) {
        JsonNode data = body.path("data");
        String dataType = text(data, "type");
        if (!SUPPORTED_DATA_TYPE.equals(dataType)) {
            log.debug("eventId: {}. data.type não suportado: {}", eventId, dataType);
            return Mono.just(IngestionResult.ignored(REASON_UNSUPPORTED_DATA_TYPE));
        }

        String key = deriver.derive(body);
        String messageText = text(data, "text");
        StoredRecord record = new StoredRecord(
                key,
                clock.instant(),
                body,
                text(data, "serviceId"),
                eventId,
                text(data, "id"),
                messageText == null ? "" : messageText,
                text(data, "by"),
                text(data, "createdAt"),
                text(data, "sentAt"));

        return store.put(key, record, ttl)
                .doOnSuccess(v -> log.info("eventId: {}. Mensagem armazenada para a chave {} via {}.",
                        eventId, key, store.backend()))
                .thenReturn(IngestionResult.storedSession(store.backend(), key));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
