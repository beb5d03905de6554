package br.com.pvss.webhookreceiver.service;

import br.com.pvss.webhookreceiver.dto.IngestionResult;
import br.com.pvss.webhookreceiver.model.StoreShape;
import br.com.pvss.webhookreceiver.model.StoredRecord;
import br.com.pvss.webhookreceiver.repository.InMemoryEventStore;
import br.com.pvss.webhookreceiver.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionPipelineTest {

    private static final Duration TTL = Duration.ofHours(1);

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T12:00:00Z"));

    @Nested
    @DisplayName("fluxo aberto")
    class Open {

        private InMemoryEventStore store;
        private IngestionPipeline pipeline;

        @BeforeEach
        void setUp() {
            store = new InMemoryEventStore(StoreShape.LATEST, 1000, TTL, clock);
            pipeline = IngestionPipeline.open(new CorrelationKeyDeriver(List.of("to"), "unknown"), store, TTL, clock);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"to\":\"555\",\"message\":{\"text\":\"hey\"}}",
                "{\"to\":\"5511999999999\",\"n\":1.5,\"flags\":[true,false,null],\"nested\":{\"a\":{\"b\":\"c\"}}}",
                "{\"to\":\"555\"}"
        })
        void payloadRoundTripsVerbatim(String json) throws Exception {
            JsonNode payload = mapper.readTree(json);
            String to = payload.get("to").asText();

            StepVerifier.create(pipeline.ingest(payload.deepCopy()))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(IngestionResult.STATUS_STORED);
                        assertThat(result.to()).isEqualTo(to);
                        assertThat(result.ttlSeconds()).isEqualTo(TTL.toSeconds());
                    })
                    .verifyComplete();

            StoredRecord stored = store.getLatest(to).block();
            assertThat(stored).isNotNull();
            assertThat(stored.payload()).isEqualTo(payload);
            assertThat(stored.receivedAt()).isEqualTo(clock.instant());
        }

        @Test
        void payloadWithoutToIsStoredUnderSentinel() throws Exception {
            JsonNode payload = mapper.readTree("{\"message\":{\"text\":\"sem destino\"}}");

            StepVerifier.create(pipeline.ingest(payload))
                    .assertNext(result -> assertThat(result.to()).isEqualTo("unknown"))
                    .verifyComplete();
            assertThat(store.getLatest("unknown").block().payload()).isEqualTo(payload);
        }

        @Test
        void nonObjectPayloadIsWrappedBeforeStoring() throws Exception {
            StepVerifier.create(pipeline.ingest(mapper.readTree("[1,2]")))
                    .assertNext(result -> assertThat(result.to()).isEqualTo("unknown"))
                    .verifyComplete();

            assertThat(store.getLatest("unknown").block().payload())
                    .isEqualTo(mapper.readTree("{\"payload\":[1,2]}"));
        }

        @Test
        void sameEventTwiceIsStoredTwiceWithoutDeduplication() throws Exception {
            JsonNode payload = mapper.readTree("{\"id\":\"e1\",\"to\":\"555\"}");
            InMemoryEventStore history = new InMemoryEventStore(StoreShape.HISTORY, 1000, TTL, clock);
            IngestionPipeline historyPipeline =
                    IngestionPipeline.open(new CorrelationKeyDeriver(List.of("to"), "unknown"), history, TTL, clock);

            historyPipeline.ingest(payload).block();
            historyPipeline.ingest(payload).block();

            assertThat(history.getAll("555").block()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("fluxo CloudEvents")
    class CloudEvents {

        private InMemoryEventStore store;
        private InMemoryIdempotencyGate gate;
        private IngestionPipeline pipeline;

        @BeforeEach
        void setUp() {
            store = new InMemoryEventStore(StoreShape.LATEST, 1000, TTL, clock);
            gate = new InMemoryIdempotencyGate(clock);
            pipeline = IngestionPipeline.cloudEvents(
                    new CorrelationKeyDeriver(List.of("data.serviceId", "session_id", "id"), "default"),
                    gate, store, TTL, Duration.ofMinutes(10), clock);
        }

        private ObjectNode event(String id, String type, String dataType, String serviceId, String text) {
            ObjectNode root = mapper.createObjectNode()
                    .put("specversion", "1.0")
                    .put("id", id)
                    .put("type", type)
                    .put("source", "amber")
                    .put("subject", "conversation")
                    .put("time", "2025-01-01T11:59:59Z")
                    .put("datacontenttype", "application/json");
            ObjectNode data = root.putObject("data")
                    .put("id", "m-" + id)
                    .put("type", dataType)
                    .put("createdAt", "2025-01-01T11:59:58Z")
                    .put("sentAt", "2025-01-01T11:59:59Z")
                    .put("by", "user")
                    .put("serviceId", serviceId);
            if (text != null) {
                data.put("text", text);
            }
            return root;
        }

        private ObjectNode message(String id, String serviceId, String text) {
            return event(id, IngestionPipeline.SUPPORTED_EVENT_TYPE, "text", serviceId, text);
        }

        @Test
        void textMessageIsStoredWithEnrichedFields() {
            ObjectNode event = message("e1", "svc1", "hi");

            StepVerifier.create(pipeline.ingest(event))
                    .assertNext(result -> {
                        assertThat(result.status()).isEqualTo(IngestionResult.STATUS_OK);
                        assertThat(result.serviceId()).isEqualTo("svc1");
                        assertThat(result.backend()).isEqualTo(InMemoryEventStore.BACKEND);
                    })
                    .verifyComplete();

            StoredRecord stored = store.getLatest("svc1").block();
            assertThat(stored.text()).isEqualTo("hi");
            assertThat(stored.eventId()).isEqualTo("e1");
            assertThat(stored.messageId()).isEqualTo("m-e1");
            assertThat(stored.serviceId()).isEqualTo("svc1");
            assertThat(stored.sentBy()).isEqualTo("user");
            assertThat(stored.createdAt()).isEqualTo("2025-01-01T11:59:58Z");
            assertThat(stored.sentAt()).isEqualTo("2025-01-01T11:59:59Z");
            assertThat(stored.payload()).isEqualTo(event);
        }

        @Test
        void missingTextIsStoredAsEmptyString() {
            pipeline.ingest(message("e1", "svc1", null)).block();

            assertThat(store.getLatest("svc1").block().text()).isEmpty();
        }

        @Test
        void duplicateEventIdIsIgnoredAndFirstRecordKept() {
            pipeline.ingest(message("e1", "svc1", "primeira")).block();

            StepVerifier.create(pipeline.ingest(message("e1", "svc1", "segunda")))
                    .assertNext(result -> {
                        assertThat(result.isIgnored()).isTrue();
                        assertThat(result.reason()).isEqualTo(IngestionPipeline.REASON_DUPLICATE_EVENT);
                    })
                    .verifyComplete();

            assertThat(store.getLatest("svc1").block().text()).isEqualTo("primeira");
        }

        @Test
        void duplicateIsDetectedEvenWhenItMapsToAnotherKey() {
            pipeline.ingest(message("e1", "svc1", "hi")).block();

            StepVerifier.create(pipeline.ingest(message("e1", "svc2", "hi")))
                    .assertNext(result -> assertThat(result.reason()).isEqualTo(IngestionPipeline.REASON_DUPLICATE_EVENT))
                    .verifyComplete();
            StepVerifier.create(store.getLatest("svc2")).verifyComplete();
        }

        @Test
        void eventIdIsAcceptedAgainAfterMarkExpires() {
            pipeline.ingest(message("e1", "svc1", "primeira")).block();
            clock.advance(Duration.ofMinutes(10));

            StepVerifier.create(pipeline.ingest(message("e1", "svc1", "segunda")))
                    .assertNext(result -> assertThat(result.status()).isEqualTo(IngestionResult.STATUS_OK))
                    .verifyComplete();
            assertThat(store.getLatest("svc1").block().text()).isEqualTo("segunda");
        }

        @Test
        void deletingRecordDoesNotClearIdempotencyMark() {
            pipeline.ingest(message("e1", "svc1", "hi")).block();
            store.delete("svc1").block();

            StepVerifier.create(pipeline.ingest(message("e1", "svc1", "hi")))
                    .assertNext(result -> assertThat(result.reason()).isEqualTo(IngestionPipeline.REASON_DUPLICATE_EVENT))
                    .verifyComplete();
        }

        @Test
        void unsupportedEventTypeIsIgnoredWithoutMarking() {
            StepVerifier.create(pipeline.ingest(event("e1", "amber.service:conversation:closed", "text", "svc1", "hi")))
                    .assertNext(result -> assertThat(result.reason()).isEqualTo(IngestionPipeline.REASON_UNSUPPORTED_TYPE))
                    .verifyComplete();

            StepVerifier.create(gate.seen("e1")).expectNext(false).verifyComplete();
            StepVerifier.create(store.getLatest("svc1")).verifyComplete();
        }

        @Test
        void nonTextDataIsIgnoredButItsEventIdIsConsumed() {
            StepVerifier.create(pipeline.ingest(event("e1", IngestionPipeline.SUPPORTED_EVENT_TYPE, "image", "svc1", null)))
                    .assertNext(result -> assertThat(result.reason()).isEqualTo(IngestionPipeline.REASON_UNSUPPORTED_DATA_TYPE))
                    .verifyComplete();

            StepVerifier.create(gate.seen("e1")).expectNext(true).verifyComplete();
            StepVerifier.create(store.getLatest("svc1")).verifyComplete();
        }

        @Test
        void emptyServiceIdFallsBackToEventId() {
            pipeline.ingest(message("e1", "", "hi")).block();

            assertThat(store.getLatest("e1").block().text()).isEqualTo("hi");
        }
    }
}
