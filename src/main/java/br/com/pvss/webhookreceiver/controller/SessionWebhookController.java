package br.com.pvss.webhookreceiver.controller;

import br.com.pvss.webhookreceiver.dto.CloudEventMessage;
import br.com.pvss.webhookreceiver.dto.DeleteResponse;
import br.com.pvss.webhookreceiver.dto.IngestionResult;
import br.com.pvss.webhookreceiver.dto.SessionListResponse;
import br.com.pvss.webhookreceiver.exception.RecordNotFoundException;
import br.com.pvss.webhookreceiver.model.StoredRecord;
import br.com.pvss.webhookreceiver.service.CorrelationQueryService;
import br.com.pvss.webhookreceiver.service.IngestionPipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
public class SessionWebhookController {

    private final IngestionPipeline pipeline;
    private final CorrelationQueryService queries;
    private final ObjectMapper objectMapper;

    public SessionWebhookController(
            @Qualifier("sessionPipeline") IngestionPipeline pipeline,
            @Qualifier("sessionQueries") CorrelationQueryService queries,
            ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.queries = queries;
        this.objectMapper = objectMapper;
    }

    @PostMapping("${webhook.sessions.path}")
    public Mono<IngestionResult> receive(@RequestBody @Valid CloudEventMessage event) {
        return pipeline.ingest(objectMapper.valueToTree(event));
    }

    @GetMapping("/sessions/{sessionId}/latest")
    public Mono<StoredRecord> latest(@PathVariable String sessionId) {
        return queries.getLatest(sessionId)
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("No messages found for this serviceId")));
    }

    @GetMapping("/sessions/{sessionId}/history")
    public Mono<List<StoredRecord>> history(@PathVariable String sessionId) {
        return queries.getAll(sessionId)
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("No messages found for this serviceId")));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public Mono<DeleteResponse> delete(@PathVariable String sessionId) {
        return queries.delete(sessionId)
                .map(deleted -> DeleteResponse.ofSession(queries.backend(), sessionId))
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("serviceId not found")));
    }

    @GetMapping("/sessions")
    public Mono<SessionListResponse> list(@RequestParam(defaultValue = "50") int limit) {
        return queries.list(limit)
                .map(keys -> new SessionListResponse(keys.size(), keys));
    }
}
