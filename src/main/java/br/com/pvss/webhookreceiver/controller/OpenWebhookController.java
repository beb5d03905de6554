package br.com.pvss.webhookreceiver.controller;

import br.com.pvss.webhookreceiver.dto.DeleteResponse;
import br.com.pvss.webhookreceiver.dto.IngestionResult;
import br.com.pvss.webhookreceiver.exception.RecordNotFoundException;
import br.com.pvss.webhookreceiver.model.StoredRecord;
import br.com.pvss.webhookreceiver.service.CorrelationQueryService;
import br.com.pvss.webhookreceiver.service.IngestionPipeline;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
public class OpenWebhookController {

    private final IngestionPipeline pipeline;
    private final CorrelationQueryService queries;

    public OpenWebhookController(
            @Qualifier("openPipeline") IngestionPipeline pipeline,
            @Qualifier("openQueries") CorrelationQueryService queries) {
        this.pipeline = pipeline;
        this.queries = queries;
    }

    @PostMapping("${webhook.open.path}")
    public Mono<IngestionResult> receive(@RequestBody JsonNode payload) {
        return pipeline.ingest(payload);
    }

    @GetMapping("/messages/{to}/latest")
    public Mono<JsonNode> latest(@PathVariable String to) {
        return queries.getLatest(to)
                .map(StoredRecord::payload)
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("No payload found for this 'to'")));
    }

    @GetMapping("/messages/{to}/history")
    public Mono<List<StoredRecord>> history(@PathVariable String to) {
        return queries.getAll(to)
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("No payload found for this 'to'")));
    }

    @DeleteMapping("/messages/{to}")
    public Mono<DeleteResponse> delete(@PathVariable String to) {
        return queries.delete(to)
                .map(deleted -> DeleteResponse.ofTo(queries.backend(), to))
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException("'to' not found")));
    }
}
