package br.com.pvss.webhookreceiver.controller;

import br.com.pvss.webhookreceiver.config.WebhookProperties;
import br.com.pvss.webhookreceiver.dto.HealthResponse;
import br.com.pvss.webhookreceiver.dto.ServiceInfoResponse;
import br.com.pvss.webhookreceiver.repository.EventStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final EventStore store;
    private final WebhookProperties props;
    private final Clock clock;
    private final String serviceName;

    public HealthController(
            @Qualifier("openEventStore") EventStore store,
            WebhookProperties props,
            Clock clock,
            @Value("${spring.application.name:webhook-receiver}") String serviceName) {
        this.store = store;
        this.props = props;
        this.clock = clock;
        this.serviceName = serviceName;
    }

    @GetMapping("/")
    public ServiceInfoResponse home() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("POST " + props.getSessions().getPath(), "Recebe mensagens (CloudEvents)");
        endpoints.put("GET  /sessions/{session_id}/latest", "Última mensagem da sessão");
        endpoints.put("GET  /sessions/{session_id}/history", "Histórico retido da sessão");
        endpoints.put("DELETE /sessions/{session_id}", "Remove conversa");
        endpoints.put("GET  /sessions", "Lista sessões residentes (backend memory)");
        endpoints.put("POST " + props.getOpen().getPath(), "Webhook genérico, correlação por 'to'");
        endpoints.put("GET  /messages/{to}/latest", "Último payload recebido para 'to'");
        endpoints.put("GET  /messages/{to}/history", "Histórico retido para 'to'");
        endpoints.put("DELETE /messages/{to}", "Remove payloads de 'to'");
        endpoints.put("GET  /health", "Healthcheck");
        return new ServiceInfoResponse(serviceName, clock.instant(), endpoints);
    }

    @GetMapping("/health")
    public Mono<HealthResponse> health() {
        return store.health()
                .map(h -> new HealthResponse(
                        "up",
                        h.now(),
                        h.ttl().toSeconds(),
                        h.backend(),
                        h.backendReachable(),
                        h.location(),
                        props.getMaxHistory()));
    }
}
