package br.com.pvss.webhookreceiver.config;

import br.com.pvss.webhookreceiver.model.StoreShape;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Configuration
@Validated
@ConfigurationProperties(prefix = "webhook")
public class WebhookProperties {

    private BackendType backend = BackendType.REDIS;
    @NotBlank
    private String namespace = "tech4";
    private Duration ttl = Duration.ofDays(1);
    private Duration eventTtl = Duration.ofDays(1);
    @Min(1)
    private int maxHistory = 1000;
    @Valid
    private Profile open = new Profile("/webhooks/tech4/862001453668864/messages", List.of("to"), "unknown");
    @Valid
    private Profile sessions = new Profile("/webhooks/tech4", List.of("data.serviceId", "session_id", "id"), "default");

    @AssertTrue(message = "webhook.ttl e webhook.event-ttl devem ser de pelo menos 1 segundo")
    public boolean isTtlValid() {
        return ttl != null && eventTtl != null && ttl.toSeconds() >= 1 && eventTtl.toSeconds() >= 1;
    }

    public BackendType getBackend() {
        return backend;
    }

    public void setBackend(BackendType backend) {
        this.backend = backend;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getEventTtl() {
        return eventTtl;
    }

    public void setEventTtl(Duration eventTtl) {
        this.eventTtl = eventTtl;
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    public Profile getOpen() {
        return open;
    }

    public void setOpen(Profile open) {
        this.open = open;
    }

    public Profile getSessions() {
        return sessions;
    }

    public void setSessions(Profile sessions) {
        this.sessions = sessions;
    }

    public static class Profile {
        @NotBlank
        private String path;
        private StoreShape shape = StoreShape.LATEST;
        @NotEmpty
        private List<String> keyFields;
        @NotBlank
        private String fallbackKey;

        public Profile() {
        }

        Profile(String path, List<String> keyFields, String fallbackKey) {
            this.path = path;
            this.keyFields = keyFields;
            this.fallbackKey = fallbackKey;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public StoreShape getShape() {
            return shape;
        }

        public void setShape(StoreShape shape) {
            this.shape = shape;
        }

        public List<String> getKeyFields() {
            return keyFields;
        }

        public void setKeyFields(List<String> keyFields) {
            this.keyFields = keyFields;
        }

        public String getFallbackKey() {
            return fallbackKey;
        }

        public void setFallbackKey(String fallbackKey) {
            this.fallbackKey = fallbackKey;
        }
    }
}
