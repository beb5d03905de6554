package br.com.pvss.webhookreceiver.config;

import br.com.pvss.webhookreceiver.dto.*;
import br.com.pvss.webhookreceiver.model.StoredRecord;
import org.springframework.aot.hint.annotation.RegisterReflectionForBinding;
import org.springframework.context.annotation.Configuration;

@Configuration
@RegisterReflectionForBinding({
        CloudEventMessage.class,
        MessageData.class,
        DeleteResponse.class,
        ErrorResponse.class,
        HealthResponse.class,
        IngestionResult.class,
        ServiceInfoResponse.class,
        SessionListResponse.class,
        StoredRecord.class
})
public class JacksonConfig {
}
