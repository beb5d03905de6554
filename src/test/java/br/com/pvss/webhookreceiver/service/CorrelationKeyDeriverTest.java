package br.com.pvss.webhookreceiver.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrelationKeyDeriverTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private final CorrelationKeyDeriver structured =
            new CorrelationKeyDeriver(List.of("data.serviceId", "session_id", "id"), "default");
    private final CorrelationKeyDeriver open =
            new CorrelationKeyDeriver(List.of("to"), "unknown");

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"id\":\"e1\",\"session_id\":\"s1\",\"data\":{\"serviceId\":\"svc1\"}} | svc1",
            "{\"id\":\"e1\",\"session_id\":\"s1\",\"data\":{\"serviceId\":\"\"}}     | s1",
            "{\"id\":\"e1\",\"data\":{}}                                            | e1",
            "{\"id\":\"e1\",\"data\":\"nao-e-objeto\"}                              | e1",
            "{\"data\":{\"serviceId\":null}}                                        | default",
            "{}                                                                     | default"
    })
    void structuredRuleFollowsPriorityOrder(String json, String expected) throws Exception {
        assertThat(structured.derive(mapper.readTree(json))).isEqualTo(expected);
    }

    @Test
    void openRuleUsesToField() throws Exception {
        assertThat(open.derive(mapper.readTree("{\"to\":\"5511999999999\",\"message\":{\"text\":\"Ola!\"}}")))
                .isEqualTo("5511999999999");
    }

    @Test
    void numericToIsAccepted() throws Exception {
        assertThat(open.derive(mapper.readTree("{\"to\":5511999999999}"))).isEqualTo("5511999999999");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"to\":\"\"}",
            "{\"to\":null}",
            "{\"to\":{\"nested\":\"x\"}}",
            "{\"to\":[\"555\"]}",
            "{\"message\":\"sem destino\"}",
            "[\"555\"]",
            "\"555\""
    })
    void missingOrUnusableKeyFallsBackToSentinel(String json) throws Exception {
        assertThat(open.derive(mapper.readTree(json))).isEqualTo("unknown");
    }

    @Test
    void wrappedScalarCanStillBeResolvedThroughPayloadField() throws Exception {
        CorrelationKeyDeriver byPayload = new CorrelationKeyDeriver(List.of("payload"), "unknown");

        assertThat(byPayload.derive(mapper.readTree("\"abc\""))).isEqualTo("abc");
    }

    @Test
    void emptyFallbackIsRejected() {
        assertThatThrownBy(() -> new CorrelationKeyDeriver(List.of("to"), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
