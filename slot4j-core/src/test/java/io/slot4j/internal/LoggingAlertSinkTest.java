package io.slot4j.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.core.Alert;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LoggingAlertSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void alertShouldRenderAsTaskFailureDocument() throws Exception {
        LoggingAlertSink sink = new LoggingAlertSink(objectMapper);
        Alert alert = new Alert("task_1a2b3c4d", "acc-1", "Publish failed: quota", Instant.parse("2026-03-10T06:00:00Z"));

        JsonNode json = objectMapper.readTree(sink.toJson(alert));

        assertEquals("task_failure", json.get("type").asText());
        assertEquals("task_1a2b3c4d", json.get("task_id").asText());
        assertEquals("acc-1", json.get("account_id").asText());
        assertEquals("Publish failed: quota", json.get("message").asText());
        assertEquals("2026-03-10T06:00:00Z", json.get("timestamp").asText());
        assertDoesNotThrow(() -> sink.notify(alert));
    }
}
