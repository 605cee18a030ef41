package io.slot4j.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.AlertSink;
import io.slot4j.core.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Writes alerts to the log as one JSON document at ERROR.
 */
public class LoggingAlertSink implements AlertSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSink.class);

    private final ObjectMapper objectMapper;

    public LoggingAlertSink(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void notify(Alert alert) throws JsonProcessingException {
        log.error("slot4j alert {}", toJson(alert));
    }

    String toJson(Alert alert) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "task_failure");
        body.put("task_id", alert.taskId());
        body.put("account_id", alert.accountId());
        body.put("message", alert.message());
        body.put("timestamp", alert.timestamp() == null ? null : alert.timestamp().toString());
        return objectMapper.writeValueAsString(body);
    }
}
