package io.slot4j.core;

import java.time.Instant;

/**
 * Failure notification raised by the orchestrator.
 */
public record Alert(
        String taskId,
        String accountId,
        String message,
        Instant timestamp
) {
}
