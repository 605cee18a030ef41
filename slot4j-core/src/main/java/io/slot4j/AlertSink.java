package io.slot4j;

import io.slot4j.core.Alert;

/**
 * Fire-and-forget failure notification hook. Implementations may throw; callers log and move on.
 */
public interface AlertSink {
    void notify(Alert alert) throws Exception;
}
