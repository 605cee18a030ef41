package io.slot4j.internal;

import io.slot4j.core.StageExecutionException.Stage;

import java.util.Map;

/**
 * Result of one produce/publish attempt, posted by a worker for the control loop to apply.
 *
 * @param token attempt token; outcomes whose token no longer matches the in-flight attempt are stale
 */
record StageOutcome(
        String taskId,
        Stage stage,
        long token,
        boolean success,
        Map<String, Object> result,
        String error
) {
    static StageOutcome succeeded(String taskId, Stage stage, long token, Map<String, Object> result) {
        return new StageOutcome(taskId, stage, token, true, result, null);
    }

    static StageOutcome failed(String taskId, Stage stage, long token, String error) {
        return new StageOutcome(taskId, stage, token, false, Map.of(), error);
    }
}
