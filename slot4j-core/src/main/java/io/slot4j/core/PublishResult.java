package io.slot4j.core;

import java.util.Map;

/**
 * Outcome of a {@link io.slot4j.PublishService#publish(String, Map)} call.
 */
public record PublishResult(
        boolean success,
        Map<String, Object> result,
        String error
) {
    public PublishResult {
        result = result == null ? Map.of() : Map.copyOf(result);
    }

    public static PublishResult ok(Map<String, Object> result) {
        return new PublishResult(true, result, null);
    }

    public static PublishResult failed(String error) {
        return new PublishResult(false, Map.of(), error);
    }
}
