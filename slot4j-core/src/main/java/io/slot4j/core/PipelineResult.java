package io.slot4j.core;

import java.util.Map;

/**
 * Outcome of a {@link io.slot4j.PipelineService#execute(Map)} call.
 *
 * @param success  whether content was produced
 * @param artifact produced content handed to the publish stage (video path, title, tags, ...)
 * @param error    error text when {@code success} is false
 */
public record PipelineResult(
        boolean success,
        Map<String, Object> artifact,
        String error
) {
    public PipelineResult {
        artifact = artifact == null ? Map.of() : Map.copyOf(artifact);
    }

    public static PipelineResult ok(Map<String, Object> artifact) {
        return new PipelineResult(true, artifact, null);
    }

    public static PipelineResult failed(String error) {
        return new PipelineResult(false, Map.of(), error);
    }
}
