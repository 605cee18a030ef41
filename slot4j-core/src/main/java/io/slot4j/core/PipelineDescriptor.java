package io.slot4j.core;

import java.util.List;

/**
 * Registry metadata of a pipeline implementation.
 */
public record PipelineDescriptor(
        String pipelineId,
        String name,
        String type,
        String version,
        List<String> supportedPlatforms
) {
    public PipelineDescriptor {
        supportedPlatforms = supportedPlatforms == null ? List.of() : List.copyOf(supportedPlatforms);
    }

    public static PipelineDescriptor of(String pipelineId) {
        return new PipelineDescriptor(pipelineId, pipelineId, "generic", "1.0.0", List.of());
    }
}
