package io.slot4j;

import io.slot4j.core.PipelineDescriptor;
import io.slot4j.core.PipelineResult;

import java.util.Map;

/**
 * Content production capability, registered once at startup under {@link #id()}.
 */
public interface PipelineService {
    String id();

    default PipelineDescriptor descriptor() {
        return PipelineDescriptor.of(id());
    }

    PipelineResult execute(Map<String, Object> config) throws Exception;
}
