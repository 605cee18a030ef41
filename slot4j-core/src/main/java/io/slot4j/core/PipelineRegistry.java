package io.slot4j.core;

import io.slot4j.PipelineService;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pipelines keyed by id, fixed at startup.
 */
public class PipelineRegistry {

    private final Map<String, PipelineService> pipelinesById;

    public PipelineRegistry(List<PipelineService> pipelines) {
        this.pipelinesById = pipelines.stream()
                .collect(Collectors.toUnmodifiableMap(
                        PipelineService::id,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate PipelineService id: " + a.id());
                        }
                ));
    }

    /**
     * @throws NotFoundException if no pipeline is registered under {@code pipelineId}
     */
    public PipelineService getRequired(String pipelineId) {
        PipelineService pipeline = pipelineId == null ? null : pipelinesById.get(pipelineId);
        if (pipeline == null) {
            throw new NotFoundException("pipeline", pipelineId);
        }
        return pipeline;
    }

    public PipelineDescriptor describe(String pipelineId) {
        return getRequired(pipelineId).descriptor();
    }

    public Collection<PipelineService> all() {
        return pipelinesById.values();
    }
}
