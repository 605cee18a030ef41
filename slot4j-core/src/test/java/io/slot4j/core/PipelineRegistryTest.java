package io.slot4j.core;

import io.slot4j.PipelineService;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PipelineRegistryTest {

    @Test
    void pipelinesShouldResolveById() {
        PipelineService video = pipeline("video");
        PipelineService shorts = pipeline("shorts");
        PipelineRegistry registry = new PipelineRegistry(List.of(video, shorts));

        assertSame(video, registry.getRequired("video"));
        assertEquals("shorts", registry.describe("shorts").pipelineId());
        assertEquals(2, registry.all().size());
    }

    @Test
    void unknownPipelineShouldThrowNotFound() {
        PipelineRegistry registry = new PipelineRegistry(List.of(pipeline("video")));

        NotFoundException ex = assertThrows(NotFoundException.class, () -> registry.getRequired("audio"));
        assertEquals("pipeline", ex.kind());
        assertEquals("audio", ex.id());
        assertThrows(NotFoundException.class, () -> registry.getRequired(null));
    }

    @Test
    void duplicateIdsShouldBeRejected() {
        assertThrows(IllegalStateException.class,
                () -> new PipelineRegistry(List.of(pipeline("video"), pipeline("video"))));
    }

    private static PipelineService pipeline(String id) {
        return new PipelineService() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public PipelineResult execute(Map<String, Object> config) {
                return PipelineResult.ok(Map.of());
            }
        };
    }
}
