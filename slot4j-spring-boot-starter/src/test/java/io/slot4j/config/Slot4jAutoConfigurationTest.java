package io.slot4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.AccountDirectory;
import io.slot4j.AlertSink;
import io.slot4j.PipelineService;
import io.slot4j.PublishService;
import io.slot4j.RecurrenceScheduler;
import io.slot4j.SlotAllocator;
import io.slot4j.TaskOrchestrator;
import io.slot4j.TaskOrchestrator.OrchestratorOptions;
import io.slot4j.core.PipelineRegistry;
import io.slot4j.core.PipelineResult;
import io.slot4j.core.PublishResult;
import io.slot4j.core.RetryAnchor;
import io.slot4j.core.spi.SlotStore;
import io.slot4j.internal.LoggingAlertSink;
import io.slot4j.internal.mongo.MongoSlotStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class Slot4jAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(Slot4jConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "slot4j.zone=UTC",
                    "slot4j.slots.retention-days=0",
                    "slot4j.orchestrator.process-every=500ms",
                    "slot4j.recurrence.check-interval=500ms"
            );

    @Test
    void shouldAutoConfigureSchedulersWhenCollaboratorsExist() {
        contextRunner
                .withBean(AccountDirectory.class, () -> groupId -> List.of("acc-1"))
                .withBean(PublishService.class, () -> (accountId, artifact) -> PublishResult.ok(Map.of()))
                .withBean(PipelineService.class, DemoPipeline::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(SlotAllocator.class);
                    assertThat(context).hasSingleBean(RecurrenceScheduler.class);
                    assertThat(context).hasSingleBean(TaskOrchestrator.class);
                    assertThat(context).hasSingleBean(Slot4jLifecycle.class);
                    assertThat(context).hasSingleBean(Slot4jProperties.class);
                    assertThat(context.getBean(SlotStore.class)).isInstanceOf(MongoSlotStore.class);
                    assertThat(context.getBean(AlertSink.class)).isInstanceOf(LoggingAlertSink.class);
                    assertThat(context.getBean(PipelineRegistry.class).getRequired("demo")).isInstanceOf(DemoPipeline.class);
                    assertThat(context.getBean(Slot4jLifecycle.class).isRunning()).isTrue();
                });
    }

    @Test
    void shouldOnlyConfigureAllocatorWithoutAccountDirectory() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(SlotAllocator.class);
            assertThat(context).hasSingleBean(Slot4jLifecycle.class);
            assertThat(context).doesNotHaveBean(RecurrenceScheduler.class);
            assertThat(context).doesNotHaveBean(TaskOrchestrator.class);
        });
    }

    @Test
    void shouldSkipOrchestratorWithoutPublisher() {
        contextRunner
                .withBean(AccountDirectory.class, () -> groupId -> List.of("acc-1"))
                .run(context -> {
                    assertThat(context).hasSingleBean(RecurrenceScheduler.class);
                    assertThat(context).doesNotHaveBean(TaskOrchestrator.class);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("slot4j.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(SlotAllocator.class));
    }

    @Test
    void userAlertSinkShouldReplaceDefault() {
        AlertSink custom = alert -> {
        };
        contextRunner
                .withBean(AlertSink.class, () -> custom)
                .run(context -> assertThat(context.getBean(AlertSink.class)).isSameAs(custom));
    }

    @Test
    void propertiesShouldBindIntoOptions() {
        contextRunner
                .withPropertyValues(
                        "slot4j.zone=Asia/Tokyo",
                        "slot4j.slots.jitter=0s",
                        "slot4j.slots.look-ahead-days=3",
                        "slot4j.slots.retention-days=7",
                        "slot4j.orchestrator.max-retries=5",
                        "slot4j.orchestrator.retry-delay=10m",
                        "slot4j.orchestrator.retry-anchor=failed-at",
                        "slot4j.orchestrator.stage-timeout=0s"
                )
                .run(context -> {
                    Slot4jProperties props = context.getBean(Slot4jProperties.class);
                    assertThat(props.zoneId()).isEqualTo(ZoneId.of("Asia/Tokyo"));
                    assertThat(props.toAllocatorOptions().jitter()).isEqualTo(Duration.ZERO);
                    assertThat(props.toAllocatorOptions().lookAheadDays()).isEqualTo(3);

                    OrchestratorOptions options = props.toOrchestratorOptions();
                    assertThat(options.maxRetries()).isEqualTo(5);
                    assertThat(options.retryDelay()).isEqualTo(Duration.ofMinutes(10));
                    assertThat(options.retryAnchor()).isEqualTo(RetryAnchor.FAILED_AT);
                    assertThat(options.stageTimeout()).isEqualTo(Duration.ZERO);
                    assertThat(options.slotRetentionDays()).isEqualTo(7);

                    assertThat(context.getBean(SlotAllocator.class).zone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
                });
    }

    static class DemoPipeline implements PipelineService {
        @Override
        public String id() {
            return "demo";
        }

        @Override
        public PipelineResult execute(Map<String, Object> config) {
            return PipelineResult.ok(Map.of("video", "demo.mp4"));
        }
    }
}
