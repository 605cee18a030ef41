package io.slot4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.slot4j.AccountDirectory;
import io.slot4j.AlertSink;
import io.slot4j.PipelineService;
import io.slot4j.PublishService;
import io.slot4j.RecurrenceScheduler;
import io.slot4j.ScheduleAction;
import io.slot4j.SlotAllocator;
import io.slot4j.TaskOrchestrator;
import io.slot4j.core.PipelineRegistry;
import io.slot4j.core.spi.ScheduleConfigStore;
import io.slot4j.core.spi.SlotStore;
import io.slot4j.core.spi.TaskStore;
import io.slot4j.internal.DefaultRecurrenceScheduler;
import io.slot4j.internal.DefaultSlotAllocator;
import io.slot4j.internal.DefaultTaskOrchestrator;
import io.slot4j.internal.LoggingAlertSink;
import io.slot4j.internal.RecurrenceCalculator;
import io.slot4j.internal.SlotPlanner;
import io.slot4j.internal.SlotPlanningAction;
import io.slot4j.internal.mongo.MongoScheduleConfigStore;
import io.slot4j.internal.mongo.MongoSlotStore;
import io.slot4j.internal.mongo.MongoTaskStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Spring Boot auto-configuration entrypoint for slot4j components.
 *
 * <p>The application supplies {@link AccountDirectory} and {@link PublishService} beans, plus any number of
 * {@link PipelineService}s. Schedulers are only created once those collaborators exist.
 */
@AutoConfiguration
@ConditionalOnClass({SlotAllocator.class, MongoTemplate.class})
@EnableConfigurationProperties(Slot4jProperties.class)
@ConditionalOnProperty(prefix = "slot4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Slot4jConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock slot4jClock(Slot4jProperties props) {
        return Clock.system(props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public SlotStore slotStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoSlotStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoTaskStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleConfigStore scheduleConfigStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoScheduleConfigStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected Slot4jMongoIndexConfig slot4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new Slot4jMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineRegistry pipelineRegistry(ObjectProvider<List<PipelineService>> pipelinesProvider) {
        List<PipelineService> pipelines = pipelinesProvider.getIfAvailable(List::of);
        return new PipelineRegistry(pipelines);
    }

    @Bean
    @ConditionalOnMissingBean
    public SlotAllocator slotAllocator(SlotStore slotStore, Slot4jProperties props, Clock clock) {
        return new DefaultSlotAllocator(slotStore, props.toAllocatorOptions(), clock, new Random());
    }

    @Bean
    @ConditionalOnMissingBean
    public RecurrenceCalculator recurrenceCalculator(Slot4jProperties props, ObjectMapper objectMapper) {
        return new RecurrenceCalculator(props.zoneId(), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertSink alertSink(ObjectMapper objectMapper) {
        return new LoggingAlertSink(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(AccountDirectory.class)
    public SlotPlanner slotPlanner(SlotAllocator allocator,
                                   SlotStore slotStore,
                                   ScheduleConfigStore configStore,
                                   AccountDirectory accounts,
                                   ObjectMapper objectMapper,
                                   Slot4jProperties props) {
        return new SlotPlanner(allocator, slotStore, configStore, accounts, objectMapper,
                props.getSlots().getLookAheadDays());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(AccountDirectory.class)
    public ScheduleAction scheduleAction(SlotPlanner planner) {
        return new SlotPlanningAction(planner);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(AccountDirectory.class)
    public RecurrenceScheduler recurrenceScheduler(ScheduleConfigStore configStore,
                                                   RecurrenceCalculator calculator,
                                                   ScheduleAction action,
                                                   Slot4jProperties props,
                                                   Clock clock) {
        return new DefaultRecurrenceScheduler(configStore, calculator, action, props.toRecurrenceOptions(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({AccountDirectory.class, PublishService.class})
    public TaskOrchestrator taskOrchestrator(ScheduleConfigStore configStore,
                                             SlotAllocator allocator,
                                             TaskStore taskStore,
                                             PipelineRegistry pipelines,
                                             PublishService publisher,
                                             AccountDirectory accounts,
                                             AlertSink alertSink,
                                             Slot4jProperties props,
                                             Clock clock) {
        return new DefaultTaskOrchestrator(configStore, allocator, taskStore, pipelines, publisher, accounts,
                alertSink, props.toOrchestratorOptions(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Slot4jLifecycle slot4jLifecycle(ObjectProvider<RecurrenceScheduler> recurrenceScheduler,
                                           ObjectProvider<TaskOrchestrator> orchestrator) {
        return new Slot4jLifecycle(recurrenceScheduler, orchestrator);
    }

    @Bean
    @ConditionalOnProperty(prefix = "slot4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton slot4jIndexesInitializer(Slot4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
