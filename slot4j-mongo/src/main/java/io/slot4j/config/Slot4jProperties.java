package io.slot4j.config;

import io.slot4j.RecurrenceScheduler.RecurrenceOptions;
import io.slot4j.SlotAllocator.AllocatorOptions;
import io.slot4j.TaskOrchestrator.OrchestratorOptions;
import io.slot4j.core.RetryAnchor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for slot allocation, recurrence polling and task orchestration.
 */
@ConfigurationProperties(prefix = "slot4j")
public class Slot4jProperties {
    private boolean enabled = true;
    private String zone; // null = system default
    private boolean ensureIndexesOnStartup = false;

    private final Slots slots = new Slots();
    private final Recurrence recurrence = new Recurrence();
    private final Orchestrator orchestrator = new Orchestrator();

    public ZoneId zoneId() {
        return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    public AllocatorOptions toAllocatorOptions() {
        return new AllocatorOptions(
                zoneId(),
                slots.getDefaultStartHour(),
                slots.getDefaultEndHour(),
                slots.getMinInterval(),
                slots.getJitter(),
                slots.isValidateTransitions(),
                slots.getLookAheadDays()
        );
    }

    public RecurrenceOptions toRecurrenceOptions() {
        return new RecurrenceOptions(recurrence.getCheckInterval());
    }

    public OrchestratorOptions toOrchestratorOptions() {
        return new OrchestratorOptions(
                orchestrator.getProcessEvery(),
                orchestrator.getProduceConcurrency(),
                orchestrator.getPublishConcurrency(),
                orchestrator.getMaxRetries(),
                orchestrator.getRetryDelay(),
                orchestrator.getRetryAnchor(),
                orchestrator.getLeadTime(),
                orchestrator.getTaskRetention(),
                orchestrator.getStageTimeout(),
                orchestrator.getErrorBackoff(),
                slots.getRetentionDays()
        );
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Slots getSlots() {
        return slots;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public static class Slots {
        private int defaultStartHour = 6;
        private int defaultEndHour = 24;
        private Duration minInterval = Duration.ofMinutes(30);
        private Duration jitter = Duration.ofMinutes(5);
        private boolean validateTransitions = true;
        private int lookAheadDays = 2;
        private int retentionDays = 30;

        public int getDefaultStartHour() {
            return defaultStartHour;
        }

        public void setDefaultStartHour(int defaultStartHour) {
            this.defaultStartHour = defaultStartHour;
        }

        public int getDefaultEndHour() {
            return defaultEndHour;
        }

        public void setDefaultEndHour(int defaultEndHour) {
            this.defaultEndHour = defaultEndHour;
        }

        public Duration getMinInterval() {
            return minInterval;
        }

        public void setMinInterval(Duration minInterval) {
            this.minInterval = minInterval;
        }

        public Duration getJitter() {
            return jitter;
        }

        public void setJitter(Duration jitter) {
            this.jitter = jitter;
        }

        public boolean isValidateTransitions() {
            return validateTransitions;
        }

        public void setValidateTransitions(boolean validateTransitions) {
            this.validateTransitions = validateTransitions;
        }

        public int getLookAheadDays() {
            return lookAheadDays;
        }

        public void setLookAheadDays(int lookAheadDays) {
            this.lookAheadDays = lookAheadDays;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }
    }

    public static class Recurrence {
        private Duration checkInterval = Duration.ofSeconds(60);

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }
    }

    public static class Orchestrator {
        private Duration processEvery = Duration.ofSeconds(60);
        private int produceConcurrency = 3;
        private int publishConcurrency = 5;
        private int maxRetries = 2;
        private Duration retryDelay = Duration.ofMinutes(30);
        private RetryAnchor retryAnchor = RetryAnchor.STARTED_AT;
        private Duration leadTime = Duration.ofMinutes(5);
        private Duration taskRetention = Duration.ofHours(24);
        private Duration stageTimeout = Duration.ofMinutes(30); // zero disables
        private Duration errorBackoff = Duration.ofSeconds(10);

        public Duration getProcessEvery() {
            return processEvery;
        }

        public void setProcessEvery(Duration processEvery) {
            this.processEvery = processEvery;
        }

        public int getProduceConcurrency() {
            return produceConcurrency;
        }

        public void setProduceConcurrency(int produceConcurrency) {
            this.produceConcurrency = produceConcurrency;
        }

        public int getPublishConcurrency() {
            return publishConcurrency;
        }

        public void setPublishConcurrency(int publishConcurrency) {
            this.publishConcurrency = publishConcurrency;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }

        public RetryAnchor getRetryAnchor() {
            return retryAnchor;
        }

        public void setRetryAnchor(RetryAnchor retryAnchor) {
            this.retryAnchor = retryAnchor;
        }

        public Duration getLeadTime() {
            return leadTime;
        }

        public void setLeadTime(Duration leadTime) {
            this.leadTime = leadTime;
        }

        public Duration getTaskRetention() {
            return taskRetention;
        }

        public void setTaskRetention(Duration taskRetention) {
            this.taskRetention = taskRetention;
        }

        public Duration getStageTimeout() {
            return stageTimeout;
        }

        public void setStageTimeout(Duration stageTimeout) {
            this.stageTimeout = stageTimeout;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }
    }
}
