package io.slot4j.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted recurrence rule plus the account group and pipeline it drives.
 *
 * <p>{@code nextRunAt} is null only when the config is inactive, or it is a {@link RecurrenceKind#ONCE}
 * config that has already fired.
 */
public class ScheduleConfig {

    private String configId;
    private String groupId;
    private String pipelineId;
    private RecurrenceKind recurrenceKind;
    private Map<String, Object> recurrenceParams = new LinkedHashMap<>();
    private Map<String, Object> pipelineConfig = new LinkedHashMap<>();
    private int priority = Priority.NORMAL.value();
    private boolean active = true;
    private Instant lastRunAt;
    private Instant nextRunAt;
    private Instant createdAt;

    public ScheduleConfig() {
    }

    public ScheduleConfig(String configId, RecurrenceKind recurrenceKind, Map<String, Object> recurrenceParams) {
        this.configId = Objects.requireNonNull(configId, "configId must not be null");
        this.recurrenceKind = Objects.requireNonNull(recurrenceKind, "recurrenceKind must not be null");
        setRecurrenceParams(recurrenceParams);
    }

    public ScheduleConfig copy() {
        ScheduleConfig c = new ScheduleConfig();
        c.configId = configId;
        c.groupId = groupId;
        c.pipelineId = pipelineId;
        c.recurrenceKind = recurrenceKind;
        c.recurrenceParams = new LinkedHashMap<>(recurrenceParams);
        c.pipelineConfig = new LinkedHashMap<>(pipelineConfig);
        c.priority = priority;
        c.active = active;
        c.lastRunAt = lastRunAt;
        c.nextRunAt = nextRunAt;
        c.createdAt = createdAt;
        return c;
    }

    public String getConfigId() {
        return configId;
    }

    public void setConfigId(String configId) {
        this.configId = configId;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public void setPipelineId(String pipelineId) {
        this.pipelineId = pipelineId;
    }

    public RecurrenceKind getRecurrenceKind() {
        return recurrenceKind;
    }

    public void setRecurrenceKind(RecurrenceKind recurrenceKind) {
        this.recurrenceKind = recurrenceKind;
    }

    public Map<String, Object> getRecurrenceParams() {
        return recurrenceParams;
    }

    public void setRecurrenceParams(Map<String, Object> recurrenceParams) {
        this.recurrenceParams = recurrenceParams == null ? new LinkedHashMap<>() : new LinkedHashMap<>(recurrenceParams);
    }

    public Map<String, Object> getPipelineConfig() {
        return pipelineConfig;
    }

    public void setPipelineConfig(Map<String, Object> pipelineConfig) {
        this.pipelineConfig = pipelineConfig == null ? new LinkedHashMap<>() : new LinkedHashMap<>(pipelineConfig);
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = Priority.clamp(priority);
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "ScheduleConfig{configId=" + configId
                + ", kind=" + recurrenceKind
                + ", active=" + active
                + ", lastRunAt=" + lastRunAt
                + ", nextRunAt=" + nextRunAt + '}';
    }
}
