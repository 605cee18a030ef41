package io.slot4j.internal.mongo;

import io.slot4j.core.RecurrenceKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

@Document(collection = "schedule_configs")
public class ScheduleConfigDocument {

    @Id
    private String id;

    private String groupId;
    private String pipelineId;
    private RecurrenceKind recurrenceKind;
    private Map<String, Object> recurrenceParams;
    private Map<String, Object> pipelineConfig;
    private int priority;
    private boolean active;
    private Instant lastRunAt;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private Instant createdAt;

    public ScheduleConfigDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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
        this.recurrenceParams = recurrenceParams;
    }

    public Map<String, Object> getPipelineConfig() {
        return pipelineConfig;
    }

    public void setPipelineConfig(Map<String, Object> pipelineConfig) {
        this.pipelineConfig = pipelineConfig;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
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
}
