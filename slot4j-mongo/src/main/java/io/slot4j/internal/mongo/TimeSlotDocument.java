package io.slot4j.internal.mongo;

import io.slot4j.core.SlotStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for time slots.
 *
 * <p>{@code slotDate} is an ISO date string and {@code slotTime} the sortable "yyyy-MM-ddTHH:mm" form of
 * (date, hour, minute); both compare lexicographically in time order.
 */
@Document(collection = "time_slots")
public class TimeSlotDocument {

    @Id
    private String id;

    private String configId;
    private String accountId;
    private String slotDate;
    private int slotHour;
    private int slotMinute;
    private String slotTime;
    private int slotIndex;
    private SlotStatus status;

    @Field(write = Field.Write.ALWAYS)
    private String taskId;

    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;

    public TimeSlotDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getConfigId() {
        return configId;
    }

    public void setConfigId(String configId) {
        this.configId = configId;
    }

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getSlotDate() {
        return slotDate;
    }

    public void setSlotDate(String slotDate) {
        this.slotDate = slotDate;
    }

    public int getSlotHour() {
        return slotHour;
    }

    public void setSlotHour(int slotHour) {
        this.slotHour = slotHour;
    }

    public int getSlotMinute() {
        return slotMinute;
    }

    public void setSlotMinute(int slotMinute) {
        this.slotMinute = slotMinute;
    }

    public String getSlotTime() {
        return slotTime;
    }

    public void setSlotTime(String slotTime) {
        this.slotTime = slotTime;
    }

    public int getSlotIndex() {
        return slotIndex;
    }

    public void setSlotIndex(int slotIndex) {
        this.slotIndex = slotIndex;
    }

    public SlotStatus getStatus() {
        return status;
    }

    public void setStatus(SlotStatus status) {
        this.status = status;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
