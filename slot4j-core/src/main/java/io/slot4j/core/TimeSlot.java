package io.slot4j.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One concrete (account, date, minute) assignment belonging to a config.
 *
 * <p>Date, hour and minute are wall-clock values in the allocator's zone.
 */
public class TimeSlot {

    /**
     * Orders slots by (date, hour, minute).
     */
    public static final Comparator<TimeSlot> BY_TIME = Comparator
            .comparing(TimeSlot::getSlotDate)
            .thenComparingInt(TimeSlot::getSlotHour)
            .thenComparingInt(TimeSlot::getSlotMinute);

    private String slotId;
    private String configId;
    private String accountId;
    private LocalDate slotDate;
    private int slotHour;
    private int slotMinute;
    private int slotIndex;
    private SlotStatus status = SlotStatus.PENDING;
    private String taskId;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;

    public TimeSlot() {
    }

    public TimeSlot(String configId, String accountId, LocalDateTime at, int slotIndex) {
        this.configId = Objects.requireNonNull(configId, "configId must not be null");
        this.accountId = Objects.requireNonNull(accountId, "accountId must not be null");
        Objects.requireNonNull(at, "at must not be null");
        this.slotDate = at.toLocalDate();
        this.slotHour = at.getHour();
        this.slotMinute = at.getMinute();
        this.slotIndex = slotIndex;
    }

    public LocalDateTime localDateTime() {
        return LocalDateTime.of(slotDate, LocalTime.of(slotHour, slotMinute));
    }

    public Instant toInstant(ZoneId zone) {
        return localDateTime().atZone(zone).toInstant();
    }

    /**
     * Minutes since midnight of the slot date.
     */
    public int minuteOfDay() {
        return slotHour * 60 + slotMinute;
    }

    public boolean sameKey(TimeSlot other) {
        return other != null
                && Objects.equals(configId, other.configId)
                && Objects.equals(accountId, other.accountId)
                && Objects.equals(slotDate, other.slotDate)
                && slotHour == other.slotHour
                && slotMinute == other.slotMinute;
    }

    public TimeSlot copy() {
        TimeSlot c = new TimeSlot();
        c.slotId = slotId;
        c.configId = configId;
        c.accountId = accountId;
        c.slotDate = slotDate;
        c.slotHour = slotHour;
        c.slotMinute = slotMinute;
        c.slotIndex = slotIndex;
        c.status = status;
        c.taskId = taskId;
        c.metadata = metadata == null ? null : new LinkedHashMap<>(metadata);
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }

    public String getSlotId() {
        return slotId;
    }

    public void setSlotId(String slotId) {
        this.slotId = slotId;
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

    public LocalDate getSlotDate() {
        return slotDate;
    }

    public void setSlotDate(LocalDate slotDate) {
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

    @Override
    public String toString() {
        return "TimeSlot{slotId=" + slotId
                + ", configId=" + configId
                + ", accountId=" + accountId
                + ", at=" + (slotDate == null ? null : localDateTime())
                + ", index=" + slotIndex
                + ", status=" + status
                + ", taskId=" + taskId + '}';
    }
}
