package io.slot4j.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The unit the orchestrator drives through produce and publish.
 *
 * <p>{@code publishStatus} only leaves {@link PublishStatus#PENDING} once {@code pipelineStatus} is
 * {@link PipelineStatus#COMPLETED}.
 */
public class ExecutionTask {

    private String taskId;
    private String configId;
    private String groupId;
    private String accountId;
    private String pipelineId;
    private String slotId;
    private Map<String, Object> pipelineConfig;
    private PipelineStatus pipelineStatus = PipelineStatus.PENDING;
    private Map<String, Object> pipelineResult;
    private PublishStatus publishStatus = PublishStatus.PENDING;
    private Map<String, Object> publishResult;
    private int priority = Priority.NORMAL.value();
    private int retryCount;
    private String errorMessage;
    private Instant createdAt;
    private Instant scheduledAt;
    private Instant startedAt;
    private Instant failedAt;
    private Instant completedAt;

    public ExecutionTask() {
    }

    public boolean isCancelled() {
        return pipelineStatus == PipelineStatus.CANCELLED || publishStatus == PublishStatus.CANCELLED;
    }

    public boolean hasFailedStage() {
        return pipelineStatus == PipelineStatus.FAILED || publishStatus == PublishStatus.FAILED;
    }

    /**
     * Published, cancelled, or failed with no retry left.
     */
    public boolean isTerminal(int maxRetries) {
        return publishStatus == PublishStatus.PUBLISHED
                || isCancelled()
                || (hasFailedStage() && retryCount > maxRetries);
    }

    public ExecutionTask copy() {
        ExecutionTask c = new ExecutionTask();
        c.taskId = taskId;
        c.configId = configId;
        c.groupId = groupId;
        c.accountId = accountId;
        c.pipelineId = pipelineId;
        c.slotId = slotId;
        c.pipelineConfig = pipelineConfig == null ? null : new LinkedHashMap<>(pipelineConfig);
        c.pipelineStatus = pipelineStatus;
        c.pipelineResult = pipelineResult == null ? null : new LinkedHashMap<>(pipelineResult);
        c.publishStatus = publishStatus;
        c.publishResult = publishResult == null ? null : new LinkedHashMap<>(publishResult);
        c.priority = priority;
        c.retryCount = retryCount;
        c.errorMessage = errorMessage;
        c.createdAt = createdAt;
        c.scheduledAt = scheduledAt;
        c.startedAt = startedAt;
        c.failedAt = failedAt;
        c.completedAt = completedAt;
        return c;
    }

    public String getTaskId() {
        return taskId;
    }

    public void setTaskId(String taskId) {
        this.taskId = taskId;
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

    public String getAccountId() {
        return accountId;
    }

    public void setAccountId(String accountId) {
        this.accountId = accountId;
    }

    public String getPipelineId() {
        return pipelineId;
    }

    public void setPipelineId(String pipelineId) {
        this.pipelineId = pipelineId;
    }

    public String getSlotId() {
        return slotId;
    }

    public void setSlotId(String slotId) {
        this.slotId = slotId;
    }

    public Map<String, Object> getPipelineConfig() {
        return pipelineConfig;
    }

    public void setPipelineConfig(Map<String, Object> pipelineConfig) {
        this.pipelineConfig = pipelineConfig;
    }

    public PipelineStatus getPipelineStatus() {
        return pipelineStatus;
    }

    public void setPipelineStatus(PipelineStatus pipelineStatus) {
        this.pipelineStatus = pipelineStatus;
    }

    public Map<String, Object> getPipelineResult() {
        return pipelineResult;
    }

    public void setPipelineResult(Map<String, Object> pipelineResult) {
        this.pipelineResult = pipelineResult;
    }

    public PublishStatus getPublishStatus() {
        return publishStatus;
    }

    public void setPublishStatus(PublishStatus publishStatus) {
        this.publishStatus = publishStatus;
    }

    public Map<String, Object> getPublishResult() {
        return publishResult;
    }

    public void setPublishResult(Map<String, Object> publishResult) {
        this.publishResult = publishResult;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = Priority.clamp(priority);
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public void setScheduledAt(Instant scheduledAt) {
        this.scheduledAt = scheduledAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    @Override
    public String toString() {
        return "ExecutionTask{taskId=" + taskId
                + ", configId=" + configId
                + ", accountId=" + accountId
                + ", slotId=" + slotId
                + ", pipelineStatus=" + pipelineStatus
                + ", publishStatus=" + publishStatus
                + ", retryCount=" + retryCount + '}';
    }
}
