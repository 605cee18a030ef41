package io.slot4j.core;

/**
 * Publish stage status of an {@link ExecutionTask}.
 */
public enum PublishStatus {
    PENDING,
    SCHEDULED,
    PUBLISHING,
    PUBLISHED,
    FAILED,
    CANCELLED
}
