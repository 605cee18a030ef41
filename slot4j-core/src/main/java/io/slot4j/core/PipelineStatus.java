package io.slot4j.core;

/**
 * Produce stage status of an {@link ExecutionTask}.
 */
public enum PipelineStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
