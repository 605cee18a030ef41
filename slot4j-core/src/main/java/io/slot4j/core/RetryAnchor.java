package io.slot4j.core;

/**
 * Point in time the retry delay of a failed task is measured from.
 */
public enum RetryAnchor {
    /** Delay counts from when the task first started producing. */
    STARTED_AT,
    /** Delay counts from the most recent failure. */
    FAILED_AT
}
