package io.slot4j;

import io.slot4j.core.ScheduleConfig;

import java.time.Instant;

/**
 * Work invoked by the {@link RecurrenceScheduler} when a config comes due.
 */
@FunctionalInterface
public interface ScheduleAction {
    void fire(ScheduleConfig config, Instant firedAt) throws Exception;
}
