package io.slot4j.internal;

import io.slot4j.ScheduleAction;
import io.slot4j.core.ScheduleConfig;
import io.slot4j.core.TimeSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link ScheduleAction}: plans slots for the occurrence that came due.
 */
public class SlotPlanningAction implements ScheduleAction {
    private static final Logger log = LoggerFactory.getLogger(SlotPlanningAction.class);

    private final SlotPlanner planner;

    public SlotPlanningAction(SlotPlanner planner) {
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
    }

    @Override
    public void fire(ScheduleConfig config, Instant firedAt) {
        Instant occurrence = config.getNextRunAt() != null ? config.getNextRunAt() : firedAt;
        List<TimeSlot> slots = planner.plan(config, occurrence);
        log.info("Occurrence planned configId={} occurrence={} newSlots={}", config.getConfigId(), occurrence, slots.size());
    }
}
