package io.slot4j;

import io.slot4j.core.ScheduleConfig;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Poll loop that fires due {@link ScheduleConfig}s.
 */
public interface RecurrenceScheduler {

    record RecurrenceOptions(Duration checkInterval) {
        public static RecurrenceOptions defaults() {
            return new RecurrenceOptions(Duration.ofSeconds(60));
        }
    }

    void start();

    void stop();

    /**
     * Add or replace a config in the working set. A missing {@code nextRunAt} is computed from now.
     */
    ScheduleConfig register(ScheduleConfig config);

    /**
     * Deactivate without clearing {@code nextRunAt}.
     */
    boolean pause(String configId);

    /**
     * Reactivate and recompute {@code nextRunAt} from now.
     */
    boolean resume(String configId);

    /**
     * Drop from the working set. The stored config is kept.
     */
    boolean remove(String configId);

    Optional<ScheduleConfig> get(String configId);

    List<ScheduleConfig> getScheduleStatus();

    /**
     * Evaluate every active config once.
     *
     * @return number of configs fired
     */
    int tick();
}
