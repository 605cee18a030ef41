package io.slot4j.config;

import io.slot4j.RecurrenceScheduler;
import io.slot4j.TaskOrchestrator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler start/stop with the Spring container lifecycle.
 * The orchestrator starts first so it has reloaded its tasks before new occurrences fire, and stops last.
 */
public class Slot4jLifecycle implements SmartLifecycle {
    private final ObjectProvider<RecurrenceScheduler> recurrenceScheduler;
    private final ObjectProvider<TaskOrchestrator> orchestrator;
    private volatile boolean running = false;

    public Slot4jLifecycle(ObjectProvider<RecurrenceScheduler> recurrenceScheduler,
                           ObjectProvider<TaskOrchestrator> orchestrator) {
        this.recurrenceScheduler = recurrenceScheduler;
        this.orchestrator = orchestrator;
    }

    @Override
    public void start() {
        orchestrator.ifAvailable(TaskOrchestrator::start);
        recurrenceScheduler.ifAvailable(RecurrenceScheduler::start);
        running = true;
    }

    @Override
    public void stop() {
        recurrenceScheduler.ifAvailable(RecurrenceScheduler::stop);
        orchestrator.ifAvailable(TaskOrchestrator::stop);
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
