package io.slot4j;

import io.slot4j.core.ExecutionTask;
import io.slot4j.core.RetryAnchor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Turns due slots into {@link ExecutionTask}s and drives them through produce and publish.
 *
 * <p>Typical usage:
 * <pre>{@code
 * orchestrator.start();
 *
 * orchestrator.trigger("daily-stories", null);
 * orchestrator.getTaskStatus(taskId);
 * orchestrator.cancelTask(taskId);
 *
 * orchestrator.stop();
 * }</pre>
 */
public interface TaskOrchestrator {

    /**
     * Orchestration tuning.
     * <ul>
     *   <li>processEvery: control loop cadence</li>
     *   <li>produceConcurrency/publishConcurrency: worker pool sizes</li>
     *   <li>maxRetries/retryDelay/retryAnchor: retry sweep policy</li>
     *   <li>leadTime: how long before its nominal time a slot may be claimed</li>
     *   <li>taskRetention: how long finished tasks stay in the working set</li>
     *   <li>stageTimeout: ceiling for one produce/publish call; zero disables it</li>
     *   <li>errorBackoff: sleep after a failed tick</li>
     *   <li>slotRetentionDays: finished slots older than this are deleted once a day; zero or less disables it</li>
     * </ul>
     */
    record OrchestratorOptions(
            Duration processEvery,
            int produceConcurrency,
            int publishConcurrency,
            int maxRetries,
            Duration retryDelay,
            RetryAnchor retryAnchor,
            Duration leadTime,
            Duration taskRetention,
            Duration stageTimeout,
            Duration errorBackoff,
            int slotRetentionDays
    ) {
        public static OrchestratorOptions defaults() {
            return new OrchestratorOptions(
                    Duration.ofSeconds(60),
                    3,
                    5,
                    2,
                    Duration.ofMinutes(30),
                    RetryAnchor.STARTED_AT,
                    Duration.ofMinutes(5),
                    Duration.ofHours(24),
                    Duration.ofMinutes(30),
                    Duration.ofSeconds(10),
                    30
            );
        }
    }

    void start();

    void stop();

    /**
     * Run one control-loop pass synchronously.
     */
    void tick();

    /**
     * Create a task outside the slot cycle.
     *
     * @param accountId explicit account, or null to pick one through slot rotation
     * @return the created task
     */
    ExecutionTask trigger(String configId, String accountId);

    Optional<ExecutionTask> getTaskStatus(String taskId);

    /**
     * Cancel a task whose produce stage has not finished.
     *
     * @return false if the task is unknown or past the produce stage
     */
    boolean cancelTask(String taskId);

    List<ExecutionTask> listTasks();
}
