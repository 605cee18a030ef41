package io.slot4j.core.spi;

import io.slot4j.core.ExecutionTask;

import java.util.List;
import java.util.Optional;

/**
 * Durable history of {@link ExecutionTask}s.
 */
public interface TaskStore {

    /**
     * Insert or replace by {@code taskId}.
     */
    void save(ExecutionTask task);

    Optional<ExecutionTask> findById(String taskId);

    /**
     * Tasks without {@code completedAt}, used to rebuild the working set after a restart.
     */
    List<ExecutionTask> findUnfinished();
}
