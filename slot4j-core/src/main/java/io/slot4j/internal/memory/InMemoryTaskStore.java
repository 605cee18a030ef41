package io.slot4j.internal.memory;

import io.slot4j.core.ExecutionTask;
import io.slot4j.core.spi.TaskStore;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed {@link TaskStore}; stores and returns copies.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<String, ExecutionTask> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(ExecutionTask task) {
        Objects.requireNonNull(task.getTaskId(), "taskId must not be null");
        tasks.put(task.getTaskId(), task.copy());
    }

    @Override
    public Optional<ExecutionTask> findById(String taskId) {
        ExecutionTask t = tasks.get(taskId);
        return t == null ? Optional.empty() : Optional.of(t.copy());
    }

    @Override
    public List<ExecutionTask> findUnfinished() {
        return tasks.values().stream()
                .filter(t -> t.getCompletedAt() == null)
                .sorted(Comparator.comparing(ExecutionTask::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(ExecutionTask::copy)
                .toList();
    }
}
