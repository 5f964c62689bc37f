package io.genoflow.core.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/// Per-run map of {@link TaskResult}s, one per task in the plan.
///
/// Reads are lock-free and may run concurrently with writes. Writes are
/// task-scoped: each task has its own lock, held only while its status moves
/// from one value to the next. Only the graph executor writes, through the
/// package-private transition methods.
///
/// @implNote Thread-safe.
public final class TaskResultStore {

    private final List<String> taskIds;
    private final Map<String, TaskResult> results = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    /// Creates a store with the given initial results.
    ///
    /// @param taskIds ids of all tasks in plan order, not null
    /// @param initial initial result per task id; tasks without one start pending
    TaskResultStore(List<String> taskIds, Map<String, TaskResult> initial) {
        this.taskIds = List.copyOf(taskIds);
        for (String id : this.taskIds) {
            TaskResult result = initial.get(id);
            results.put(id, result != null ? result : TaskResult.pending(id));
            locks.put(id, new Object());
        }
    }

    /// Returns the current result of a task.
    ///
    /// @param taskId task id, not null
    /// @return the result, or empty if the task is not part of this run
    public Optional<TaskResult> get(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return Optional.ofNullable(results.get(taskId));
    }

    public TaskStatus status(String taskId) {
        return require(taskId).status();
    }

    /// Returns the outputs of a succeeded task.
    ///
    /// @param taskId task id, not null
    /// @return outputs, or empty if the task has not succeeded
    public Optional<Map<String, Object>> outputsOf(String taskId) {
        return get(taskId).filter(TaskResult::isSucceeded).map(TaskResult::outputs);
    }

    /// Returns a point-in-time copy of all results in plan order.
    ///
    /// @return unmodifiable map keyed by task id, never null
    public Map<String, TaskResult> snapshot() {
        Map<String, TaskResult> copy = new LinkedHashMap<>();
        for (String id : taskIds) {
            copy.put(id, results.get(id));
        }
        return Collections.unmodifiableMap(copy);
    }

    public List<String> taskIds() {
        return taskIds;
    }

    /// Applies a transition when the task is in the expected status.
    ///
    /// @return the new result, or empty if the task was in another status
    /// @throws IllegalStateException if the transition itself is illegal
    Optional<TaskResult> transitionIf(
            String taskId, TaskStatus expected, UnaryOperator<TaskResult> transition) {
        synchronized (lockOf(taskId)) {
            TaskResult current = require(taskId);
            if (current.status() != expected) {
                return Optional.empty();
            }
            TaskResult next = transition.apply(current);
            results.put(taskId, next);
            return Optional.of(next);
        }
    }

    /// Applies a transition unconditionally.
    ///
    /// @throws IllegalStateException if the transition is illegal
    TaskResult transition(String taskId, UnaryOperator<TaskResult> transition) {
        synchronized (lockOf(taskId)) {
            TaskResult next = transition.apply(require(taskId));
            results.put(taskId, next);
            return next;
        }
    }

    private TaskResult require(String taskId) {
        TaskResult result = results.get(taskId);
        if (result == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return result;
    }

    private Object lockOf(String taskId) {
        Object lock = locks.get(taskId);
        if (lock == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return lock;
    }
}
