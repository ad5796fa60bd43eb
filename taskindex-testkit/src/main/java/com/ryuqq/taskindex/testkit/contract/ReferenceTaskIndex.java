package com.ryuqq.taskindex.testkit.contract;

import com.ryuqq.taskindex.core.model.IndexStatistics;
import com.ryuqq.taskindex.core.model.Task;
import com.ryuqq.taskindex.core.spi.TaskIndex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reference implementation of {@link TaskIndex} for Contract Tests and differential testing.
 *
 * <p>Backed by {@link TreeMap} with every method {@code synchronized}. It is deliberately
 * simple so that its answers can serve as the expected values when checking other
 * implementations.</p>
 *
 * <p><strong>Statistics:</strong> a {@link TreeMap} does not expose its shape, so
 * {@link #statistics()} reports {@code balanced=true} and the height of a perfectly
 * balanced tree holding the same number of keys.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ReferenceTaskIndex implements TaskIndex {

    private final TreeMap<Integer, Task> tasks = new TreeMap<>();

    @Override
    public synchronized void insert(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        tasks.put(task.getPriority(), task);
    }

    @Override
    public synchronized void insertAll(Collection<Task> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        for (Task task : batch) {
            if (task == null) {
                throw new IllegalArgumentException("tasks cannot contain null elements");
            }
        }
        for (Task task : batch) {
            tasks.put(task.getPriority(), task);
        }
    }

    @Override
    public synchronized Optional<Task> search(int priority) {
        return Optional.ofNullable(tasks.get(priority));
    }

    @Override
    public synchronized boolean contains(int priority) {
        return tasks.containsKey(priority);
    }

    @Override
    public synchronized Optional<Task> minimum() {
        Map.Entry<Integer, Task> entry = tasks.firstEntry();
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    @Override
    public synchronized Optional<Task> maximum() {
        Map.Entry<Integer, Task> entry = tasks.lastEntry();
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    @Override
    public synchronized List<Task> rangeQuery(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min must be <= max (min: " + min + ", max: " + max + ")");
        }
        return Collections.unmodifiableList(new ArrayList<>(tasks.subMap(min, true, max, true).values()));
    }

    @Override
    public synchronized List<Task> inOrderTraversal() {
        return Collections.unmodifiableList(new ArrayList<>(tasks.values()));
    }

    @Override
    public synchronized boolean delete(int priority) {
        return tasks.remove(priority) != null;
    }

    @Override
    public synchronized Optional<Task> pollMinimum() {
        Map.Entry<Integer, Task> entry = tasks.pollFirstEntry();
        return entry != null ? Optional.of(entry.getValue()) : Optional.empty();
    }

    @Override
    public synchronized void clear() {
        tasks.clear();
    }

    @Override
    public synchronized int size() {
        return tasks.size();
    }

    @Override
    public synchronized boolean isEmpty() {
        return tasks.isEmpty();
    }

    @Override
    public synchronized IndexStatistics statistics() {
        if (tasks.isEmpty()) {
            return IndexStatistics.empty();
        }
        int n = tasks.size();
        // ceil(log2(n + 1))
        int perfectHeight = 32 - Integer.numberOfLeadingZeros(n);
        return IndexStatistics.of(n, perfectHeight, true, tasks.firstKey(), tasks.lastKey());
    }
}
