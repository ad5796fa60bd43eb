package com.ryuqq.taskindex.core.spi;

import com.ryuqq.taskindex.core.model.IndexStatistics;
import com.ryuqq.taskindex.core.model.Task;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Priority-ordered Task Index SPI.
 *
 * <p>This interface abstracts the ordered index used by the task-assignment path
 * to store pending {@link Task}s keyed by {@link Task#getPriority()}.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Insert / overwrite by priority key</li>
 *   <li>Exact-key lookup, minimum / maximum</li>
 *   <li>Inclusive range scans and full ordered traversal</li>
 *   <li>Removal by key, atomic removal of the minimum</li>
 *   <li>Diagnostic statistics</li>
 * </ul>
 *
 * <p><strong>Key Semantics:</strong></p>
 * <ul>
 *   <li>Keys are unique: inserting a task whose priority already exists
 *       replaces the stored task (last-write-wins)</li>
 *   <li>Ordering is plain ascending integer order</li>
 *   <li>Absence is a normal result ({@link Optional#empty()} / {@code false}), never an exception</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods callable from multiple threads</li>
 *   <li>Atomic: no caller may observe a partially applied mutation</li>
 *   <li>Argument validation happens before any mutation</li>
 *   <li>Returned lists are snapshots; later mutations do not affect them</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskIndex {

    /**
     * Inserts a task, replacing any task stored under the same priority.
     *
     * @param task the task to insert
     * @throws IllegalArgumentException if task is null
     */
    void insert(Task task);

    /**
     * Inserts all tasks as one atomic mutation.
     *
     * <p>Every element is validated first; if the collection or any element is null
     * nothing is inserted. Later elements win over earlier ones with the same priority.</p>
     *
     * @param tasks the tasks to insert
     * @throws IllegalArgumentException if tasks or any element is null
     */
    void insertAll(Collection<Task> tasks);

    /**
     * Looks up the task stored under the given priority.
     *
     * @param priority the key
     * @return the task, or empty if no task has this priority
     */
    Optional<Task> search(int priority);

    /**
     * Returns whether a task is stored under the given priority.
     *
     * @param priority the key
     * @return true if present
     */
    boolean contains(int priority);

    /**
     * Returns the task with the smallest priority.
     *
     * @return the task, or empty on an empty index
     */
    Optional<Task> minimum();

    /**
     * Returns the task with the largest priority.
     *
     * @return the task, or empty on an empty index
     */
    Optional<Task> maximum();

    /**
     * Returns the tasks whose priority lies in {@code [min, max]}, ascending.
     *
     * @param min inclusive lower bound
     * @param max inclusive upper bound
     * @return snapshot list, possibly empty
     * @throws IllegalArgumentException if min &gt; max
     */
    List<Task> rangeQuery(int min, int max);

    /**
     * Returns every task in ascending priority order.
     *
     * @return snapshot list, possibly empty
     */
    List<Task> inOrderTraversal();

    /**
     * Removes the task stored under the given priority.
     *
     * @param priority the key
     * @return true if a task was removed
     */
    boolean delete(int priority);

    /**
     * Removes and returns the task with the smallest priority.
     *
     * @return the removed task, or empty on an empty index
     */
    Optional<Task> pollMinimum();

    /**
     * Removes every task.
     */
    void clear();

    /**
     * @return number of stored tasks
     */
    int size();

    /**
     * @return true if no task is stored
     */
    boolean isEmpty();

    /**
     * Computes diagnostic statistics. O(n).
     *
     * @return statistics snapshot
     */
    IndexStatistics statistics();
}
