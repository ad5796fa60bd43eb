package com.ryuqq.taskindex.adapter.inmemory.avl;

import com.ryuqq.taskindex.core.model.IndexStatistics;
import com.ryuqq.taskindex.core.model.Task;
import com.ryuqq.taskindex.core.spi.TaskIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link TaskIndex} backed by an AVL tree.
 *
 * <p>This class is the concurrency guard around a single {@link AvlTree}: every tree call runs
 * inside one critical section of a {@link ReentrantReadWriteLock}.</p>
 *
 * <p><strong>Locking:</strong></p>
 * <ul>
 *   <li><strong>Read lock:</strong> search, contains, minimum, maximum, rangeQuery,
 *       inOrderTraversal, size, isEmpty, height, statistics</li>
 *   <li><strong>Write lock:</strong> insert, insertAll, delete, pollMinimum, clear.
 *       Held for the whole structural change including every rotation, so no reader
 *       observes a partially rebalanced tree</li>
 *   <li>Argument validation runs before the lock is acquired</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>insert / delete / search / pollMinimum:</strong> O(log N)</li>
 *   <li><strong>rangeQuery:</strong> O(log N + K)</li>
 *   <li><strong>inOrderTraversal / statistics:</strong> O(N)</li>
 *   <li>With {@link TaskIndexConfig#verifyInvariants()} every mutation additionally costs O(N)</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * TaskIndex index = new InMemoryTaskIndex();
 *
 * index.insert(Task.of(10, "Fix login bug", "alice"));
 * index.insert(Task.of(30, "Write release notes"));
 *
 * Optional&lt;Task&gt; next = index.pollMinimum();     // priority 10
 * List&lt;Task&gt; urgent = index.rangeQuery(0, 20);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryTaskIndex implements TaskIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskIndex.class);

    private final AvlTree tree;
    private final TaskIndexConfig config;
    private final Lock readLock;
    private final Lock writeLock;

    /**
     * Creates an empty index with the default {@link TaskIndexConfig}.
     */
    public InMemoryTaskIndex() {
        this(new TaskIndexConfig());
    }

    /**
     * Creates an empty index.
     *
     * @param config index configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryTaskIndex(TaskIndexConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        ReentrantReadWriteLock lock = new ReentrantReadWriteLock(config.fairLock());
        this.tree = new AvlTree();
        this.config = config;
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();
    }

    @Override
    public void insert(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        writeLock.lock();
        try {
            boolean added = tree.insert(task);
            verifyIfEnabled("insert");
            log.debug("{} task at priority {} (size: {})",
                added ? "Inserted" : "Replaced", task.getPriority(), tree.size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Validates the whole collection before taking the write lock</li>
     *   <li>Acquires the write lock once for the batch</li>
     * </ul>
     */
    @Override
    public void insertAll(Collection<Task> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        for (Task task : tasks) {
            if (task == null) {
                throw new IllegalArgumentException("tasks cannot contain null elements");
            }
        }

        writeLock.lock();
        try {
            int added = 0;
            for (Task task : tasks) {
                if (tree.insert(task)) {
                    added++;
                }
            }
            verifyIfEnabled("insertAll");
            log.debug("Batch insert of {} tasks: {} added, {} replaced",
                tasks.size(), added, tasks.size() - added);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Task> search(int priority) {
        readLock.lock();
        try {
            return Optional.ofNullable(tree.find(priority));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean contains(int priority) {
        readLock.lock();
        try {
            return tree.find(priority) != null;
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Optional<Task> minimum() {
        readLock.lock();
        try {
            return Optional.ofNullable(tree.minimum());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Optional<Task> maximum() {
        readLock.lock();
        try {
            return Optional.ofNullable(tree.maximum());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Task> rangeQuery(int min, int max) {
        if (min > max) {
            throw new IllegalArgumentException("min must be <= max (min: " + min + ", max: " + max + ")");
        }

        readLock.lock();
        try {
            return Collections.unmodifiableList(tree.range(min, max));
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Task> inOrderTraversal() {
        readLock.lock();
        try {
            return Collections.unmodifiableList(tree.inOrder());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean delete(int priority) {
        writeLock.lock();
        try {
            boolean removed = tree.delete(priority);
            if (removed) {
                verifyIfEnabled("delete");
                log.debug("Deleted task at priority {} (size: {})", priority, tree.size());
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Task> pollMinimum() {
        writeLock.lock();
        try {
            Task polled = tree.pollMinimum();
            if (polled != null) {
                verifyIfEnabled("pollMinimum");
                log.debug("Polled task at priority {} (size: {})", polled.getPriority(), tree.size());
            }
            return Optional.ofNullable(polled);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            int dropped = tree.size();
            tree.clear();
            log.debug("Cleared index ({} tasks dropped)", dropped);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int size() {
        readLock.lock();
        try {
            return tree.size();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the cached height of the tree (0 when empty).
     *
     * @return tree height
     */
    public int height() {
        readLock.lock();
        try {
            return tree.height();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Height and balance are re-derived by walking the tree, not read from cached heights.</p>
     */
    @Override
    public IndexStatistics statistics() {
        readLock.lock();
        try {
            return tree.statistics();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Returns the configuration this index was created with.
     *
     * @return configuration
     */
    public TaskIndexConfig getConfig() {
        return config;
    }

    /**
     * Runs the full invariant check while the write lock is still held.
     */
    private void verifyIfEnabled(String operation) {
        if (!config.verifyInvariants()) {
            return;
        }
        try {
            tree.verifyInvariants();
        } catch (IllegalStateException e) {
            log.error("Tree invariant violated after {}", operation, e);
            throw e;
        }
    }
}
