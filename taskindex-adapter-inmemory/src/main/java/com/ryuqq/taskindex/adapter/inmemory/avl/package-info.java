/**
 * In-memory TaskIndex adapter backed by a self-balancing AVL tree.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.taskindex.adapter.inmemory.avl.InMemoryTaskIndex}:
 *       Thread-safe implementation of {@link com.ryuqq.taskindex.core.spi.TaskIndex}</li>
 *   <li>{@link com.ryuqq.taskindex.adapter.inmemory.avl.TaskIndexConfig}:
 *       Lock fairness and invariant verification settings</li>
 *   <li>{@code AvlTree} / {@code AvlNode}: package-private tree structure, never exposed</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Ownership:</strong> Plain owned tree, no parent pointers; rotations move subtrees only</li>
 *   <li><strong>Concurrency:</strong> One {@link java.util.concurrent.locks.ReentrantReadWriteLock}
 *       critical section per operation</li>
 *   <li><strong>Keys:</strong> Duplicate priority overwrites the stored task</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Writers are fully serialized</li>
 * </ul>
 *
 * @see com.ryuqq.taskindex.core.spi.TaskIndex
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.taskindex.adapter.inmemory.avl;
