/**
 * Service Provider Interface for priority-ordered task storage.
 *
 * <p>Adapters implement {@link com.ryuqq.taskindex.core.spi.TaskIndex};
 * the testkit ships an abstract contract test every implementation must pass.</p>
 *
 * <pre>
 * adapter-inmemory (InMemoryTaskIndex, AVL tree)
 *   ↓ implements
 * core/spi (TaskIndex)
 *   ↓ depends on
 * core/model (Task, TaskStatus, IndexStatistics)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.taskindex.core.spi;
