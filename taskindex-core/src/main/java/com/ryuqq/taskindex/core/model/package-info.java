/**
 * Core domain model package for the Task Index.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskindex.core.model.Task} - Prioritized unit of work (index key: priority)</li>
 *   <li>{@link com.ryuqq.taskindex.core.model.TaskStatus} - Task lifecycle status</li>
 *   <li>{@link com.ryuqq.taskindex.core.model.IndexStatistics} - Diagnostic snapshot of an index</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Task identity fields and statistics are final</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.taskindex.core.model;
