package com.ryuqq.taskindex.testkit.contract;

import com.ryuqq.taskindex.core.spi.TaskIndex;

/**
 * Contract Tests for {@link ReferenceTaskIndex}.
 *
 * <p>Keeps the oracle honest: the reference implementation must pass the same
 * scenarios it is used to check.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ReferenceTaskIndexContractTest extends AbstractTaskIndexContractTest {

    @Override
    protected TaskIndex createIndex() {
        return new ReferenceTaskIndex();
    }
}
