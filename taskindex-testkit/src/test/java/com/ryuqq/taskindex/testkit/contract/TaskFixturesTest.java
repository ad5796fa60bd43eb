package com.ryuqq.taskindex.testkit.contract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TaskFixtures 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TaskFixturesTest {

    @Test
    void shuffledRange_ContainsEveryKeyOnce() {
        // when
        List<Integer> keys = TaskFixtures.shuffledRange(-10, 10, 1L);

        // then
        assertThat(keys).hasSize(20).doesNotHaveDuplicates().allMatch(k -> k >= -10 && k < 10);
    }

    @Test
    void shuffledRange_SameSeed_SameOrder() {
        assertThat(TaskFixtures.shuffledRange(0, 100, 5L)).isEqualTo(TaskFixtures.shuffledRange(0, 100, 5L));
    }

    @Test
    void avlHeightBound_KnownValues() {
        assertThat(TaskFixtures.avlHeightBound(0)).isEqualTo(1);
        assertThat(TaskFixtures.avlHeightBound(1)).isEqualTo(2);
        assertThat(TaskFixtures.avlHeightBound(10_000)).isEqualTo(19);
    }

    @Test
    void tasks_PreservesOrderAndDescriptions() {
        assertThat(TaskFixtures.priorities(TaskFixtures.tasks(3, 1, 2))).containsExactly(3, 1, 2);
        assertThat(TaskFixtures.task(4).getDescription()).isEqualTo("task-4");
    }
}
