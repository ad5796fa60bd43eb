package com.ryuqq.taskindex.adapter.inmemory.avl;

import com.ryuqq.taskindex.core.model.IndexStatistics;
import com.ryuqq.taskindex.core.model.Task;
import com.ryuqq.taskindex.core.model.TaskStatus;
import com.ryuqq.taskindex.testkit.contract.ReferenceTaskIndex;
import com.ryuqq.taskindex.testkit.contract.TaskFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.ryuqq.taskindex.testkit.contract.TaskFixtures.priorities;
import static com.ryuqq.taskindex.testkit.contract.TaskFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryTaskIndex 테스트.
 *
 * <p>계약 테스트({@link InMemoryTaskIndexContractTest})에서 다루지 않는 구현 고유 동작을 검증합니다:</p>
 * <ul>
 *   <li>설정 검증 및 높이 조회</li>
 *   <li>ReferenceTaskIndex와의 차등 테스트</li>
 *   <li>읽기/쓰기 동시 실행 시 부분 회전 상태 비노출</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryTaskIndexTest {

    private InMemoryTaskIndex index;

    @BeforeEach
    void setUp() {
        index = new InMemoryTaskIndex(new TaskIndexConfig().withVerifyInvariants(true));
    }

    @Test
    void constructor_NullConfig_Throws() {
        assertThatThrownBy(() -> new InMemoryTaskIndex(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }

    @Test
    void defaultConstructor_UsesDefaultConfig() {
        assertThat(new InMemoryTaskIndex().getConfig()).isEqualTo(new TaskIndexConfig());
    }

    @Test
    void height_MatchesDerivedStatisticsHeight() {
        // given
        for (int p : TaskFixtures.shuffledRange(0, 1000, 21L)) {
            index.insert(task(p));
        }

        // when
        IndexStatistics stats = index.statistics();

        // then
        assertThat(index.height()).isEqualTo(stats.height());
        assertThat(stats.height()).isLessThanOrEqualTo(TaskFixtures.avlHeightBound(1000));
        assertThat(stats.minPriority()).hasValue(0);
        assertThat(stats.maxPriority()).hasValue(999);
    }

    @Test
    void sequentialInsert_HeightFarBelowNodeCount() {
        // given
        List<Task> batch = new ArrayList<>();
        for (int p = 1; p <= 10_000; p++) {
            batch.add(task(p));
        }

        // when
        index.insertAll(batch);

        // then
        assertThat(index.size()).isEqualTo(10_000);
        assertThat(index.height()).isLessThanOrEqualTo(TaskFixtures.avlHeightBound(10_000));
    }

    @Test
    void statusChanges_DoNotAffectIndexing() {
        // given
        Task task = Task.of(5, "Deploy", "bob");
        index.insert(task);

        // when
        task.transitionTo(TaskStatus.IN_PROGRESS);

        // then
        assertThat(index.search(5)).containsSame(task);
        assertThat(index.search(5).get().getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
    }

    @Test
    void rangeQuery_InvalidBounds_RejectedWithoutTouchingIndex() {
        // given
        index.insert(task(1));

        // when & then
        assertThatThrownBy(() -> index.rangeQuery(Integer.MAX_VALUE, Integer.MIN_VALUE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void differential_AgreesWithReferenceIndex() {
        // given
        ReferenceTaskIndex reference = new ReferenceTaskIndex();
        Random random = new Random(99L);

        for (int i = 0; i < 5000; i++) {
            int key = random.nextInt(1000) - 500;
            int op = random.nextInt(10);

            // when
            if (op < 5) {
                Task t = task(key);
                index.insert(t);
                reference.insert(t);
            } else if (op < 8) {
                assertThat(index.delete(key)).isEqualTo(reference.delete(key));
            } else if (op < 9) {
                assertThat(index.pollMinimum()).isEqualTo(reference.pollMinimum());
            } else {
                int max = key + random.nextInt(200);
                assertThat(index.rangeQuery(key, max)).containsExactlyElementsOf(reference.rangeQuery(key, max));
            }

            // then
            assertThat(index.size()).isEqualTo(reference.size());
            assertThat(index.minimum()).isEqualTo(reference.minimum());
            assertThat(index.maximum()).isEqualTo(reference.maximum());
        }
        assertThat(index.inOrderTraversal()).containsExactlyElementsOf(reference.inOrderTraversal());
    }

    @Test
    void concurrentReadersAndWriters_NeverSeeBrokenTree() throws Exception {
        // given: per-mutation verification off, readers do the checking
        InMemoryTaskIndex shared = new InMemoryTaskIndex();
        int writers = 4;
        int readers = 4;
        int perWriter = 2000;
        ExecutorService executorService = Executors.newFixedThreadPool(writers + readers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean writing = new AtomicBoolean(true);
        Queue<String> violations = new ConcurrentLinkedQueue<>();
        List<Future<?>> writerFutures = new ArrayList<>();
        List<Future<?>> readerFutures = new ArrayList<>();

        // when
        try {
            for (int w = 0; w < writers; w++) {
                int base = w * perWriter;
                writerFutures.add(executorService.submit(() -> {
                    start.await();
                    for (int p = base; p < base + perWriter; p++) {
                        shared.insert(task(p));
                        if (p % 3 == 0) {
                            shared.delete(p);
                        }
                    }
                    return null;
                }));
            }
            for (int r = 0; r < readers; r++) {
                readerFutures.add(executorService.submit(() -> {
                    start.await();
                    while (writing.get()) {
                        List<Integer> keys = priorities(shared.inOrderTraversal());
                        for (int i = 1; i < keys.size(); i++) {
                            if (keys.get(i - 1) >= keys.get(i)) {
                                violations.add("unsorted traversal at " + keys.get(i));
                            }
                        }
                        if (!shared.statistics().balanced()) {
                            violations.add("unbalanced tree observed");
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : writerFutures) {
                future.get(60, TimeUnit.SECONDS);
            }
            writing.set(false);
            for (Future<?> future : readerFutures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            writing.set(false);
            executorService.shutdownNow();
        }

        // then
        int expected = 0;
        for (int p = 0; p < writers * perWriter; p++) {
            if (p % 3 != 0) {
                expected++;
            }
        }
        assertThat(violations).isEmpty();
        assertThat(shared.size()).isEqualTo(expected);
        assertThat(shared.statistics().balanced()).isTrue();
        assertThat(shared.rangeQuery(0, 2)).extracting(Task::getPriority).containsExactly(1, 2);
    }

    @Test
    void fairLock_BehavesTheSame() {
        // given
        InMemoryTaskIndex fair = new InMemoryTaskIndex(new TaskIndexConfig(true, true));

        // when
        fair.insertAll(TaskFixtures.tasks(3, 1, 2));

        // then
        assertThat(fair.getConfig().fairLock()).isTrue();
        assertThat(priorities(fair.inOrderTraversal())).containsExactly(1, 2, 3);
    }
}
