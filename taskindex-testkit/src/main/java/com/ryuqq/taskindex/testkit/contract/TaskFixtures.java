package com.ryuqq.taskindex.testkit.contract;

import com.ryuqq.taskindex.core.model.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Task 테스트 픽스처.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TaskFixtures {

    private TaskFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 우선순위에서 설명을 유도한 Task 생성 ("task-{priority}").
     */
    public static Task task(int priority) {
        return Task.of(priority, "task-" + priority);
    }

    /**
     * 주어진 순서대로 Task 목록 생성.
     */
    public static List<Task> tasks(int... priorities) {
        List<Task> result = new ArrayList<>(priorities.length);
        for (int priority : priorities) {
            result.add(task(priority));
        }
        return result;
    }

    /**
     * Task 목록의 우선순위만 추출.
     */
    public static List<Integer> priorities(List<Task> tasks) {
        return tasks.stream()
                .map(Task::getPriority)
                .collect(Collectors.toList());
    }

    /**
     * [fromInclusive, toExclusive) 범위의 우선순위를 seed로 섞은 목록.
     */
    public static List<Integer> shuffledRange(int fromInclusive, int toExclusive, long seed) {
        List<Integer> keys = new ArrayList<>(toExclusive - fromInclusive);
        for (int i = fromInclusive; i < toExclusive; i++) {
            keys.add(i);
        }
        Collections.shuffle(keys, new Random(seed));
        return keys;
    }

    /**
     * n개 노드를 가진 AVL 트리의 최대 허용 높이: 1.44 * log2(n + 2).
     */
    public static int avlHeightBound(int n) {
        return (int) Math.floor(1.4405 * (Math.log(n + 2) / Math.log(2)));
    }
}
