package com.ryuqq.taskindex.core.model;

import java.util.OptionalInt;

/**
 * TaskIndex 진단 통계 (불변 record).
 *
 * <p>{@code balanced}는 캐시된 높이를 신뢰하지 않고 트리를 다시 순회해 계산한 값입니다.
 * 진단/테스트 용도이며 hot path에서 호출하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param nodeCount 노드 수 (0 이상)
 * @param height 트리 높이 (빈 트리 0, 단일 노드 1)
 * @param balanced 모든 노드가 AVL 균형 조건을 만족하는지 여부
 * @param minPriority 최소 우선순위 (빈 인덱스면 empty)
 * @param maxPriority 최대 우선순위 (빈 인덱스면 empty)
 */
public record IndexStatistics(
    int nodeCount,
    int height,
    boolean balanced,
    OptionalInt minPriority,
    OptionalInt maxPriority
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public IndexStatistics {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount cannot be negative (current: " + nodeCount + ")");
        }
        if (height < 0) {
            throw new IllegalArgumentException("height cannot be negative (current: " + height + ")");
        }
        if (minPriority == null || maxPriority == null) {
            throw new IllegalArgumentException("minPriority and maxPriority cannot be null");
        }
        boolean present = nodeCount > 0;
        if (minPriority.isPresent() != present || maxPriority.isPresent() != present) {
            throw new IllegalArgumentException(
                "minPriority/maxPriority must be present iff nodeCount > 0 (nodeCount: " + nodeCount + ")"
            );
        }
        if (present && minPriority.getAsInt() > maxPriority.getAsInt()) {
            throw new IllegalArgumentException(
                "minPriority must be <= maxPriority (min: " + minPriority.getAsInt()
                    + ", max: " + maxPriority.getAsInt() + ")"
            );
        }
    }

    /**
     * 빈 인덱스의 통계.
     *
     * @return nodeCount=0, height=0, balanced=true
     */
    public static IndexStatistics empty() {
        return new IndexStatistics(0, 0, true, OptionalInt.empty(), OptionalInt.empty());
    }

    /**
     * 비어 있지 않은 인덱스의 통계.
     */
    public static IndexStatistics of(int nodeCount, int height, boolean balanced, int minPriority, int maxPriority) {
        return new IndexStatistics(nodeCount, height, balanced, OptionalInt.of(minPriority), OptionalInt.of(maxPriority));
    }

    public boolean isEmpty() {
        return nodeCount == 0;
    }
}
