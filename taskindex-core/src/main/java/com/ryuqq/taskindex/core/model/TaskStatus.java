package com.ryuqq.taskindex.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Task의 처리 상태.
 *
 * <pre>
 * PENDING ──(할당)──► IN_PROGRESS ──┬─► DONE
 *                                   └─► FAILED
 * </pre>
 *
 * <p>각 상태는 이동 가능한 후속 상태 집합을 가지며, 후속 상태가 없는 상태가 종료 상태입니다.
 * 상태는 외부 협력자(할당/실행 파이프라인)가 변경하며, 인덱스는 상태를 읽거나 바꾸지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TaskStatus {

    /**
     * 대기 중 (아직 할당 안 됨).
     */
    PENDING,

    /**
     * 처리 중.
     */
    IN_PROGRESS,

    /**
     * 완료.
     */
    DONE,

    /**
     * 실패.
     */
    FAILED;

    private static final Map<TaskStatus, Set<TaskStatus>> SUCCESSORS = new EnumMap<>(TaskStatus.class);

    static {
        SUCCESSORS.put(PENDING, Collections.unmodifiableSet(EnumSet.of(IN_PROGRESS)));
        SUCCESSORS.put(IN_PROGRESS, Collections.unmodifiableSet(EnumSet.of(DONE, FAILED)));
        SUCCESSORS.put(DONE, Collections.unmodifiableSet(EnumSet.noneOf(TaskStatus.class)));
        SUCCESSORS.put(FAILED, Collections.unmodifiableSet(EnumSet.noneOf(TaskStatus.class)));
    }

    /**
     * 이 상태에서 바로 이동할 수 있는 상태들.
     *
     * @return 읽기 전용 후속 상태 집합 (종료 상태면 빈 집합)
     */
    public Set<TaskStatus> successors() {
        return SUCCESSORS.get(this);
    }

    /**
     * 주어진 상태로 바로 이동할 수 있는지 확인.
     *
     * @param next 다음 상태
     * @return 후속 상태에 포함되면 true
     */
    public boolean canMoveTo(TaskStatus next) {
        return next != null && successors().contains(next);
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return 후속 상태가 없으면 true (DONE, FAILED)
     */
    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
