package com.ryuqq.taskindex.core.model;

/**
 * 우선순위가 부여된 작업 단위.
 *
 * <p>{@code priority}는 인덱스의 유일한 정렬/동등성 키입니다.
 * 값이 작을수록 먼저 처리한다는 것은 호출자 측 관례이며, 인덱스 자체는 단순 오름차순 구조입니다.</p>
 *
 * <p><strong>불변성:</strong> priority, description, assignedTo, createdAt은 생성 후 변경 불가.
 * status만 {@link #transitionTo(TaskStatus)}로 변경됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>description: null 또는 빈 문자열 불가</li>
 *   <li>assignedTo: null 허용 (미할당), 빈 문자열 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Task {

    private final int priority;
    private final String description;
    private final String assignedTo;
    private final long createdAt;
    private volatile TaskStatus status;

    private Task(int priority, String description, String assignedTo) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (assignedTo != null && assignedTo.isBlank()) {
            throw new IllegalArgumentException("assignedTo cannot be blank");
        }
        this.priority = priority;
        this.description = description;
        this.assignedTo = assignedTo;
        this.createdAt = System.currentTimeMillis();
        this.status = TaskStatus.PENDING;
    }

    /**
     * 미할당 Task 생성.
     *
     * @param priority 우선순위 (인덱스 키)
     * @param description 작업 설명
     * @return PENDING 상태의 Task
     * @throws IllegalArgumentException description이 null이거나 빈 문자열인 경우
     */
    public static Task of(int priority, String description) {
        return new Task(priority, description, null);
    }

    /**
     * 담당자가 지정된 Task 생성.
     *
     * @param priority 우선순위 (인덱스 키)
     * @param description 작업 설명
     * @param assignedTo 담당자 (null 허용)
     * @return PENDING 상태의 Task
     * @throws IllegalArgumentException description이 null/빈 문자열이거나 assignedTo가 빈 문자열인 경우
     */
    public static Task of(int priority, String description, String assignedTo) {
        return new Task(priority, description, assignedTo);
    }

    public int getPriority() {
        return priority;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 담당자 조회.
     *
     * @return 담당자, 미할당이면 null
     */
    public String getAssignedTo() {
        return assignedTo;
    }

    /**
     * 생성 시각 (epoch millis).
     *
     * @return 생성 시각
     */
    public long getCreatedAt() {
        return createdAt;
    }

    public TaskStatus getStatus() {
        return status;
    }

    /**
     * 상태 전이.
     *
     * <p>현재 상태의 {@link TaskStatus#successors()}에 포함된 상태로만 이동하며,
     * 동시 호출 시 하나의 전이만 성공합니다. 실패하면 상태는 그대로입니다.</p>
     *
     * @param next 다음 상태
     * @throws IllegalArgumentException next가 null인 경우
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public synchronized void transitionTo(TaskStatus next) {
        if (next == null) {
            throw new IllegalArgumentException("next status cannot be null");
        }
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("Task " + priority + " cannot move from " + status + " to " + next
                + (status.isTerminal() ? " (already finished)" : " (allowed: " + status.successors() + ")"));
        }
        this.status = next;
    }

    @Override
    public String toString() {
        return "Task{priority=" + priority
            + ", description='" + description + '\''
            + ", assignedTo=" + (assignedTo != null ? assignedTo : "Unassigned")
            + ", status=" + status + '}';
    }
}
