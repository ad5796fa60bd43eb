package com.ryuqq.taskindex.adapter.inmemory.avl;

/**
 * InMemoryTaskIndex 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>fairLock: ReentrantReadWriteLock 공정성 모드 (기본 false)</li>
 *   <li>verifyInvariants: 매 변경 후 트리 불변식 전체 검증 (기본 false, O(N))</li>
 * </ul>
 *
 * <p><strong>verifyInvariants 가이드:</strong></p>
 * <ul>
 *   <li>테스트/개발: true (불변식 위반 시 즉시 IllegalStateException)</li>
 *   <li>운영: false (모든 변경이 O(N)이 되므로)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param fairLock 공정한 락 획득 순서 사용 여부
 * @param verifyInvariants 변경마다 불변식 검증 여부
 */
public record TaskIndexConfig(
    boolean fairLock,
    boolean verifyInvariants
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: fairLock=false, verifyInvariants=false</p>
     */
    public TaskIndexConfig() {
        this(false, false);
    }

    /**
     * fairLock만 변경한 새 인스턴스 생성.
     */
    public TaskIndexConfig withFairLock(boolean fairLock) {
        return new TaskIndexConfig(fairLock, verifyInvariants);
    }

    /**
     * verifyInvariants만 변경한 새 인스턴스 생성.
     */
    public TaskIndexConfig withVerifyInvariants(boolean verifyInvariants) {
        return new TaskIndexConfig(fairLock, verifyInvariants);
    }
}
