package com.ryuqq.pipeline.core.validation;

import com.ryuqq.pipeline.core.model.Verdict;

/**
 * 대기 중 검증의 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>WAITING → APPROVED (승인 응답)</li>
 *   <li>WAITING → REJECTED (거절 응답)</li>
 *   <li>WAITING → TIMED_OUT (기한 초과)</li>
 *   <li><strong>WAITING을 벗어나는 전이는 정확히 한 번 (먼저 쓴 쪽이 이김)</strong></li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ValidationState {

    WAITING,
    APPROVED,
    REJECTED,
    TIMED_OUT;

    /**
     * @return WAITING이 아닌 경우 true
     */
    public boolean isResolved() {
        return this != WAITING;
    }

    /**
     * 게이트를 막는 상태인지 확인 (fail-closed).
     *
     * @return REJECTED 또는 TIMED_OUT인 경우 true
     */
    public boolean isBlocking() {
        return this == REJECTED || this == TIMED_OUT;
    }

    /**
     * 판정을 상태로 변환.
     *
     * @param verdict 판정
     * @return APPROVED 또는 REJECTED
     */
    public static ValidationState from(Verdict verdict) {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        return verdict == Verdict.APPROVED ? APPROVED : REJECTED;
    }
}
