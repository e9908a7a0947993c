package com.ryuqq.pipeline.core.validation;

import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;

import java.time.Instant;

/**
 * 해결된 검증의 결과.
 *
 * <p>검증 핸들이 완료될 때 전달되는 값이며, 기한 초과도 정상 완료된
 * {@link ValidationState#TIMED_OUT} 결과로 전달됩니다.</p>
 *
 * @param correlationId 상관관계 식별자
 * @param pipelineItemId 대상 파이프라인 아이템
 * @param type 검증 종류
 * @param state 최종 상태 (WAITING 불가)
 * @param summary 응답 요약 (nullable)
 * @param resolvedAt 해결 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ValidationResult(
    CorrelationId correlationId,
    PipelineItemId pipelineItemId,
    ValidationType type,
    ValidationState state,
    String summary,
    Instant resolvedAt
) {

    public ValidationResult {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (pipelineItemId == null) {
            throw new IllegalArgumentException("pipelineItemId cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (state == null || !state.isResolved()) {
            throw new IllegalArgumentException("state must be a resolved state (current: " + state + ")");
        }
        if (resolvedAt == null) {
            throw new IllegalArgumentException("resolvedAt cannot be null");
        }
    }

    public boolean isApproved() {
        return state == ValidationState.APPROVED;
    }
}
