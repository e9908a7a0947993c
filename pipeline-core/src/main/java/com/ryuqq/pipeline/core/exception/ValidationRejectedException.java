package com.ryuqq.pipeline.core.exception;

/**
 * 게이트 검증이 거절되었거나 기한을 넘겨 아이템이 차단된 상태.
 *
 * <p>명시적인 거절 해제 전까지 같은 검증의 재요청과 진행이 모두 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationRejectedException extends PipelineException {

    public ValidationRejectedException(String message) {
        super("PIPE-REJECTED", message);
    }
}
