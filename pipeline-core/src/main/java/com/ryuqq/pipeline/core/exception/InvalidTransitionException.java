package com.ryuqq.pipeline.core.exception;

/**
 * 허용되지 않은 단계 전이 시도.
 *
 * <p>종료 단계에서의 전이, 미해결 게이트 검증이 남은 상태에서의 진행,
 * 기대 단계 불일치(동시 진행 충돌)에서 발생합니다. 발생 시 상태는 변경되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends PipelineException {

    public InvalidTransitionException(String message) {
        super("PIPE-TRANSITION", message);
    }
}
