package com.ryuqq.pipeline.core.exception;

/**
 * 이미 해결된 알림 또는 검증을 다시 해결하려는 시도.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class AlreadyResolvedException extends PipelineException {

    public AlreadyResolvedException(String message) {
        super("PIPE-RESOLVED", message);
    }
}
