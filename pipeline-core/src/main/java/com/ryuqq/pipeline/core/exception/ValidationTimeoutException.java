package com.ryuqq.pipeline.core.exception;

/**
 * 검증 응답이 기한 내에 도착하지 않음.
 *
 * <p>검증 핸들의 결과를 {@code join()}으로 기다리는 호출자에게 전달되는 실패이며,
 * 기한 초과는 승인으로 취급되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationTimeoutException extends PipelineException {

    public ValidationTimeoutException(String message) {
        super("PIPE-TIMEOUT", message);
    }
}
