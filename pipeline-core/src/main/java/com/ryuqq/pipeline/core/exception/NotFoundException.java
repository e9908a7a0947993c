package com.ryuqq.pipeline.core.exception;

/**
 * 조회 대상(파이프라인 아이템, 알림, 대기 중 검증)이 존재하지 않음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NotFoundException extends PipelineException {

    public NotFoundException(String message) {
        super("PIPE-NOT-FOUND", message);
    }
}
