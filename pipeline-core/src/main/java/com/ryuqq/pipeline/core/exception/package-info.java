/**
 * 파이프라인 오케스트레이터의 오류 분류.
 *
 * <p>모든 예외는 {@link com.ryuqq.pipeline.core.exception.PipelineException}을 상속하며
 * 오류 코드를 가집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.exception;
