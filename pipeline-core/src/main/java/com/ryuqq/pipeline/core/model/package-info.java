/**
 * 파이프라인 도메인 값 타입.
 *
 * <p>식별자({@link com.ryuqq.pipeline.core.model.PipelineItemId},
 * {@link com.ryuqq.pipeline.core.model.CorrelationId})와 검증 종류 및 판정을 정의합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.model;
