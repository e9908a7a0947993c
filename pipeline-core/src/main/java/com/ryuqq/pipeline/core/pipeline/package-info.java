/**
 * 파이프라인 아이템과 게이트 정책.
 *
 * <p>{@link com.ryuqq.pipeline.core.pipeline.PipelineItem}은 불변 스냅샷이며
 * 모든 변경은 {@code withX} 메서드로 새 스냅샷을 만듭니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.pipeline;
