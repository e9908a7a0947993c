/**
 * 파이프라인 단계 상태 머신 규칙.
 *
 * <p>{@link com.ryuqq.pipeline.core.statemachine.Stage}의 순서와
 * {@link com.ryuqq.pipeline.core.statemachine.StageTransition}의 전이 검증을 정의합니다.
 * 잠금과 게이트 처리는 러너 모듈의 상태 머신이 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.statemachine;
