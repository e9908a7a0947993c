/**
 * 모듈 간 검증 요청의 상태 모델.
 *
 * <p>{@link com.ryuqq.pipeline.core.validation.PendingValidation}은 compare-and-set으로
 * WAITING을 정확히 한 번 벗어나며, 기한 초과는 승인으로 취급되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.validation;
