/**
 * 모듈 간 이벤트 계약.
 *
 * <p>{@link com.ryuqq.pipeline.core.contract.EventEnvelope}는 브로드캐스트 채널과 직접 전달 경로에서
 * 동일한 와이어 형태({@link com.ryuqq.pipeline.core.contract.EnvelopeCodec})로 전송되며,
 * {@link com.ryuqq.pipeline.core.contract.EventKind}는 와이어 종류 문자열의 태그된 표현입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.contract;
