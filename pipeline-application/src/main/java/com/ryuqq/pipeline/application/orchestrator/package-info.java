/**
 * 파이프라인 오케스트레이터 경계와 검증 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.orchestrator;
