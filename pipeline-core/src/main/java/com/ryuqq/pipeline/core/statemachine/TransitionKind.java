package com.ryuqq.pipeline.core.statemachine;

/**
 * 단계 이력 항목의 종류.
 *
 * <ul>
 *   <li>CREATED - 파이프라인 진입</li>
 *   <li>ADVANCE - 순차 진행 (N → N+1)</li>
 *   <li>OVERRIDE - 관리자 강제 이동</li>
 *   <li>CANCEL - 취소</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum TransitionKind {
    CREATED,
    ADVANCE,
    OVERRIDE,
    CANCEL
}
