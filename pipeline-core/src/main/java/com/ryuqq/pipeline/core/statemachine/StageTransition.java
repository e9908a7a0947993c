package com.ryuqq.pipeline.core.statemachine;

import com.ryuqq.pipeline.core.exception.InvalidTransitionException;

/**
 * 단계 전이 검증 및 실행.
 *
 * <p>이 클래스는 게이트 검증과 무관한 순수 단계 규칙만 다룹니다.
 * 게이트 조건은 상태 머신이 아이템 잠금 안에서 확인합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>ADVANCE: N → N+1 (종료 단계 제외)</li>
 *   <li>CANCEL: 종료되지 않은 단계 → CANCELLED</li>
 *   <li>OVERRIDE: 종료되지 않은 단계 → CANCELLED를 제외한 다른 단계</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 단계(COMPLETE, CANCELLED)에서는 어떤 단계로도 전이 불가</li>
 *   <li>ADVANCE는 건너뛰기 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StageTransition {

    // Utility class - prevent instantiation
    private StageTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @param kind 전이 종류 (CREATED 불가)
     * @throws IllegalArgumentException 인자가 null이거나 kind가 CREATED인 경우
     * @throws InvalidTransitionException 유효하지 않은 전이인 경우
     */
    public static void validate(Stage from, Stage to, TransitionKind kind) {
        if (from == null || to == null || kind == null) {
            throw new IllegalArgumentException(
                "Arguments cannot be null (from: " + from + ", to: " + to + ", kind: " + kind + ")");
        }
        if (kind == TransitionKind.CREATED) {
            throw new IllegalArgumentException("CREATED is not a transition");
        }

        // 종료 단계에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new InvalidTransitionException(
                String.format("Cannot transition from terminal stage: %s → %s", from, to)
            );
        }

        boolean valid = switch (kind) {
            case ADVANCE -> to == from.next() && to != Stage.CANCELLED;
            case CANCEL -> to == Stage.CANCELLED;
            case OVERRIDE -> to != from && to != Stage.CANCELLED;
            case CREATED -> false;
        };

        if (!valid) {
            throw new InvalidTransitionException(
                String.format("Invalid %s transition: %s → %s", kind, from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @param kind 전이 종류
     * @return 전이된 단계 (next)
     * @throws InvalidTransitionException 유효하지 않은 전이인 경우
     */
    public static Stage transition(Stage current, Stage next, TransitionKind kind) {
        validate(current, next, kind);
        return next;
    }
}
