package com.ryuqq.pipeline.core.pipeline;

import com.ryuqq.pipeline.core.statemachine.Stage;
import com.ryuqq.pipeline.core.statemachine.TransitionKind;

import java.time.Instant;

/**
 * 단계 이력 항목.
 *
 * @param stage 진입한 단계
 * @param enteredAt 진입 시각
 * @param actor 전이를 수행한 주체
 * @param kind 전이 종류 (CREATED, ADVANCE, OVERRIDE, CANCEL)
 * @param note 사유 또는 메모 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StageHistoryEntry(
    Stage stage,
    Instant enteredAt,
    String actor,
    TransitionKind kind,
    String note
) {

    public StageHistoryEntry {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
        if (enteredAt == null) {
            throw new IllegalArgumentException("enteredAt cannot be null");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }
}
