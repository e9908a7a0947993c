package com.ryuqq.pipeline.core.pipeline;

import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.statemachine.Stage;
import com.ryuqq.pipeline.core.statemachine.TransitionKind;
import com.ryuqq.pipeline.core.validation.ValidationState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 파이프라인을 진행하는 제품 개발 아이템의 불변 스냅샷.
 *
 * <p>상태 머신만이 새 스냅샷을 만들어 저장하며, 아이템은 삭제되지 않고
 * COMPLETE 또는 CANCELLED로 종료됩니다.</p>
 *
 * <p><strong>검증 기록:</strong></p>
 * <ul>
 *   <li>pendingValidations: 현재 단계에서 응답을 기다리는 상관관계 식별자와 검증 종류</li>
 *   <li>validationOutcomes: 현재 단계에서 검증 종류별 마지막 판정</li>
 *   <li>blocked: 판정 중 하나라도 REJECTED 또는 TIMED_OUT이면 true</li>
 * </ul>
 * <p>단계를 벗어나면 검증 기록은 모두 초기화됩니다.</p>
 *
 * @param id 아이템 식별자
 * @param title 제목
 * @param category 카테고리 (nullable)
 * @param currentStage 현재 단계
 * @param stageHistory 단계 이력 (시간순)
 * @param pendingValidations 대기 중 검증 (상관관계 식별자 → 검증 종류)
 * @param validationOutcomes 검증 종류별 판정
 * @param blocked 차단 여부
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 변경 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PipelineItem(
    PipelineItemId id,
    String title,
    String category,
    Stage currentStage,
    List<StageHistoryEntry> stageHistory,
    Map<CorrelationId, ValidationType> pendingValidations,
    Map<ValidationType, ValidationState> validationOutcomes,
    boolean blocked,
    Instant createdAt,
    Instant updatedAt
) {

    public PipelineItem {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (currentStage == null) {
            throw new IllegalArgumentException("currentStage cannot be null");
        }
        if (stageHistory == null || stageHistory.isEmpty()) {
            throw new IllegalArgumentException("stageHistory cannot be null or empty");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
        stageHistory = List.copyOf(stageHistory);
        pendingValidations = pendingValidations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(pendingValidations));
        validationOutcomes = validationOutcomes == null || validationOutcomes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(validationOutcomes));
    }

    /**
     * DISCOVERY 단계의 새 아이템 생성.
     *
     * @param id 식별자
     * @param title 제목
     * @param category 카테고리 (nullable)
     * @param actor 생성 주체
     * @param now 생성 시각
     * @return CREATED 이력 1건을 가진 아이템
     */
    public static PipelineItem create(PipelineItemId id, String title, String category, String actor, Instant now) {
        StageHistoryEntry created = new StageHistoryEntry(Stage.DISCOVERY, now, actor, TransitionKind.CREATED, null);
        return new PipelineItem(id, title, category, Stage.DISCOVERY, List.of(created),
            Map.of(), Map.of(), false, now, now);
    }

    /**
     * 단계 전이를 적용한 사본 반환.
     *
     * <p>이력 항목을 추가하고 떠나는 단계의 검증 기록과 차단 상태를 초기화합니다.
     * 전이 규칙 검증은 호출자의 책임입니다.</p>
     *
     * @param to 진입할 단계
     * @param kind 전이 종류
     * @param actor 수행 주체
     * @param note 사유 (nullable)
     * @param now 전이 시각
     * @return 새 스냅샷
     */
    public PipelineItem withStage(Stage to, TransitionKind kind, String actor, String note, Instant now) {
        List<StageHistoryEntry> history = new ArrayList<>(stageHistory);
        history.add(new StageHistoryEntry(to, now, actor, kind, note));
        return new PipelineItem(id, title, category, to, history, Map.of(), Map.of(), false, createdAt, now);
    }

    /**
     * 대기 중 검증을 추가한 사본 반환.
     *
     * @param correlationId 상관관계 식별자
     * @param type 검증 종류
     * @param now 변경 시각
     * @return 새 스냅샷
     */
    public PipelineItem withPendingValidation(CorrelationId correlationId, ValidationType type, Instant now) {
        Map<CorrelationId, ValidationType> pending = new LinkedHashMap<>(pendingValidations);
        pending.put(correlationId, type);
        Map<ValidationType, ValidationState> outcomes = mutableOutcomes();
        outcomes.put(type, ValidationState.WAITING);
        return new PipelineItem(id, title, category, currentStage, stageHistory, pending, outcomes,
            anyBlocking(outcomes), createdAt, now);
    }

    /**
     * 검증 결과를 반영한 사본 반환.
     *
     * @param correlationId 해결된 상관관계 식별자 (대기 목록에 있어야 함)
     * @param state 최종 상태
     * @param now 변경 시각
     * @return 새 스냅샷
     * @throws IllegalArgumentException correlationId가 대기 목록에 없는 경우
     */
    public PipelineItem withValidationResult(CorrelationId correlationId, ValidationState state, Instant now) {
        ValidationType type = pendingValidations.get(correlationId);
        if (type == null) {
            throw new IllegalArgumentException("Not pending on this item: " + correlationId);
        }
        Map<CorrelationId, ValidationType> pending = new LinkedHashMap<>(pendingValidations);
        pending.remove(correlationId);
        Map<ValidationType, ValidationState> outcomes = mutableOutcomes();
        outcomes.put(type, state);
        return new PipelineItem(id, title, category, currentStage, stageHistory, pending, outcomes,
            anyBlocking(outcomes), createdAt, now);
    }

    /**
     * 대기 중 검증을 철회한 사본 반환 (요청 발행 실패).
     *
     * <p>같은 종류의 다른 대기 요청이 없으면 그 종류의 판정도 지워 다시 요청할 수 있게 합니다.</p>
     *
     * @param correlationId 철회할 상관관계 식별자 (대기 목록에 있어야 함)
     * @param now 변경 시각
     * @return 새 스냅샷
     * @throws IllegalArgumentException correlationId가 대기 목록에 없는 경우
     */
    public PipelineItem withoutPendingValidation(CorrelationId correlationId, Instant now) {
        ValidationType type = pendingValidations.get(correlationId);
        if (type == null) {
            throw new IllegalArgumentException("Not pending on this item: " + correlationId);
        }
        Map<CorrelationId, ValidationType> pending = new LinkedHashMap<>(pendingValidations);
        pending.remove(correlationId);
        Map<ValidationType, ValidationState> outcomes = mutableOutcomes();
        if (!pending.containsValue(type)) {
            outcomes.remove(type);
        }
        return new PipelineItem(id, title, category, currentStage, stageHistory, pending, outcomes,
            anyBlocking(outcomes), createdAt, now);
    }

    /**
     * 한 검증 종류의 판정을 지운 사본 반환 (거절 해제).
     *
     * @param type 검증 종류
     * @param now 변경 시각
     * @return 새 스냅샷
     */
    public PipelineItem withoutOutcome(ValidationType type, Instant now) {
        Map<ValidationType, ValidationState> outcomes = mutableOutcomes();
        outcomes.remove(type);
        return new PipelineItem(id, title, category, currentStage, stageHistory, pendingValidations, outcomes,
            anyBlocking(outcomes), createdAt, now);
    }

    public boolean isTerminal() {
        return currentStage.isTerminal();
    }

    /**
     * @return 대기 중 상관관계 식별자 집합
     */
    public Set<CorrelationId> pendingValidationIds() {
        return pendingValidations.keySet();
    }

    /**
     * @param type 검증 종류
     * @return 현재 단계에서의 판정, 요청된 적 없으면 empty
     */
    public Optional<ValidationState> outcome(ValidationType type) {
        return Optional.ofNullable(validationOutcomes.get(type));
    }

    /**
     * @return 마지막 이력 항목
     */
    public StageHistoryEntry lastTransition() {
        return stageHistory.get(stageHistory.size() - 1);
    }

    private Map<ValidationType, ValidationState> mutableOutcomes() {
        EnumMap<ValidationType, ValidationState> outcomes = new EnumMap<>(ValidationType.class);
        outcomes.putAll(validationOutcomes);
        return outcomes;
    }

    private static boolean anyBlocking(Map<ValidationType, ValidationState> outcomes) {
        return outcomes.values().stream().anyMatch(ValidationState::isBlocking);
    }
}
