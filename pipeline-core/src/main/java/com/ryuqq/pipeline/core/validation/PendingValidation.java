package com.ryuqq.pipeline.core.validation;

import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 응답을 기다리는 검증 요청 기록.
 *
 * <p>검증 오케스트레이터가 독점적으로 소유합니다. 식별 정보와 기한은 불변이고,
 * 상태는 {@link #resolve(ValidationState, String, Instant)}의 compare-and-set으로
 * WAITING에서 정확히 한 번만 벗어납니다. 응답과 기한 초과가 경합하면 먼저 쓴 쪽이 이깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PendingValidation {

    private final CorrelationId correlationId;
    private final PipelineItemId pipelineItemId;
    private final ValidationType requestType;
    private final Instant issuedAt;
    private final Instant deadline;
    private final AtomicReference<Resolution> resolution;

    public PendingValidation(
        CorrelationId correlationId,
        PipelineItemId pipelineItemId,
        ValidationType requestType,
        Instant issuedAt,
        Instant deadline
    ) {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (pipelineItemId == null) {
            throw new IllegalArgumentException("pipelineItemId cannot be null");
        }
        if (requestType == null) {
            throw new IllegalArgumentException("requestType cannot be null");
        }
        if (issuedAt == null || deadline == null) {
            throw new IllegalArgumentException("issuedAt and deadline cannot be null");
        }
        if (deadline.isBefore(issuedAt)) {
            throw new IllegalArgumentException("deadline cannot precede issuedAt");
        }
        this.correlationId = correlationId;
        this.pipelineItemId = pipelineItemId;
        this.requestType = requestType;
        this.issuedAt = issuedAt;
        this.deadline = deadline;
        this.resolution = new AtomicReference<>(Resolution.WAITING);
    }

    /**
     * WAITING에서 최종 상태로 전이 (최초 1회만 성공).
     *
     * @param target 최종 상태 (WAITING 불가)
     * @param summary 응답 요약 (nullable)
     * @param at 해결 시각
     * @return 이번 호출이 전이를 적용했으면 true, 이미 해결된 경우 false
     */
    public boolean resolve(ValidationState target, String summary, Instant at) {
        if (target == null || !target.isResolved()) {
            throw new IllegalArgumentException("target must be a resolved state (current: " + target + ")");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        return resolution.compareAndSet(Resolution.WAITING, new Resolution(target, summary, at));
    }

    /**
     * @param now 기준 시각
     * @return 아직 WAITING이고 기한이 지난 경우 true
     */
    public boolean isOverdue(Instant now) {
        return state() == ValidationState.WAITING && !now.isBefore(deadline);
    }

    public ValidationState state() {
        return resolution.get().state();
    }

    public Optional<String> summary() {
        return Optional.ofNullable(resolution.get().summary());
    }

    public Optional<Instant> resolvedAt() {
        return Optional.ofNullable(resolution.get().resolvedAt());
    }

    /**
     * 해결된 경우 결과 조회.
     *
     * @return 결과, WAITING이면 empty
     */
    public Optional<ValidationResult> result() {
        Resolution current = resolution.get();
        if (!current.state().isResolved()) {
            return Optional.empty();
        }
        return Optional.of(new ValidationResult(
            correlationId, pipelineItemId, requestType, current.state(), current.summary(), current.resolvedAt()));
    }

    public CorrelationId correlationId() {
        return correlationId;
    }

    public PipelineItemId pipelineItemId() {
        return pipelineItemId;
    }

    public ValidationType requestType() {
        return requestType;
    }

    public Instant issuedAt() {
        return issuedAt;
    }

    public Instant deadline() {
        return deadline;
    }

    @Override
    public String toString() {
        return "PendingValidation{" + correlationId.getValue()
            + ", item=" + pipelineItemId.getValue()
            + ", type=" + requestType
            + ", state=" + state()
            + ", deadline=" + deadline + '}';
    }

    private record Resolution(ValidationState state, String summary, Instant resolvedAt) {
        static final Resolution WAITING = new Resolution(ValidationState.WAITING, null, null);
    }
}
