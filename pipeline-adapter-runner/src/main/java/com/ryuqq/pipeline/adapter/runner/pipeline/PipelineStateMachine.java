package com.ryuqq.pipeline.adapter.runner.pipeline;

import com.ryuqq.pipeline.adapter.runner.validation.ValidationOrchestrator;
import com.ryuqq.pipeline.application.orchestrator.ValidationHandle;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.exception.InvalidTransitionException;
import com.ryuqq.pipeline.core.exception.NotFoundException;
import com.ryuqq.pipeline.core.exception.ValidationRejectedException;
import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.pipeline.GatePolicy;
import com.ryuqq.pipeline.core.pipeline.PipelineItem;
import com.ryuqq.pipeline.core.spi.PipelineItemRepository;
import com.ryuqq.pipeline.core.statemachine.Stage;
import com.ryuqq.pipeline.core.statemachine.StageTransition;
import com.ryuqq.pipeline.core.statemachine.TransitionKind;
import com.ryuqq.pipeline.core.transport.EventTransport;
import com.ryuqq.pipeline.core.validation.ValidationResult;
import com.ryuqq.pipeline.core.validation.ValidationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 상품 파이프라인 상태 머신.
 *
 * <p>항목별 {@link ReentrantLock}으로 같은 항목에 대한 전이/검증 요청/결과 반영을 직렬화합니다.
 * 서로 다른 항목은 독립적으로 진행됩니다.</p>
 *
 * <p><strong>진행 규칙:</strong></p>
 * <ul>
 *   <li>종료 단계(COMPLETE, CANCELLED)에서는 어떤 전이도 불가</li>
 *   <li>현재 단계가 요구하는 검증이 모두 APPROVED여야 다음 단계로 진행</li>
 *   <li>요청하지 않았거나 대기 중인 검증 → {@link InvalidTransitionException}</li>
 *   <li>REJECTED/TIMED_OUT 검증 → {@link ValidationRejectedException}</li>
 *   <li>expectedStage가 현재 단계와 다르면 동시 수정 충돌 → {@link InvalidTransitionException}</li>
 * </ul>
 *
 * <p>전이가 저장된 뒤 잠금 밖에서 통지 이벤트를 발행합니다. 통지 실패는 로그로만 남고
 * 전이를 되돌리지 않습니다.</p>
 *
 * <p>검증 요청도 잠금 안에서는 대기 기록만 저장하고, 요청 봉투는 잠금을 놓은 뒤 발행합니다.
 * 발행이 실패하면 다시 잠금을 잡고 대기 기록을 지웁니다.</p>
 *
 * <p>종료 단계에 들어간 항목의 잠금은 맵에서 제거됩니다. 종료 단계는 더 이상 바뀌지 않으므로
 * 이후 호출이 새 잠금을 만들어도 모두 종료 단계 검사에서 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PipelineStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PipelineStateMachine.class);

    private final PipelineItemRepository repository;
    private final ValidationOrchestrator validations;
    private final EventTransport transport;
    private final GatePolicy gatePolicy;
    private final Clock clock;

    private final Map<PipelineItemId, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param repository 항목 저장소
     * @param validations 검증 관리자
     * @param transport 통지 발행용 전송
     * @param gatePolicy 단계별 게이트 정책
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PipelineStateMachine(
        PipelineItemRepository repository,
        ValidationOrchestrator validations,
        EventTransport transport,
        GatePolicy gatePolicy,
        Clock clock
    ) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (validations == null) {
            throw new IllegalArgumentException("validations cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (gatePolicy == null) {
            throw new IllegalArgumentException("gatePolicy cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.repository = repository;
        this.validations = validations;
        this.transport = transport;
        this.gatePolicy = gatePolicy;
        this.clock = clock;
    }

    public GatePolicy gatePolicy() {
        return gatePolicy;
    }

    // ============================================================
    // Creation & transitions
    // ============================================================

    /**
     * DISCOVERY 단계 항목 생성.
     *
     * @return 생성된 항목
     */
    public PipelineItem create(String title, String category, String actor) {
        PipelineItem item = PipelineItem.create(PipelineItemId.generate(), title, category, actor, clock.instant());
        repository.save(item);
        log.info("Pipeline item {} created by {}: {}", item.id().getValue(), actor, title);
        publishNotices(null, item);
        return item;
    }

    /**
     * 다음 단계로 진행.
     *
     * <p>잠금을 잡기 전에 읽은 단계를 기대 단계로 사용하므로, 같은 단계에서 경쟁한 호출 중
     * 하나만 전이하고 나머지는 충돌로 실패합니다.</p>
     *
     * @see #advance(PipelineItemId, String, Stage)
     */
    public PipelineItem advance(PipelineItemId id, String actor) {
        Stage observed = load(id).currentStage();
        return advance(id, actor, observed);
    }

    /**
     * 다음 단계로 진행 (낙관적 충돌 검사).
     *
     * @param id 항목 ID
     * @param actor 수행자
     * @param expectedStage 호출자가 관찰한 현재 단계
     * @return 진행된 항목
     * @throws NotFoundException 항목이 없는 경우
     * @throws InvalidTransitionException 종료 단계, 게이트 미충족, 단계 불일치
     * @throws ValidationRejectedException 게이트 검증이 거절/시간 초과된 경우
     */
    public PipelineItem advance(PipelineItemId id, String actor, Stage expectedStage) {
        if (expectedStage == null) {
            throw new IllegalArgumentException("expectedStage cannot be null");
        }
        Change change = withLock(id, () -> {
            PipelineItem item = load(id);
            Stage current = item.currentStage();
            if (current != expectedStage) {
                throw new InvalidTransitionException(String.format(
                    "Conflict on %s: expected stage %s but was %s", id.getValue(), expectedStage, current));
            }
            if (current.isTerminal()) {
                throw new InvalidTransitionException(
                    "Cannot advance " + id.getValue() + " from terminal stage " + current);
            }
            checkGate(item);

            Stage next = StageTransition.transition(current, current.next(), TransitionKind.ADVANCE);
            PipelineItem updated = item.withStage(next, TransitionKind.ADVANCE, actor, null, clock.instant());
            repository.save(updated);
            log.info("Pipeline item {} advanced {} → {} by {}", id.getValue(), current, next, actor);
            return new Change(item, updated);
        });
        releaseIfTerminal(change.after());
        publishNotices(change.before(), change.after());
        return change.after();
    }

    /**
     * 관리자 단계 변경 (앞/뒤 이동, CANCELLED 제외).
     *
     * <p>대기 중인 검증은 취소되고 검증 기록은 초기화됩니다.</p>
     */
    public PipelineItem override(PipelineItemId id, String actor, Stage target, String reason) {
        Change change = withLock(id, () -> {
            PipelineItem item = load(id);
            Stage current = item.currentStage();
            StageTransition.validate(current, target, TransitionKind.OVERRIDE);
            int cancelled = validations.cancelAll(id, "stage overridden to " + target);
            PipelineItem updated = item.withStage(target, TransitionKind.OVERRIDE, actor, reason, clock.instant());
            repository.save(updated);
            log.warn("Pipeline item {} overridden {} → {} by {} ({} validations cancelled): {}",
                id.getValue(), current, target, actor, cancelled, reason);
            return new Change(item, updated);
        });
        publishNotices(change.before(), change.after());
        return change.after();
    }

    /**
     * 항목 취소 (비종료 단계에서만).
     */
    public PipelineItem cancel(PipelineItemId id, String actor, String reason) {
        Change change = withLock(id, () -> {
            PipelineItem item = load(id);
            Stage current = item.currentStage();
            StageTransition.validate(current, Stage.CANCELLED, TransitionKind.CANCEL);
            int cancelled = validations.cancelAll(id, "pipeline item cancelled");
            PipelineItem updated = item.withStage(Stage.CANCELLED, TransitionKind.CANCEL, actor, reason, clock.instant());
            repository.save(updated);
            log.info("Pipeline item {} cancelled at {} by {} ({} validations cancelled): {}",
                id.getValue(), current, actor, cancelled, reason);
            return new Change(item, updated);
        });
        releaseIfTerminal(change.after());
        publishNotices(change.before(), change.after());
        return change.after();
    }

    private void checkGate(PipelineItem item) {
        Stage current = item.currentStage();
        for (ValidationType type : gatePolicy.requiredFor(current)) {
            Optional<ValidationState> outcome = item.outcome(type);
            if (outcome.isPresent() && outcome.get().isBlocking()) {
                throw new ValidationRejectedException(String.format(
                    "%s for %s is %s; cannot leave %s", type.wireName(), item.id().getValue(), outcome.get(), current));
            }
        }
        if (item.blocked()) {
            throw new ValidationRejectedException(
                "Pipeline item " + item.id().getValue() + " is blocked by a rejected validation");
        }
        for (ValidationType type : gatePolicy.requiredFor(current)) {
            Optional<ValidationState> outcome = item.outcome(type);
            if (outcome.isEmpty()) {
                throw new InvalidTransitionException(String.format(
                    "%s required to leave %s has not been requested for %s",
                    type.wireName(), current, item.id().getValue()));
            }
            if (outcome.get() == ValidationState.WAITING) {
                throw new InvalidTransitionException(String.format(
                    "%s required to leave %s is still waiting for %s",
                    type.wireName(), current, item.id().getValue()));
            }
        }
    }

    // ============================================================
    // Validations
    // ============================================================

    /**
     * 현재 단계 게이트 검증 요청 (기본 기한, 기본 본문).
     */
    public ValidationHandle validate(PipelineItemId id, ValidationType type) {
        return validate(id, type, null, null);
    }

    /**
     * 현재 단계 게이트 검증 요청.
     *
     * <p>같은 종류가 이미 대기 중이면 새 요청 없이 기존 핸들을 반환합니다.</p>
     *
     * @param payload 추가 요청 본문 (null 허용)
     * @param timeout 응답 기한 (null이면 기본값)
     * @return 결과 핸들
     * @throws InvalidTransitionException 종료 단계이거나 현재 단계가 요구하지 않는 검증, 이미 승인된 검증
     * @throws ValidationRejectedException 이전 거절/시간 초과가 해제되지 않은 경우
     */
    public ValidationHandle validate(PipelineItemId id, ValidationType type, Map<String, Object> payload, Duration timeout) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Issue issue = withLock(id, () -> plan(load(id), type, payload, timeout));
        return dispatch(issue);
    }

    /**
     * 현재 단계가 요구하는 검증 중 아직 요청되지 않은 것을 모두 요청.
     *
     * <p>대기 중인 검증은 기존 핸들을 포함하고, 승인된 검증은 건너뜁니다.
     * 요청 봉투는 대기 기록을 모두 저장하고 잠금을 놓은 뒤 발행합니다.</p>
     *
     * @return 대기 중인 검증 핸들 목록
     */
    public List<ValidationHandle> requestValidations(PipelineItemId id) {
        List<Issue> issues = withLock(id, () -> {
            List<Issue> planned = new ArrayList<>();
            for (ValidationType type : gatePolicy.requiredFor(load(id).currentStage())) {
                PipelineItem item = load(id);
                Optional<ValidationState> outcome = item.outcome(type);
                if (outcome.isPresent() && outcome.get() == ValidationState.APPROVED) {
                    continue;
                }
                planned.add(plan(item, type, null, null));
            }
            return planned;
        });
        List<ValidationHandle> handles = new ArrayList<>();
        for (int i = 0; i < issues.size(); i++) {
            try {
                handles.add(dispatch(issues.get(i)));
            } catch (RuntimeException e) {
                // 발행하지 못한 나머지 요청도 철회
                for (Issue unsent : issues.subList(i + 1, issues.size())) {
                    if (unsent.prepared() != null) {
                        validations.cancel(unsent.handle().getCorrelationId(), "earlier request not delivered");
                        discardPending(unsent.handle());
                    }
                }
                throw e;
            }
        }
        return handles;
    }

    /**
     * 잠금 안에서 요청 가능 여부를 확인하고 대기 기록을 저장.
     */
    private Issue plan(PipelineItem item, ValidationType type, Map<String, Object> payload, Duration timeout) {
        PipelineItemId id = item.id();
        Stage current = item.currentStage();
        if (current.isTerminal()) {
            throw new InvalidTransitionException(
                "Cannot request " + type.wireName() + " for " + id.getValue() + " at terminal stage " + current);
        }
        if (!gatePolicy.requiredFor(current).contains(type)) {
            throw new InvalidTransitionException(
                type.wireName() + " is not required at stage " + current);
        }

        Optional<ValidationState> outcome = item.outcome(type);
        if (outcome.isPresent()) {
            switch (outcome.get()) {
                case WAITING -> {
                    Optional<ValidationHandle> existing = existingHandle(item, type);
                    if (existing.isPresent()) {
                        log.debug("{} already pending for {}, reusing request", type.wireName(), id.getValue());
                        return new Issue(existing.get(), null);
                    }
                }
                case REJECTED, TIMED_OUT -> throw new ValidationRejectedException(String.format(
                    "%s for %s is %s; clear the rejection before re-requesting",
                    type.wireName(), id.getValue(), outcome.get()));
                case APPROVED -> throw new InvalidTransitionException(
                    type.wireName() + " already approved for " + id.getValue() + " at " + current);
            }
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pipeline_item_id", id.getValue());
        body.put("title", item.title());
        body.put("category", item.category());
        body.put("stage", stageName(current));
        if (payload != null) {
            body.putAll(payload);
        }

        ValidationOrchestrator.PreparedRequest prepared = validations.prepareValidation(id, type, body, timeout);
        repository.save(item.withPendingValidation(prepared.handle().getCorrelationId(), type, clock.instant()));
        return new Issue(prepared.handle(), prepared);
    }

    /**
     * 잠금 밖에서 준비된 요청을 발행. 실패하면 대기 기록을 지우고 예외를 전파합니다.
     */
    private ValidationHandle dispatch(Issue issue) {
        if (issue.prepared() == null) {
            return issue.handle();
        }
        try {
            return validations.send(issue.prepared());
        } catch (RuntimeException e) {
            discardPending(issue.handle());
            throw e;
        }
    }

    private void discardPending(ValidationHandle handle) {
        PipelineItemId id = handle.getPipelineItemId();
        CorrelationId correlationId = handle.getCorrelationId();
        withLock(id, () -> {
            Optional<PipelineItem> found = repository.findById(id);
            if (found.isPresent() && found.get().pendingValidationIds().contains(correlationId)) {
                repository.save(found.get().withoutPendingValidation(correlationId, clock.instant()));
                log.info("Pipeline item {} {} request {} withdrawn after delivery failure",
                    id.getValue(), handle.getType().wireName(), correlationId.getValue());
            }
            return null;
        });
    }

    private Optional<ValidationHandle> existingHandle(PipelineItem item, ValidationType type) {
        for (Map.Entry<CorrelationId, ValidationType> entry : item.pendingValidations().entrySet()) {
            if (entry.getValue() == type) {
                return validations.handle(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * 검증 결과 반영 (검증 관리자의 결과 리스너).
     *
     * <p>항목이 더 이상 기다리지 않는 상관 ID(취소, 단계 변경)는 무시합니다.</p>
     */
    public void recordValidationResult(ValidationResult result) {
        PipelineItemId id = result.pipelineItemId();
        withLock(id, () -> {
            Optional<PipelineItem> found = repository.findById(id);
            if (found.isEmpty()) {
                log.warn("Validation result {} for unknown item {} ignored",
                    result.correlationId().getValue(), id.getValue());
                return null;
            }
            PipelineItem item = found.get();
            if (!item.pendingValidationIds().contains(result.correlationId())) {
                log.debug("Stale validation result {} for {} ignored", result.correlationId().getValue(), id.getValue());
                return null;
            }
            PipelineItem updated = item.withValidationResult(result.correlationId(), result.state(), clock.instant());
            repository.save(updated);
            if (result.state().isBlocking()) {
                log.warn("Pipeline item {} blocked at {}: {} {} ({})", id.getValue(), item.currentStage(),
                    result.type().wireName(), result.state(), result.summary());
            } else {
                log.info("Pipeline item {} {} approved at {}", id.getValue(), result.type().wireName(), item.currentStage());
            }
            return null;
        });
    }

    /**
     * 거절/시간 초과 해제 (재요청 허용).
     *
     * @throws InvalidTransitionException 해제할 거절이 없는 경우
     */
    public PipelineItem clearRejection(PipelineItemId id, ValidationType type, String actor) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor cannot be null or blank");
        }
        return withLock(id, () -> {
            PipelineItem item = load(id);
            Optional<ValidationState> outcome = item.outcome(type);
            if (outcome.isEmpty() || !outcome.get().isBlocking()) {
                throw new InvalidTransitionException(
                    "No rejected " + type.wireName() + " to clear on " + id.getValue());
            }
            PipelineItem updated = item.withoutOutcome(type, clock.instant());
            repository.save(updated);
            log.info("Pipeline item {} {} {} cleared by {}", id.getValue(), type.wireName(), outcome.get(), actor);
            return updated;
        });
    }

    // ============================================================
    // Query
    // ============================================================

    /**
     * @throws NotFoundException 항목이 없는 경우
     */
    public PipelineItem get(PipelineItemId id) {
        return load(id);
    }

    public Optional<PipelineItem> find(PipelineItemId id) {
        return repository.findById(id);
    }

    /**
     * @param stage 단계 필터 (null이면 전체)
     */
    public List<PipelineItem> list(Stage stage) {
        return repository.list(stage);
    }

    // ============================================================
    // Internal
    // ============================================================

    private PipelineItem load(PipelineItemId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return repository.findById(id)
            .orElseThrow(() -> new NotFoundException("Pipeline item not found: " + id.getValue()));
    }

    private <T> T withLock(PipelineItemId id, Supplier<T> action) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        ReentrantLock lock = locks.computeIfAbsent(id, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void releaseIfTerminal(PipelineItem item) {
        if (item.isTerminal()) {
            locks.remove(item.id());
        }
    }

    int lockCount() {
        return locks.size();
    }

    private void publishNotices(PipelineItem before, PipelineItem after) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pipeline_item_id", after.id().getValue());
        payload.put("title", after.title());
        payload.put("category", after.category());
        payload.put("from_stage", before == null ? null : stageName(before.currentStage()));
        payload.put("to_stage", stageName(after.currentStage()));
        payload.put("transition", after.lastTransition().kind().name().toLowerCase(Locale.ROOT));
        payload.put("actor", after.lastTransition().actor());

        notify(EventKind.PRODUCT_PIPELINE_UPDATED, ModuleName.EXECUTIVE, payload);
        if (after.currentStage() == Stage.COMPLETE) {
            notify(EventKind.PRODUCT_APPROVED_FOR_PRODUCTION, ModuleName.OPERATIONS, payload);
            notify(EventKind.PRODUCT_BUDGET_ALLOCATED, ModuleName.FINANCE, payload);
            notify(EventKind.PRODUCT_LAUNCH_SCHEDULED, ModuleName.MARKETING, payload);
        }
    }

    private void notify(EventKind kind, ModuleName target, Map<String, Object> payload) {
        EventEnvelope notice = EventEnvelope.create(
            kind.wireName(), transport.localModule(), target, payload, null, clock.instant());
        try {
            transport.publishAsync(notice).whenComplete((receipt, error) -> {
                if (error != null) {
                    log.warn("Notice {} to {} for {} not delivered: {}",
                        kind.wireName(), target.wireName(), payload.get("pipeline_item_id"), error.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.warn("Notice {} to {} for {} not published: {}",
                kind.wireName(), target.wireName(), payload.get("pipeline_item_id"), e.getMessage());
        }
    }

    private static String stageName(Stage stage) {
        return stage.name().toLowerCase(Locale.ROOT);
    }

    private record Change(PipelineItem before, PipelineItem after) {
    }

    /**
     * @param handle 반환할 핸들
     * @param prepared 발행할 요청 (기존 요청을 재사용하면 null)
     */
    private record Issue(ValidationHandle handle, ValidationOrchestrator.PreparedRequest prepared) {
    }
}
