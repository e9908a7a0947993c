package com.ryuqq.pipeline.adapter.runner.validation;

import com.ryuqq.pipeline.application.orchestrator.ValidationHandle;
import com.ryuqq.pipeline.application.runtime.ManagedLifecycle;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.exception.AlreadyResolvedException;
import com.ryuqq.pipeline.core.exception.NotFoundException;
import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.model.Verdict;
import com.ryuqq.pipeline.core.spi.DeduplicationRegistry;
import com.ryuqq.pipeline.core.transport.EventTransport;
import com.ryuqq.pipeline.core.transport.Subscription;
import com.ryuqq.pipeline.core.validation.PendingValidation;
import com.ryuqq.pipeline.core.validation.ValidationResult;
import com.ryuqq.pipeline.core.validation.ValidationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 교차 모듈 검증 요청/응답 상관 관리자.
 *
 * <p>검증 요청마다 새 상관 ID를 발급해 대기 기록을 만들고, 응답 모듈로 요청을 발행한 뒤
 * 응답 또는 기한 초과 중 먼저 일어난 쪽으로 결과를 확정합니다.</p>
 *
 * <p><strong>확정 규칙:</strong></p>
 * <ul>
 *   <li>첫 번째 확정만 유효 (응답과 기한 초과가 경쟁해도 결과는 하나)</li>
 *   <li>알 수 없는 상관 ID, 이미 확정된 기록에 대한 응답은 로그 후 폐기</li>
 *   <li>판정을 읽을 수 없는 응답은 승인으로 간주하지 않고 폐기 (fail-closed)</li>
 *   <li>기한 초과는 TIMED_OUT으로 확정되며 승인이 아님</li>
 * </ul>
 *
 * <p><strong>결과 통지 순서:</strong> 결과 리스너(상태 머신)에 먼저 통지한 뒤 핸들을 완료합니다.
 * 핸들 완료를 관찰한 호출자는 항목에 결과가 반영된 상태를 봅니다.</p>
 *
 * <p>종료 시 아직 대기 중인 핸들은 취소 상태로 완료됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ValidationOrchestrator implements ManagedLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ValidationOrchestrator.class);

    static final String CONSUMER_NAME = "validation-orchestrator";

    private enum State { NEW, RUNNING, STOPPED }

    private final EventTransport transport;
    private final DeduplicationRegistry deduplication;
    private final ValidationConfig config;
    private final Clock clock;

    private final Map<CorrelationId, Entry> pending = new ConcurrentHashMap<>();
    private final List<Consumer<ValidationResult>> resultListeners = new CopyOnWriteArrayList<>();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

    private volatile ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param transport 이벤트 전송
     * @param deduplication 응답 중복 제거 저장소
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ValidationOrchestrator(
        EventTransport transport,
        DeduplicationRegistry deduplication,
        ValidationConfig config,
        Clock clock
    ) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (deduplication == null) {
            throw new IllegalArgumentException("deduplication cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.transport = transport;
        this.deduplication = deduplication;
        this.config = config;
        this.clock = clock;
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Override
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("ValidationOrchestrator already started or stopped");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-validation-timer");
            thread.setDaemon(true);
            return thread;
        });
        for (ValidationType type : ValidationType.values()) {
            subscriptions.add(transport.subscribe(type.responseKind(), this::onResponseEvent));
        }
        log.info("ValidationOrchestrator started (default timeout: {}ms)", config.defaultTimeoutMs());
    }

    @Override
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            state.compareAndSet(State.NEW, State.STOPPED);
            return;
        }
        for (Subscription subscription : subscriptions) {
            transport.unsubscribe(subscription);
        }
        subscriptions.clear();
        scheduler.shutdownNow();

        int abandoned = 0;
        for (Map.Entry<CorrelationId, Entry> waiting : pending.entrySet()) {
            Entry entry = waiting.getValue();
            if (entry.record.state() == ValidationState.WAITING && pending.remove(waiting.getKey(), entry)) {
                entry.cancelTimer();
                entry.future.cancel(false);
                abandoned++;
            }
        }
        log.info("ValidationOrchestrator stopped ({} waiting validations cancelled, {} records retained)",
            abandoned, pending.size());
    }

    @Override
    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /**
     * 결과 확정 리스너 등록.
     *
     * <p>리스너는 확정한 스레드에서 호출되며, 예외는 로그로만 남습니다.</p>
     */
    public void addResultListener(Consumer<ValidationResult> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        resultListeners.add(listener);
    }

    // ============================================================
    // Request
    // ============================================================

    /**
     * 기본 기한으로 검증 요청.
     *
     * @see #requestValidation(PipelineItemId, ValidationType, Map, Duration)
     */
    public ValidationHandle requestValidation(PipelineItemId itemId, ValidationType type, Map<String, Object> payload) {
        return requestValidation(itemId, type, payload, config.defaultTimeout());
    }

    /**
     * 검증 요청 발행.
     *
     * <p>{@link #prepareValidation}과 {@link #send}를 차례로 수행합니다.</p>
     *
     * @param itemId 검증 대상 항목
     * @param type 검증 종류 (응답 모듈 결정)
     * @param payload 요청 본문 (null 허용)
     * @param timeout 응답 기한
     * @return 결과 핸들
     * @throws com.ryuqq.pipeline.core.exception.DeliveryFailedException 요청을 전달하지 못한 경우
     */
    public ValidationHandle requestValidation(
        PipelineItemId itemId,
        ValidationType type,
        Map<String, Object> payload,
        Duration timeout
    ) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return send(prepareValidation(itemId, type, payload, timeout));
    }

    /**
     * 대기 기록 등록 (발행 전 단계).
     *
     * <p>상관 ID를 발급하고 대기 기록과 기한 타이머를 등록한 뒤 요청 봉투를 만듭니다.
     * 기록이 발행보다 먼저 등록되므로 아주 빠른 응답도 기록을 찾을 수 있습니다.
     * 발행은 하지 않으므로 호출자가 잠금을 잡고 있어도 원격 응답을 기다리지 않습니다.</p>
     *
     * @param itemId 검증 대상 항목
     * @param type 검증 종류
     * @param payload 요청 본문 (null 허용)
     * @param timeout 응답 기한 (null이면 기본 기한)
     * @return 발행 대기 중인 요청
     * @throws IllegalStateException 실행 중이 아닌 경우
     */
    public PreparedRequest prepareValidation(
        PipelineItemId itemId,
        ValidationType type,
        Map<String, Object> payload,
        Duration timeout
    ) {
        if (itemId == null) {
            throw new IllegalArgumentException("itemId cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Duration effective = timeout == null ? config.defaultTimeout() : timeout;
        if (effective.isNegative() || effective.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        requireRunning();

        Instant now = clock.instant();
        CorrelationId correlationId = CorrelationId.generate();
        PendingValidation record = new PendingValidation(correlationId, itemId, type, now, now.plus(effective));
        Entry entry = new Entry(record);
        pending.put(correlationId, entry);
        entry.timer = scheduler.schedule(() -> expire(correlationId), effective.toMillis(), TimeUnit.MILLISECONDS);

        Map<String, Object> body = new LinkedHashMap<>();
        if (payload != null) {
            body.putAll(payload);
        }
        body.put("validation_request_id", correlationId.getValue());
        body.put("request_type", type.wireName());
        body.put("pipeline_item_id", itemId.getValue());
        EventEnvelope request = EventEnvelope.create(
            type.requestKind().wireName(),
            transport.localModule(),
            type.responder(),
            body,
            correlationId.getValue(),
            now
        );
        return new PreparedRequest(entry.handle(), request);
    }

    /**
     * 준비된 요청 발행.
     *
     * <p>발행이 실패하면 기록과 타이머를 제거하고 핸들을 같은 예외로 완료한 뒤 예외를 그대로 전파합니다.</p>
     *
     * @param prepared {@link #prepareValidation}의 결과
     * @return 결과 핸들
     * @throws com.ryuqq.pipeline.core.exception.DeliveryFailedException 요청을 전달하지 못한 경우
     */
    public ValidationHandle send(PreparedRequest prepared) {
        if (prepared == null) {
            throw new IllegalArgumentException("prepared cannot be null");
        }
        ValidationHandle handle = prepared.handle();
        CorrelationId correlationId = handle.getCorrelationId();
        try {
            transport.publish(prepared.request());
        } catch (RuntimeException e) {
            Entry entry = pending.remove(correlationId);
            if (entry != null) {
                entry.cancelTimer();
                entry.future.completeExceptionally(e);
            }
            log.error("Validation request {} ({}) for {} could not be delivered: {}",
                correlationId.getValue(), handle.getType().wireName(), handle.getPipelineItemId().getValue(),
                e.getMessage());
            throw e;
        }

        log.info("Validation {} requested from {} for {} ({}), deadline {}",
            handle.getType().wireName(), handle.getType().responder().wireName(),
            handle.getPipelineItemId().getValue(), correlationId.getValue(), handle.getDeadline());
        return handle;
    }

    // ============================================================
    // Response
    // ============================================================

    /**
     * 응답 이벤트 처리 (전송 구독 핸들러).
     *
     * <p>예외를 던지지 않습니다. 처리할 수 없는 응답은 이유와 함께 로그로 남기고 버립니다.</p>
     */
    public void onResponseEvent(EventEnvelope envelope) {
        if (!deduplication.firstSeen(CONSUMER_NAME, envelope.id())) {
            log.debug("Duplicate response envelope {} ignored", envelope.id());
            return;
        }
        String correlationValue = envelope.correlationId() != null
            ? envelope.correlationId()
            : envelope.payloadString("validation_request_id");
        if (correlationValue == null || correlationValue.isBlank()) {
            log.warn("Response {} ({}) has no correlation id, discarded", envelope.id(), envelope.type());
            return;
        }

        CorrelationId correlationId = CorrelationId.of(correlationValue);
        Entry entry = pending.get(correlationId);
        if (entry == null) {
            log.warn("Response {} for unknown correlation id {} discarded", envelope.id(), correlationValue);
            return;
        }
        ValidationType expected = entry.record.requestType();
        if (ValidationType.forResponseKind(envelope.kind()).filter(expected::equals).isEmpty()) {
            log.warn("Response {} of type {} does not answer {} request {}, discarded",
                envelope.id(), envelope.type(), expected.wireName(), correlationValue);
            return;
        }

        Optional<Verdict> verdict = Verdict.fromPayload(envelope.payload());
        if (verdict.isEmpty()) {
            log.warn("Response {} for {} carries no readable verdict, discarded", envelope.id(), correlationValue);
            return;
        }

        if (!resolve(entry, ValidationState.from(verdict.get()), summaryOf(envelope))) {
            log.info("Response {} for {} arrived after resolution ({}), discarded",
                envelope.id(), correlationValue, entry.record.state());
        }
    }

    /**
     * 응답 직접 제출 (웹훅 외 경로, 운영자 입력 등).
     *
     * @return 확정된 결과
     * @throws NotFoundException 상관 ID를 알 수 없는 경우
     * @throws AlreadyResolvedException 이미 확정된 경우
     */
    public ValidationResult submitResponse(CorrelationId correlationId, Verdict verdict, String summary) {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        Entry entry = pending.get(correlationId);
        if (entry == null) {
            throw new NotFoundException("Unknown validation request: " + correlationId.getValue());
        }
        if (!resolve(entry, ValidationState.from(verdict), summary)) {
            throw new AlreadyResolvedException(
                "Validation " + correlationId.getValue() + " already resolved as " + entry.record.state());
        }
        return entry.record.result().orElseThrow();
    }

    // ============================================================
    // Timeout & cleanup
    // ============================================================

    /**
     * 기한 초과 처리.
     *
     * <p>아직 대기 중이면 TIMED_OUT으로 확정하고 로컬에 validation_timeout을 발행합니다.</p>
     *
     * @return 이번 호출로 확정했으면 true
     */
    public boolean expire(CorrelationId correlationId) {
        Entry entry = pending.get(correlationId);
        if (entry == null) {
            return false;
        }
        PendingValidation record = entry.record;
        if (!resolve(entry, ValidationState.TIMED_OUT, "no response before " + record.deadline())) {
            return false;
        }

        log.warn("Validation {} ({}) for {} timed out at {}",
            correlationId.getValue(), record.requestType().wireName(), record.pipelineItemId().getValue(), record.deadline());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("validation_request_id", correlationId.getValue());
        payload.put("request_type", record.requestType().wireName());
        payload.put("pipeline_item_id", record.pipelineItemId().getValue());
        payload.put("responder", record.requestType().responder().wireName());
        payload.put("deadline", record.deadline().toString());
        transport.dispatchLocal(EventEnvelope.create(
            EventKind.VALIDATION_TIMEOUT.wireName(),
            transport.localModule(),
            transport.localModule(),
            payload,
            correlationId.getValue(),
            clock.instant()
        ));
        return true;
    }

    /**
     * 기한이 지난 대기 기록 조회.
     */
    public List<CorrelationId> scanOverdue(Instant now, int limit) {
        List<CorrelationId> overdue = new ArrayList<>();
        for (Entry entry : pending.values()) {
            if (overdue.size() >= limit) {
                break;
            }
            if (entry.record.isOverdue(now)) {
                overdue.add(entry.record.correlationId());
            }
        }
        return overdue;
    }

    /**
     * 보존 시간이 지난 확정 기록 조회.
     */
    public List<CorrelationId> scanExpiredResolved(Instant now, int limit) {
        Instant cutoff = now.minusMillis(config.gracePeriodMs());
        List<CorrelationId> expired = new ArrayList<>();
        for (Entry entry : pending.values()) {
            if (expired.size() >= limit) {
                break;
            }
            Optional<Instant> resolvedAt = entry.record.resolvedAt();
            if (resolvedAt.isPresent() && !resolvedAt.get().isAfter(cutoff)) {
                expired.add(entry.record.correlationId());
            }
        }
        return expired;
    }

    /**
     * 확정된 기록 제거. 대기 중인 기록은 제거하지 않습니다.
     *
     * @return 제거했으면 true
     */
    public boolean purge(CorrelationId correlationId) {
        Entry entry = pending.get(correlationId);
        if (entry == null || !entry.record.state().isResolved()) {
            return false;
        }
        return pending.remove(correlationId, entry);
    }

    /**
     * 대기 중인 검증 취소.
     *
     * <p>기록을 제거하고 핸들을 취소 상태로 완료합니다. 이후 도착한 응답은 알 수 없는 상관 ID로 버려집니다.</p>
     *
     * @return 취소했으면 true
     */
    public boolean cancel(CorrelationId correlationId, String reason) {
        Entry entry = pending.get(correlationId);
        if (entry == null || entry.record.state().isResolved()) {
            return false;
        }
        if (!pending.remove(correlationId, entry)) {
            return false;
        }
        entry.cancelTimer();
        entry.future.cancel(false);
        log.info("Validation {} ({}) cancelled: {}",
            correlationId.getValue(), entry.record.requestType().wireName(), reason);
        return true;
    }

    /**
     * 항목의 대기 중 검증 전체 취소.
     *
     * @return 취소한 건수
     */
    public int cancelAll(PipelineItemId itemId, String reason) {
        int cancelled = 0;
        for (PendingValidation record : pendingFor(itemId)) {
            if (cancel(record.correlationId(), reason)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    // ============================================================
    // Query
    // ============================================================

    public Optional<PendingValidation> find(CorrelationId correlationId) {
        Entry entry = pending.get(correlationId);
        return entry == null ? Optional.empty() : Optional.of(entry.record);
    }

    public Optional<ValidationHandle> handle(CorrelationId correlationId) {
        Entry entry = pending.get(correlationId);
        return entry == null ? Optional.empty() : Optional.of(entry.handle());
    }

    /**
     * 항목의 대기 중(WAITING) 검증 목록.
     */
    public List<PendingValidation> pendingFor(PipelineItemId itemId) {
        List<PendingValidation> records = new ArrayList<>();
        for (Entry entry : pending.values()) {
            if (entry.record.pipelineItemId().equals(itemId)
                && entry.record.state() == ValidationState.WAITING) {
                records.add(entry.record);
            }
        }
        return records;
    }

    public int size() {
        return pending.size();
    }

    // ============================================================
    // Internal
    // ============================================================

    private boolean resolve(Entry entry, ValidationState target, String summary) {
        Instant now = clock.instant();
        if (!entry.record.resolve(target, summary, now)) {
            return false;
        }
        entry.cancelTimer();
        ValidationResult result = entry.record.result().orElseThrow();
        log.info("Validation {} ({}) for {} resolved: {}",
            result.correlationId().getValue(), result.type().wireName(), result.pipelineItemId().getValue(), target);

        for (Consumer<ValidationResult> listener : resultListeners) {
            try {
                listener.accept(result);
            } catch (RuntimeException e) {
                log.error("Validation result listener failed for {}", result.correlationId().getValue(), e);
            }
        }
        entry.future.complete(result);
        schedulePurge(result.correlationId());
        return true;
    }

    private void schedulePurge(CorrelationId correlationId) {
        ScheduledExecutorService timer = scheduler;
        if (timer == null || timer.isShutdown()) {
            return;
        }
        try {
            timer.schedule(() -> purge(correlationId), config.gracePeriodMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Purge of {} left to the reaper: scheduler stopped", correlationId.getValue());
        }
    }

    private void requireRunning() {
        if (state.get() != State.RUNNING) {
            throw new IllegalStateException("ValidationOrchestrator not running (state: " + state.get() + ")");
        }
    }

    private static String summaryOf(EventEnvelope envelope) {
        String summary = envelope.payloadString("summary");
        if (summary == null) {
            summary = envelope.payloadString("reason");
        }
        return summary;
    }

    /**
     * 등록되었지만 아직 발행되지 않은 검증 요청.
     *
     * @param handle 결과 핸들
     * @param request 발행할 요청 봉투
     */
    public record PreparedRequest(ValidationHandle handle, EventEnvelope request) {

        public PreparedRequest {
            if (handle == null) {
                throw new IllegalArgumentException("handle cannot be null");
            }
            if (request == null) {
                throw new IllegalArgumentException("request cannot be null");
            }
        }
    }

    private static final class Entry {

        private final PendingValidation record;
        private final CompletableFuture<ValidationResult> future = new CompletableFuture<>();
        private volatile ScheduledFuture<?> timer;

        private Entry(PendingValidation record) {
            this.record = record;
        }

        private ValidationHandle handle() {
            return new ValidationHandle(
                record.correlationId(), record.pipelineItemId(), record.requestType(), record.deadline(), future);
        }

        private void cancelTimer() {
            ScheduledFuture<?> current = timer;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
