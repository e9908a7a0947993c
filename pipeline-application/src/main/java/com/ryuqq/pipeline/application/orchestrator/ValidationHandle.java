package com.ryuqq.pipeline.application.orchestrator;

import com.ryuqq.pipeline.core.exception.ValidationRejectedException;
import com.ryuqq.pipeline.core.exception.ValidationTimeoutException;
import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.validation.ValidationResult;
import com.ryuqq.pipeline.core.validation.ValidationState;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 검증 요청 핸들.
 *
 * <p>검증 요청은 즉시 반환되고, 응답 또는 기한 초과는 나중에 {@link #result()}로 전달됩니다.
 * 요청 호출은 원격 응답을 기다리며 블로킹하지 않습니다.</p>
 *
 * <p><strong>완료 방식:</strong></p>
 * <ul>
 *   <li>응답 도착 - APPROVED 또는 REJECTED 결과로 정상 완료</li>
 *   <li>기한 초과 - TIMED_OUT 결과로 정상 완료 (fail-closed)</li>
 *   <li>요청 취소 (아이템 취소 등) - {@link CancellationException}으로 예외 완료</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ValidationHandle handle = orchestrator.requestValidation(itemId, ValidationType.MARGIN_CHECK, payload);
 *
 * // 비동기
 * handle.result().thenAccept(result -&gt; log.info("resolved: {}", result.state()));
 *
 * // 동기 대기 (테스트, 배치)
 * ValidationResult approved = handle.awaitApproval(Duration.ofSeconds(5));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ValidationHandle {

    private final CorrelationId correlationId;
    private final PipelineItemId pipelineItemId;
    private final ValidationType type;
    private final Instant deadline;
    private final CompletableFuture<ValidationResult> result;

    /**
     * @param correlationId 상관관계 식별자
     * @param pipelineItemId 대상 아이템
     * @param type 검증 종류
     * @param deadline 응답 기한
     * @param result 검증 오케스트레이터가 완료시키는 future
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ValidationHandle(
        CorrelationId correlationId,
        PipelineItemId pipelineItemId,
        ValidationType type,
        Instant deadline,
        CompletableFuture<ValidationResult> result
    ) {
        if (correlationId == null) {
            throw new IllegalArgumentException("correlationId cannot be null");
        }
        if (pipelineItemId == null) {
            throw new IllegalArgumentException("pipelineItemId cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (deadline == null) {
            throw new IllegalArgumentException("deadline cannot be null");
        }
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        this.correlationId = correlationId;
        this.pipelineItemId = pipelineItemId;
        this.type = type;
        this.deadline = deadline;
        this.result = result;
    }

    public CorrelationId getCorrelationId() {
        return correlationId;
    }

    public PipelineItemId getPipelineItemId() {
        return pipelineItemId;
    }

    public ValidationType getType() {
        return type;
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * 결과 future 조회.
     *
     * <p><strong>주의:</strong> 완료는 검증 오케스트레이터만 수행합니다. 호출자가 직접 완료시키지 마세요.</p>
     *
     * @return 검증 결과 future
     */
    public CompletableFuture<ValidationResult> result() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * 결과를 기다린 뒤 승인 여부를 확인.
     *
     * @param maxWait 최대 대기 시간
     * @return 승인된 결과
     * @throws ValidationRejectedException 거절된 경우
     * @throws ValidationTimeoutException 기한을 넘겼거나 maxWait 안에 해결되지 않은 경우
     * @throws CancellationException 요청이 취소된 경우
     */
    public ValidationResult awaitApproval(Duration maxWait) {
        ValidationResult resolved = await(maxWait);
        if (resolved.state() == ValidationState.TIMED_OUT) {
            throw new ValidationTimeoutException(
                type + " timed out for " + pipelineItemId.getValue() + " (" + correlationId.getValue() + ")");
        }
        if (!resolved.isApproved()) {
            throw new ValidationRejectedException(
                type + " rejected for " + pipelineItemId.getValue() + ": " + resolved.summary());
        }
        return resolved;
    }

    /**
     * 결과를 기다림.
     *
     * @param maxWait 최대 대기 시간
     * @return 해결된 결과 (TIMED_OUT 포함)
     * @throws ValidationTimeoutException maxWait 안에 해결되지 않은 경우
     * @throws CancellationException 요청이 취소된 경우
     */
    public ValidationResult await(Duration maxWait) {
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be null or negative");
        }
        try {
            return result.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Waiting for validation interrupted", e);
        } catch (TimeoutException e) {
            throw new ValidationTimeoutException(
                type + " not resolved within " + maxWait + " (" + correlationId.getValue() + ")");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Validation failed: " + correlationId.getValue(), cause);
        }
    }

    @Override
    public String toString() {
        return "ValidationHandle{" + correlationId.getValue()
            + ", item=" + pipelineItemId.getValue()
            + ", type=" + type
            + ", deadline=" + deadline
            + ", done=" + result.isDone() + '}';
    }
}
