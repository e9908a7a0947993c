package com.ryuqq.pipeline.core.validation;

import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.model.Verdict;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PendingValidation 테스트.
 *
 * <p>첫 번째 해결만 반영되고 이후 해결 시도는 false를 반환해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PendingValidationTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private PendingValidation pending() {
        return new PendingValidation(CorrelationId.of("corr-1"), PipelineItemId.of("item-1"),
            ValidationType.MARGIN_CHECK, T0, T0.plus(Duration.ofHours(48)));
    }

    @Test
    void resolve_FirstWriteWins() {
        // Given
        PendingValidation pending = pending();

        // When
        boolean first = pending.resolve(ValidationState.APPROVED, "margin 42%", T0.plusSeconds(5));
        boolean second = pending.resolve(ValidationState.REJECTED, "late", T0.plusSeconds(6));

        // Then
        assertTrue(first);
        assertFalse(second);
        assertEquals(ValidationState.APPROVED, pending.state());
        assertEquals("margin 42%", pending.summary().orElseThrow());
        assertEquals(T0.plusSeconds(5), pending.resolvedAt().orElseThrow());
    }

    @Test
    void resolve_ConcurrentAttempts_ExactlyOneSucceeds() throws Exception {
        // Given
        PendingValidation pending = pending();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            ValidationState target = i % 2 == 0 ? ValidationState.APPROVED : ValidationState.TIMED_OUT;
            futures.add(executor.submit(() -> {
                start.await();
                return pending.resolve(target, null, T0.plusSeconds(1));
            }));
        }
        start.countDown();
        int winners = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        executor.shutdownNow();

        // Then
        assertEquals(1, winners);
        assertTrue(pending.state().isResolved());
    }

    @Test
    void resolve_WaitingTarget_ThrowsIllegalArgument() {
        PendingValidation pending = pending();

        assertThrows(IllegalArgumentException.class, () -> pending.resolve(ValidationState.WAITING, null, T0));
        assertThrows(IllegalArgumentException.class, () -> pending.resolve(null, null, T0));
        assertThrows(IllegalArgumentException.class, () -> pending.resolve(ValidationState.APPROVED, null, null));
    }

    @Test
    void isOverdue_AtDeadlineBoundary() {
        // Given
        PendingValidation pending = pending();
        Instant deadline = pending.deadline();

        // When & Then
        assertFalse(pending.isOverdue(deadline.minusMillis(1)));
        assertTrue(pending.isOverdue(deadline));
        assertTrue(pending.isOverdue(deadline.plusSeconds(60)));
    }

    @Test
    void isOverdue_ResolvedValidation_ReturnsFalse() {
        PendingValidation pending = pending();
        pending.resolve(ValidationState.REJECTED, null, T0);

        assertFalse(pending.isOverdue(pending.deadline().plusSeconds(1)));
    }

    @Test
    void result_EmptyUntilResolved() {
        // Given
        PendingValidation pending = pending();
        assertTrue(pending.result().isEmpty());

        // When
        pending.resolve(ValidationState.TIMED_OUT, "no response", T0.plusSeconds(10));

        // Then
        ValidationResult result = pending.result().orElseThrow();
        assertEquals(CorrelationId.of("corr-1"), result.correlationId());
        assertEquals(ValidationType.MARGIN_CHECK, result.type());
        assertEquals(ValidationState.TIMED_OUT, result.state());
        assertFalse(result.isApproved());
    }

    @Test
    void constructor_DeadlineBeforeIssue_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new PendingValidation(CorrelationId.of("c"),
            PipelineItemId.of("i"), ValidationType.CAPACITY_CHECK, T0, T0.minusSeconds(1)));
    }

    @Test
    void validationState_FromVerdictAndBlocking() {
        assertEquals(ValidationState.APPROVED, ValidationState.from(Verdict.APPROVED));
        assertTrue(ValidationState.REJECTED.isBlocking());
        assertTrue(ValidationState.TIMED_OUT.isBlocking());
        assertFalse(ValidationState.WAITING.isResolved());
    }
}
