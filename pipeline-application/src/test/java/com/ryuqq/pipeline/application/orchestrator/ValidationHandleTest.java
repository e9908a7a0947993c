package com.ryuqq.pipeline.application.orchestrator;

import com.ryuqq.pipeline.core.exception.ValidationRejectedException;
import com.ryuqq.pipeline.core.exception.ValidationTimeoutException;
import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.validation.ValidationResult;
import com.ryuqq.pipeline.core.validation.ValidationState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ValidationHandle 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ValidationHandleTest {

    private static final CorrelationId CORRELATION_ID = CorrelationId.of("corr-1");
    private static final PipelineItemId ITEM_ID = PipelineItemId.of("item-1");
    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    private ValidationHandle handle(CompletableFuture<ValidationResult> future) {
        return new ValidationHandle(CORRELATION_ID, ITEM_ID, ValidationType.MARGIN_CHECK,
            NOW.plusSeconds(30), future);
    }

    private ValidationResult result(ValidationState state) {
        return new ValidationResult(CORRELATION_ID, ITEM_ID, ValidationType.MARGIN_CHECK, state, "summary", NOW);
    }

    @Test
    void 승인된_결과는_awaitApproval로_반환된다() {
        // given
        ValidationHandle handle = handle(CompletableFuture.completedFuture(result(ValidationState.APPROVED)));

        // when
        ValidationResult resolved = handle.awaitApproval(Duration.ofMillis(100));

        // then
        assertThat(resolved.isApproved()).isTrue();
        assertThat(handle.isDone()).isTrue();
    }

    @Test
    void 거절된_결과는_ValidationRejectedException() {
        // given
        ValidationHandle handle = handle(CompletableFuture.completedFuture(result(ValidationState.REJECTED)));

        // when & then
        assertThatThrownBy(() -> handle.awaitApproval(Duration.ofMillis(100)))
            .isInstanceOf(ValidationRejectedException.class)
            .hasMessageContaining("MARGIN_CHECK");
    }

    @Test
    void 기한_초과_결과는_승인으로_취급되지_않는다() {
        // given
        ValidationHandle handle = handle(CompletableFuture.completedFuture(result(ValidationState.TIMED_OUT)));

        // when & then
        assertThat(handle.await(Duration.ofMillis(100)).state()).isEqualTo(ValidationState.TIMED_OUT);
        assertThatThrownBy(() -> handle.awaitApproval(Duration.ofMillis(100)))
            .isInstanceOf(ValidationTimeoutException.class);
    }

    @Test
    void 대기_시간_안에_해결되지_않으면_ValidationTimeoutException() {
        // given
        ValidationHandle handle = handle(new CompletableFuture<>());

        // when & then
        assertThatThrownBy(() -> handle.await(Duration.ofMillis(20)))
            .isInstanceOf(ValidationTimeoutException.class)
            .hasMessageContaining("corr-1");
        assertThat(handle.isDone()).isFalse();
    }

    @Test
    void 취소된_요청은_CancellationException() {
        // given
        CompletableFuture<ValidationResult> future = new CompletableFuture<>();
        future.completeExceptionally(new CancellationException("item cancelled"));
        ValidationHandle handle = handle(future);

        // when & then
        assertThatThrownBy(() -> handle.await(Duration.ofMillis(100)))
            .isInstanceOf(CancellationException.class);
    }

    @Test
    void null_인자는_IllegalArgumentException() {
        assertThatThrownBy(() -> new ValidationHandle(null, ITEM_ID, ValidationType.MARGIN_CHECK, NOW,
            new CompletableFuture<>()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("correlationId cannot be null");
        assertThatThrownBy(() -> new ValidationHandle(CORRELATION_ID, ITEM_ID, ValidationType.MARGIN_CHECK, NOW, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("result cannot be null");
    }
}
