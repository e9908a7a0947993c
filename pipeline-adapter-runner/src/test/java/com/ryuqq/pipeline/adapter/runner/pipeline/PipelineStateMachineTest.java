package com.ryuqq.pipeline.adapter.runner.pipeline;

import com.ryuqq.pipeline.adapter.inmemory.store.InMemoryDeduplicationRegistry;
import com.ryuqq.pipeline.adapter.inmemory.store.InMemoryPipelineItemRepository;
import com.ryuqq.pipeline.adapter.runner.validation.ValidationConfig;
import com.ryuqq.pipeline.adapter.runner.validation.ValidationOrchestrator;
import com.ryuqq.pipeline.application.orchestrator.ValidationHandle;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.exception.DeliveryFailedException;
import com.ryuqq.pipeline.core.exception.InvalidTransitionException;
import com.ryuqq.pipeline.core.exception.NotFoundException;
import com.ryuqq.pipeline.core.exception.ValidationRejectedException;
import com.ryuqq.pipeline.core.model.CorrelationId;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.model.Verdict;
import com.ryuqq.pipeline.core.pipeline.GatePolicy;
import com.ryuqq.pipeline.core.pipeline.PipelineItem;
import com.ryuqq.pipeline.core.pipeline.StageHistoryEntry;
import com.ryuqq.pipeline.core.statemachine.Stage;
import com.ryuqq.pipeline.core.statemachine.TransitionKind;
import com.ryuqq.pipeline.core.transport.EventTransport;
import com.ryuqq.pipeline.core.validation.ValidationResult;
import com.ryuqq.pipeline.core.validation.ValidationState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PipelineStateMachine 유닛 테스트.
 *
 * <p>실제 {@link ValidationOrchestrator}를 사용하고 전송만 Mock으로 대체합니다.
 * 응답은 {@link ValidationOrchestrator#submitResponse}로 주입합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class PipelineStateMachineTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");
    private static final String ACTOR = "designer@studio";

    @Mock
    private EventTransport transport;

    private InMemoryPipelineItemRepository repository;
    private ValidationOrchestrator validations;
    private PipelineStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        lenient().when(transport.localModule()).thenReturn(ModuleName.DESIGN);
        lenient().when(transport.publishAsync(any())).thenReturn(CompletableFuture.completedFuture(null));

        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        repository = new InMemoryPipelineItemRepository();
        validations = new ValidationOrchestrator(
            transport, new InMemoryDeduplicationRegistry(), new ValidationConfig(), clock);
        stateMachine = new PipelineStateMachine(repository, validations, transport, GatePolicy.defaults(), clock);
        validations.addResultListener(stateMachine::recordValidationResult);
        validations.start();
    }

    @AfterEach
    void tearDown() {
        validations.stop();
    }

    // ============================================================
    // 1. 생성과 게이트 없는 진행
    // ============================================================

    @Test
    void 생성된_항목은_DISCOVERY에서_시작하고_경영진에게_통지된다() {
        // when
        PipelineItem item = stateMachine.create("Linen overshirt", "tops", ACTOR);

        // then
        assertThat(item.currentStage()).isEqualTo(Stage.DISCOVERY);
        assertThat(item.lastTransition().kind()).isEqualTo(TransitionKind.CREATED);
        assertThat(stateMachine.get(item.id())).isEqualTo(item);

        EventEnvelope notice = lastNotice();
        assertThat(notice.kind()).isEqualTo(EventKind.PRODUCT_PIPELINE_UPDATED);
        assertThat(notice.targetModule()).isEqualTo(ModuleName.EXECUTIVE);
        assertThat(notice.payload())
            .containsEntry("to_stage", "discovery")
            .containsEntry("transition", "created")
            .containsEntry("from_stage", null);
    }

    @Test
    void 게이트가_없는_단계는_바로_진행한다() {
        // given
        PipelineItem item = stateMachine.create("Linen overshirt", "tops", ACTOR);

        // when
        PipelineItem ideation = stateMachine.advance(item.id(), ACTOR);
        PipelineItem design = stateMachine.advance(item.id(), ACTOR, Stage.IDEATION);

        // then
        assertThat(ideation.currentStage()).isEqualTo(Stage.IDEATION);
        assertThat(design.currentStage()).isEqualTo(Stage.DESIGN);
        assertThat(design.stageHistory()).extracting(StageHistoryEntry::stage)
            .containsExactly(Stage.DISCOVERY, Stage.IDEATION, Stage.DESIGN);
        assertThat(lastNotice().payload())
            .containsEntry("from_stage", "ideation")
            .containsEntry("to_stage", "design")
            .containsEntry("transition", "advance");
    }

    @Test
    void 없는_항목은_NotFound() {
        assertThatThrownBy(() -> stateMachine.advance(PipelineItemId.of("missing"), ACTOR))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> stateMachine.get(PipelineItemId.of("missing")))
            .isInstanceOf(NotFoundException.class);
    }

    // ============================================================
    // 2. 게이트
    // ============================================================

    @Test
    void 마진_검증을_요청하지_않으면_SOURCING을_떠날_수_없다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);

        // when & then
        assertThatThrownBy(() -> stateMachine.advance(id, ACTOR))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("margin_check");
        assertThat(stateMachine.get(id).currentStage()).isEqualTo(Stage.SOURCING);
    }

    @Test
    void 대기_중인_검증이_있으면_진행할_수_없다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        stateMachine.validate(id, ValidationType.MARGIN_CHECK);

        // when & then
        assertThatThrownBy(() -> stateMachine.advance(id, ACTOR))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("still waiting");
        assertThat(stateMachine.get(id).outcome(ValidationType.MARGIN_CHECK)).contains(ValidationState.WAITING);
    }

    @Test
    void 승인되면_다음_단계로_진행하고_검증_기록은_초기화된다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        ValidationHandle handle = stateMachine.validate(id, ValidationType.MARGIN_CHECK);

        // when
        validations.submitResponse(handle.getCorrelationId(), Verdict.APPROVED, "margin 58%");
        PipelineItem sampling = stateMachine.advance(id, ACTOR);

        // then
        assertThat(sampling.currentStage()).isEqualTo(Stage.SAMPLING);
        assertThat(sampling.validationOutcomes()).isEmpty();
        assertThat(sampling.pendingValidations()).isEmpty();
    }

    @Test
    void 거절되면_항목이_차단되고_진행은_ValidationRejected() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        ValidationHandle handle = stateMachine.validate(id, ValidationType.MARGIN_CHECK);

        // when
        validations.submitResponse(handle.getCorrelationId(), Verdict.REJECTED, "margin below floor");

        // then
        PipelineItem item = stateMachine.get(id);
        assertThat(item.blocked()).isTrue();
        assertThat(item.outcome(ValidationType.MARGIN_CHECK)).contains(ValidationState.REJECTED);
        assertThatThrownBy(() -> stateMachine.advance(id, ACTOR))
            .isInstanceOf(ValidationRejectedException.class);
        assertThatThrownBy(() -> stateMachine.validate(id, ValidationType.MARGIN_CHECK))
            .isInstanceOf(ValidationRejectedException.class)
            .hasMessageContaining("clear the rejection");
    }

    @Test
    void 기한_초과도_거절과_같이_진행을_막는다() {
        // given
        PipelineItemId id = itemAt(Stage.SAMPLING);
        ValidationHandle handle = stateMachine.validate(id, ValidationType.CAPACITY_CHECK, null, Duration.ofMillis(30));

        // when
        ValidationResult result = handle.await(Duration.ofSeconds(2));

        // then
        assertThat(result.state()).isEqualTo(ValidationState.TIMED_OUT);
        assertThat(stateMachine.get(id).blocked()).isTrue();
        assertThatThrownBy(() -> stateMachine.advance(id, ACTOR))
            .isInstanceOf(ValidationRejectedException.class);
    }

    @Test
    void 거절을_해제하면_다시_요청하고_진행할_수_있다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        ValidationHandle rejected = stateMachine.validate(id, ValidationType.MARGIN_CHECK);
        validations.submitResponse(rejected.getCorrelationId(), Verdict.REJECTED, "too thin");

        // when
        PipelineItem cleared = stateMachine.clearRejection(id, ValidationType.MARGIN_CHECK, "cfo@studio");
        ValidationHandle retry = stateMachine.validate(id, ValidationType.MARGIN_CHECK);
        validations.submitResponse(retry.getCorrelationId(), Verdict.APPROVED, "repriced");

        // then
        assertThat(cleared.blocked()).isFalse();
        assertThat(retry.getCorrelationId()).isNotEqualTo(rejected.getCorrelationId());
        assertThat(stateMachine.advance(id, ACTOR).currentStage()).isEqualTo(Stage.SAMPLING);
    }

    @Test
    void 해제할_거절이_없으면_InvalidTransition() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);

        // when & then
        assertThatThrownBy(() -> stateMachine.clearRejection(id, ValidationType.MARGIN_CHECK, ACTOR))
            .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> stateMachine.clearRejection(id, ValidationType.MARGIN_CHECK, " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 3. 검증 요청 규칙
    // ============================================================

    @Test
    void 현재_단계가_요구하지_않는_검증은_요청할_수_없다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);

        // when & then
        assertThatThrownBy(() -> stateMachine.validate(id, ValidationType.PRODUCT_APPROVAL))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void 대기_중인_검증을_다시_요청하면_기존_핸들을_반환한다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        ValidationHandle first = stateMachine.validate(id, ValidationType.MARGIN_CHECK);

        // when
        ValidationHandle second = stateMachine.validate(id, ValidationType.MARGIN_CHECK);

        // then
        assertThat(second.getCorrelationId()).isEqualTo(first.getCorrelationId());
        assertThat(validations.pendingFor(id)).hasSize(1);
    }

    @Test
    void 이미_승인된_검증은_다시_요청할_수_없다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        ValidationHandle handle = stateMachine.validate(id, ValidationType.MARGIN_CHECK);
        validations.submitResponse(handle.getCorrelationId(), Verdict.APPROVED, null);

        // when & then
        assertThatThrownBy(() -> stateMachine.validate(id, ValidationType.MARGIN_CHECK))
            .isInstanceOf(InvalidTransitionException.class);
        assertThat(stateMachine.requestValidations(id)).isEmpty();
    }

    @Test
    void 검증_요청_본문에는_항목_정보가_담긴다() {
        // given
        PipelineItemId id = itemAt(Stage.PRODUCTION);

        // when
        List<ValidationHandle> handles = stateMachine.requestValidations(id);

        // then
        assertThat(handles).extracting(ValidationHandle::getType).containsExactly(ValidationType.PRODUCT_APPROVAL);
        ArgumentCaptor<EventEnvelope> captor = ArgumentCaptor.forClass(EventEnvelope.class);
        verify(transport, atLeastOnce()).publish(captor.capture());
        assertThat(captor.getValue().kind()).isEqualTo(EventKind.PRODUCT_APPROVAL_REQUEST);
        assertThat(captor.getValue().targetModule()).isEqualTo(ModuleName.EXECUTIVE);
        assertThat(captor.getValue().payload())
            .containsEntry("pipeline_item_id", id.getValue())
            .containsEntry("title", "Linen overshirt")
            .containsEntry("stage", "production");
    }

    @Test
    void 항목이_기다리지_않는_결과는_무시된다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        PipelineItem before = stateMachine.get(id);

        // when
        stateMachine.recordValidationResult(new ValidationResult(CorrelationId.of("stale"), id,
            ValidationType.MARGIN_CHECK, ValidationState.REJECTED, null, T0));
        stateMachine.recordValidationResult(new ValidationResult(CorrelationId.of("other"),
            PipelineItemId.of("unknown"), ValidationType.MARGIN_CHECK, ValidationState.APPROVED, null, T0));

        // then
        assertThat(stateMachine.get(id)).isEqualTo(before);
    }

    // ============================================================
    // 4. 종료, 취소, 관리자 변경
    // ============================================================

    @Test
    void COMPLETE에_도달하면_운영_재무_마케팅에_통지한다() {
        // given
        PipelineItemId id = itemAt(Stage.PRODUCTION);
        ValidationHandle approval = stateMachine.validate(id, ValidationType.PRODUCT_APPROVAL);
        validations.submitResponse(approval.getCorrelationId(), Verdict.APPROVED, "go");

        // when
        PipelineItem complete = stateMachine.advance(id, ACTOR);

        // then
        assertThat(complete.currentStage()).isEqualTo(Stage.COMPLETE);
        ArgumentCaptor<EventEnvelope> captor = ArgumentCaptor.forClass(EventEnvelope.class);
        verify(transport, atLeastOnce()).publishAsync(captor.capture());
        List<EventEnvelope> notices = captor.getAllValues();
        assertThat(notices.subList(notices.size() - 4, notices.size()))
            .extracting(EventEnvelope::kind, EventEnvelope::targetModule)
            .containsExactly(
                tuple(EventKind.PRODUCT_PIPELINE_UPDATED, ModuleName.EXECUTIVE),
                tuple(EventKind.PRODUCT_APPROVED_FOR_PRODUCTION, ModuleName.OPERATIONS),
                tuple(EventKind.PRODUCT_BUDGET_ALLOCATED, ModuleName.FINANCE),
                tuple(EventKind.PRODUCT_LAUNCH_SCHEDULED, ModuleName.MARKETING)
            );

        assertThatThrownBy(() -> stateMachine.advance(id, ACTOR)).isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> stateMachine.cancel(id, ACTOR, "late")).isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void 취소하면_대기_중인_검증도_취소된다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        ValidationHandle handle = stateMachine.validate(id, ValidationType.MARGIN_CHECK);

        // when
        PipelineItem cancelled = stateMachine.cancel(id, ACTOR, "trend faded");

        // then
        assertThat(cancelled.currentStage()).isEqualTo(Stage.CANCELLED);
        assertThat(cancelled.lastTransition().note()).isEqualTo("trend faded");
        assertThatThrownBy(() -> handle.await(Duration.ofSeconds(1))).isInstanceOf(CancellationException.class);
        assertThat(validations.pendingFor(id)).isEmpty();
        assertThatThrownBy(() -> stateMachine.validate(id, ValidationType.MARGIN_CHECK))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void 관리자_변경은_게이트를_건너뛰고_검증_기록을_초기화한다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        ValidationHandle handle = stateMachine.validate(id, ValidationType.MARGIN_CHECK);
        validations.submitResponse(handle.getCorrelationId(), Verdict.REJECTED, "no");

        // when
        PipelineItem back = stateMachine.override(id, "ceo@studio", Stage.DESIGN, "rework tech pack");

        // then
        assertThat(back.currentStage()).isEqualTo(Stage.DESIGN);
        assertThat(back.blocked()).isFalse();
        assertThat(back.lastTransition().kind()).isEqualTo(TransitionKind.OVERRIDE);
        assertThatThrownBy(() -> stateMachine.override(id, ACTOR, Stage.CANCELLED, "x"))
            .isInstanceOf(InvalidTransitionException.class);
    }

    // ============================================================
    // 5. 동시성
    // ============================================================

    @Test
    void 같은_단계에서_동시에_진행하면_하나만_성공한다() throws Exception {
        // given
        PipelineItem item = stateMachine.create("Linen overshirt", "tops", ACTOR);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger conflicted = new AtomicInteger();

        // when
        Future<?>[] futures = new Future<?>[threads];
        for (int i = 0; i < threads; i++) {
            futures[i] = executor.submit(() -> {
                start.await();
                try {
                    stateMachine.advance(item.id(), ACTOR, Stage.DISCOVERY);
                    succeeded.incrementAndGet();
                } catch (InvalidTransitionException e) {
                    conflicted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // then
        assertThat(succeeded.get()).isEqualTo(1);
        assertThat(conflicted.get()).isEqualTo(threads - 1);
        assertThat(stateMachine.get(item.id()).currentStage()).isEqualTo(Stage.IDEATION);
    }

    @Test
    void 기대_단계_없이_동시에_진행해도_한_번만_전이한다() throws Exception {
        // given
        PipelineItem item = stateMachine.create("Linen overshirt", "tops", ACTOR);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger conflicted = new AtomicInteger();

        // when
        Future<?>[] futures = new Future<?>[threads];
        for (int i = 0; i < threads; i++) {
            futures[i] = executor.submit(() -> {
                start.await();
                try {
                    stateMachine.advance(item.id(), ACTOR);
                    succeeded.incrementAndGet();
                } catch (InvalidTransitionException e) {
                    conflicted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // then
        PipelineItem after = stateMachine.get(item.id());
        assertThat(succeeded.get()).isEqualTo(1);
        assertThat(conflicted.get()).isEqualTo(threads - 1);
        assertThat(after.currentStage()).isEqualTo(Stage.IDEATION);
        assertThat(after.stageHistory()).hasSize(2);
    }

    @Test
    void 검증_요청_발행_중에도_항목_잠금은_잡혀_있지_않다() throws Exception {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        CountDownLatch publishing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(transport.publish(any(EventEnvelope.class))).thenAnswer(invocation -> {
            publishing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            // when
            Future<ValidationHandle> requested = executor.submit(() -> stateMachine.validate(id, ValidationType.MARGIN_CHECK));
            assertThat(publishing.await(5, TimeUnit.SECONDS)).isTrue();
            Future<Throwable> contender = executor.submit(() -> {
                try {
                    stateMachine.advance(id, ACTOR);
                    return null;
                } catch (RuntimeException e) {
                    return e;
                }
            });

            // then
            Throwable blocked = contender.get(2, TimeUnit.SECONDS);
            assertThat(blocked).isInstanceOf(InvalidTransitionException.class).hasMessageContaining("still waiting");
            assertThat(requested.isDone()).isFalse();

            release.countDown();
            ValidationHandle handle = requested.get(5, TimeUnit.SECONDS);
            assertThat(stateMachine.get(id).pendingValidationIds()).containsExactly(handle.getCorrelationId());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void 검증_요청_발행이_실패하면_대기_기록을_지우고_다시_요청할_수_있다() {
        // given
        PipelineItemId id = itemAt(Stage.SOURCING);
        when(transport.publish(any(EventEnvelope.class)))
            .thenThrow(new DeliveryFailedException("env-1", "all paths failed"))
            .thenReturn(null);

        // when & then
        assertThatThrownBy(() -> stateMachine.validate(id, ValidationType.MARGIN_CHECK))
            .isInstanceOf(DeliveryFailedException.class);
        PipelineItem withdrawn = stateMachine.get(id);
        assertThat(withdrawn.pendingValidationIds()).isEmpty();
        assertThat(withdrawn.outcome(ValidationType.MARGIN_CHECK)).isEmpty();
        assertThat(validations.pendingFor(id)).isEmpty();

        ValidationHandle retried = stateMachine.validate(id, ValidationType.MARGIN_CHECK);
        assertThat(stateMachine.get(id).pendingValidationIds()).containsExactly(retried.getCorrelationId());
    }

    @Test
    void 여러_검증_중_하나의_발행이_실패하면_나머지_요청도_철회된다() {
        // given
        PipelineStateMachine twoGates = new PipelineStateMachine(repository, validations, transport,
            GatePolicy.none().withGate(Stage.DISCOVERY, ValidationType.MARGIN_CHECK, ValidationType.CAPACITY_CHECK),
            Clock.fixed(T0, ZoneOffset.UTC));
        PipelineItemId id = twoGates.create("Linen overshirt", "tops", ACTOR).id();
        when(transport.publish(any(EventEnvelope.class)))
            .thenThrow(new DeliveryFailedException("env-1", "all paths failed"));

        // when & then
        assertThatThrownBy(() -> twoGates.requestValidations(id)).isInstanceOf(DeliveryFailedException.class);
        PipelineItem after = twoGates.get(id);
        assertThat(after.pendingValidationIds()).isEmpty();
        assertThat(after.validationOutcomes()).isEmpty();
        assertThat(validations.pendingFor(id)).isEmpty();
    }

    @Test
    void 종료된_항목의_잠금은_제거된다() {
        // given
        PipelineItem first = stateMachine.create("Linen overshirt", "tops", ACTOR);
        PipelineItem second = stateMachine.create("Wool scarf", "accessories", ACTOR);
        stateMachine.advance(first.id(), ACTOR);
        stateMachine.advance(second.id(), ACTOR);
        assertThat(stateMachine.lockCount()).isEqualTo(2);

        // when
        stateMachine.cancel(first.id(), ACTOR, "dropped");

        // then
        assertThat(stateMachine.lockCount()).isEqualTo(1);
        assertThatThrownBy(() -> stateMachine.advance(first.id(), ACTOR, Stage.CANCELLED))
            .isInstanceOf(InvalidTransitionException.class);
        assertThat(stateMachine.get(first.id()).stageHistory()).hasSize(3);
    }

    // ============================================================
    // Helpers
    // ============================================================

    private PipelineItemId itemAt(Stage target) {
        PipelineItemId id = stateMachine.create("Linen overshirt", "tops", ACTOR).id();
        while (stateMachine.get(id).currentStage() != target) {
            Stage current = stateMachine.get(id).currentStage();
            for (ValidationType type : GatePolicy.defaults().requiredFor(current)) {
                ValidationHandle handle = stateMachine.validate(id, type);
                validations.submitResponse(handle.getCorrelationId(), Verdict.APPROVED, null);
            }
            stateMachine.advance(id, ACTOR);
        }
        return id;
    }

    private EventEnvelope lastNotice() {
        ArgumentCaptor<EventEnvelope> captor = ArgumentCaptor.forClass(EventEnvelope.class);
        verify(transport, atLeastOnce()).publishAsync(captor.capture());
        return captor.getValue();
    }
}
