package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.application.orchestrator.ValidationHandle;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.model.PipelineItemId;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.model.Verdict;
import com.ryuqq.pipeline.core.pipeline.PipelineItem;
import com.ryuqq.pipeline.core.pipeline.StageHistoryEntry;
import com.ryuqq.pipeline.core.statemachine.Stage;
import com.ryuqq.pipeline.core.statemachine.TransitionKind;
import com.ryuqq.pipeline.core.validation.ValidationResult;
import com.ryuqq.pipeline.core.validation.ValidationState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the approved path through the pipeline.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>All gates approved over broadcast → item reaches COMPLETE</li>
 *   <li>COMPLETE notifies operations, finance and marketing</li>
 *   <li>Every transition is recorded and announced to the executive module</li>
 *   <li>Cancelling an item abandons its pending validation</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HappyPathContractTest extends AbstractPipelineContractTest {

    @Test
    void testFullPipeline_AllGatesApproved_ReachesComplete() {
        // Given
        PipelineItemId id = createItemAt(Stage.PRODUCTION);

        // When
        ValidationHandle approval = orchestrator.requestValidation(id, ValidationType.PRODUCT_APPROVAL, null);
        ValidationResult result = approval.awaitApproval(AWAIT);
        PipelineItem complete = orchestrator.advance(id, ACTOR);

        // Then
        assertEquals(ValidationState.APPROVED, result.state());
        assertEquals(Stage.COMPLETE, complete.currentStage());
        assertTrue(directDelivery.attempts().isEmpty(), "Broadcast was reachable, no fallback expected");

        awaitCondition("production hand-off", () ->
                operations.received(EventKind.PRODUCT_APPROVED_FOR_PRODUCTION).size() == 1);
        awaitCondition("budget allocation", () ->
                finance.received(EventKind.PRODUCT_BUDGET_ALLOCATED).size() == 1);
        awaitCondition("launch scheduling", () ->
                marketing.received(EventKind.PRODUCT_LAUNCH_SCHEDULED).size() == 1);

        EventEnvelope handOff = operations.received(EventKind.PRODUCT_APPROVED_FOR_PRODUCTION).get(0);
        assertEquals(id.getValue(), handOff.payloadString("pipeline_item_id"));
        assertEquals("complete", handOff.payloadString("to_stage"));
    }

    @Test
    void testValidationRequest_CarriesCorrelationIdToResponder() {
        // Given
        PipelineItemId id = createItemAt(Stage.SOURCING);

        // When
        ValidationHandle handle = orchestrator.requestValidation(id, ValidationType.MARGIN_CHECK, null);
        handle.awaitApproval(AWAIT);

        // Then
        List<EventEnvelope> requests = finance.received(EventKind.MARGIN_CHECK_REQUEST);
        assertEquals(1, requests.size(), "Finance should receive exactly one margin request");
        EventEnvelope request = requests.get(0);
        assertEquals(handle.getCorrelationId().getValue(), request.correlationId());
        assertEquals(handle.getCorrelationId().getValue(), request.payloadString("validation_request_id"));
        assertEquals(ModuleName.FINANCE, request.targetModule());
        assertEquals("sourcing", request.payloadString("stage"));

        assertTrue(operations.received(EventKind.MARGIN_CHECK_REQUEST).isEmpty(),
                "Requests addressed to finance must not reach operations handlers");
    }

    @Test
    void testStageHistory_RecordsEveryTransitionAndAnnouncesIt() {
        // Given
        PipelineItemId id = createItemAt(Stage.SAMPLING);

        // When
        PipelineItem item = orchestrator.getItem(id);

        // Then
        List<StageHistoryEntry> history = item.stageHistory();
        assertEquals(5, history.size());
        assertEquals(TransitionKind.CREATED, history.get(0).kind());
        assertEquals(Stage.SAMPLING, history.get(4).stage());
        assertTrue(history.stream().skip(1).allMatch(entry -> entry.kind() == TransitionKind.ADVANCE));

        awaitCondition("executive notices", () ->
                executive.received(EventKind.PRODUCT_PIPELINE_UPDATED).size() == 5);
    }

    @Test
    void testCancel_WithPendingValidation_AbandonsIt() {
        // Given
        PipelineItemId id = createItemAt(Stage.SAMPLING);
        operations.respondWith(ValidationType.CAPACITY_CHECK, null);
        ValidationHandle handle = orchestrator.requestValidation(id, ValidationType.CAPACITY_CHECK, null);
        awaitCondition("capacity request", () -> operations.received(EventKind.CAPACITY_CHECK_REQUEST).size() == 1);

        // When
        PipelineItem cancelled = orchestrator.cancel(id, ACTOR, "supplier dropped out");

        // Then
        assertEquals(Stage.CANCELLED, cancelled.currentStage());
        assertThrows(CancellationException.class, () -> handle.await(Duration.ofSeconds(1)));

        // A late answer finds no pending request
        operations.answer(operations.received(EventKind.CAPACITY_CHECK_REQUEST).get(0),
                Verdict.APPROVED);
        sleep(100);
        assertStage(id, Stage.CANCELLED);
        assertTrue(orchestrator.getItem(id).validationOutcomes().isEmpty());
    }
}
