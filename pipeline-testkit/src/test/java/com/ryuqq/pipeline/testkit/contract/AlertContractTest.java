package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.alert.Alert;
import com.ryuqq.pipeline.core.alert.AlertQuery;
import com.ryuqq.pipeline.core.alert.AlertSeverity;
import com.ryuqq.pipeline.core.alert.AlertStatus;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.exception.AlreadyResolvedException;
import com.ryuqq.pipeline.core.exception.NotFoundException;
import com.ryuqq.pipeline.core.transport.EventAuditRecord;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for alerts raised from module events.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Operations inventory update → MEDIUM inventory alert</li>
 *   <li>Unknown event type → LOW unclassified alert</li>
 *   <li>Undecodable webhook body → LOW transport alert, no exception to the caller</li>
 *   <li>Resolve once → RESOLVED; resolve again → AlreadyResolved</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AlertContractTest extends AbstractPipelineContractTest {

    @Test
    void testInventoryUpdate_RaisesMediumAlert() {
        // When
        operations.publish("inventory_updated", null,
                Map.of("item_name", "Linen overshirt", "sku", "LO-01", "quantity", 3));

        // Then
        Alert alert = awaitAlert(new AlertQuery().withCategory("inventory"));
        assertEquals(AlertSeverity.MEDIUM, alert.severity());
        assertEquals(AlertStatus.OPEN, alert.status());
        assertEquals("coo reports inventory change: Linen overshirt (LO-01) now at 3 units", alert.message());
        assertEquals(ModuleName.OPERATIONS, alert.sourceEvent().sourceModule());
    }

    @Test
    void testUnknownEventType_RaisesUnclassifiedAlert() {
        // When
        marketing.publish("viral_moment", ModuleName.DESIGN, Map.of("platform", "short-video"));

        // Then
        Alert alert = awaitAlert(new AlertQuery().withCategory("unclassified"));
        assertEquals(AlertSeverity.LOW, alert.severity());
        assertEquals("viral_moment", alert.sourceEvent().type());
    }

    @Test
    void testMalformedWebhook_RaisesTransportAlert() {
        // When
        assertDoesNotThrow(() -> orchestrator.receiveWebhook("{\"type\": \"inventory_updated\", \"payload\": "));

        // Then
        Alert alert = awaitAlert(new AlertQuery().withCategory("transport"));
        assertEquals(AlertSeverity.LOW, alert.severity());
        assertTrue(auditLog.recent(10).stream()
                .anyMatch(record -> record.status() == EventAuditRecord.Status.MALFORMED));
    }

    @Test
    void testResolveAlert_SecondResolveFails() {
        // Given
        Alert raised = orchestrator.raiseAlert(AlertSeverity.HIGH, "operations", "Dye lot mismatch", "lot 7B");

        // When
        Alert resolved = orchestrator.resolveAlert(raised.id(), "coo@studio");

        // Then
        assertEquals(AlertStatus.RESOLVED, resolved.status());
        assertEquals("coo@studio", resolved.resolvedBy());
        assertEquals(START, resolved.resolvedAt());
        assertThrows(AlreadyResolvedException.class, () -> orchestrator.resolveAlert(raised.id(), "ceo@studio"));
        assertThrows(NotFoundException.class, () -> orchestrator.resolveAlert("no-such-alert", "ceo@studio"));
        assertTrue(orchestrator.listAlerts(AlertQuery.open()).isEmpty());
    }
}
