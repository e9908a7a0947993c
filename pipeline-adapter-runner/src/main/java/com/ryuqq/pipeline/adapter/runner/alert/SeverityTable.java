package com.ryuqq.pipeline.adapter.runner.alert;

import com.ryuqq.pipeline.core.alert.AlertSeverity;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.model.Verdict;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 이벤트 종류별 알림 분류표.
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>inventory_updated, campaign_performance, financial_report, sales_data_updated - MEDIUM</li>
 *   <li>validation_timeout - HIGH</li>
 *   <li>delivery_failed - CRITICAL</li>
 *   <li>검증 응답, approval_decided - LOW (거절이면 MEDIUM)</li>
 *   <li>malformed_event, unclassified - LOW</li>
 * </ul>
 *
 * <p>표에 없는 종류는 알림을 만들지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SeverityTable {

    private static final Map<EventKind, Rule> RULES;

    static {
        EnumMap<EventKind, Rule> rules = new EnumMap<>(EventKind.class);
        rules.put(EventKind.INVENTORY_UPDATED, new Rule(AlertSeverity.MEDIUM, "inventory", "Inventory Updated", false));
        rules.put(EventKind.CAMPAIGN_PERFORMANCE, new Rule(AlertSeverity.MEDIUM, "analytics", "Campaign Performance Update", false));
        rules.put(EventKind.FINANCIAL_REPORT, new Rule(AlertSeverity.MEDIUM, "finance", "Financial Report", false));
        rules.put(EventKind.SALES_DATA_UPDATED, new Rule(AlertSeverity.MEDIUM, "analytics", "Sales Data Updated", false));
        rules.put(EventKind.VALIDATION_TIMEOUT, new Rule(AlertSeverity.HIGH, "validation", "Validation Timed Out", false));
        rules.put(EventKind.DELIVERY_FAILED, new Rule(AlertSeverity.CRITICAL, "delivery", "Event Delivery Failed", false));
        rules.put(EventKind.MARGIN_CHECK_RESPONSE, new Rule(AlertSeverity.LOW, "validation", "Margin Check", true));
        rules.put(EventKind.CAPACITY_CHECK_RESPONSE, new Rule(AlertSeverity.LOW, "validation", "Capacity Check", true));
        rules.put(EventKind.APPROVAL_DECIDED, new Rule(AlertSeverity.LOW, "approval", "Product Approval", true));
        rules.put(EventKind.MALFORMED_EVENT, new Rule(AlertSeverity.LOW, "transport", "Malformed Event", false));
        rules.put(EventKind.UNCLASSIFIED, new Rule(AlertSeverity.LOW, "unclassified", "Unclassified Event", false));
        RULES = Collections.unmodifiableMap(rules);
    }

    private SeverityTable() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @return 알림 대상 이벤트 종류
     */
    public static Set<EventKind> alertKinds() {
        return RULES.keySet();
    }

    /**
     * 이벤트 분류.
     *
     * @param envelope 수신 이벤트
     * @return 분류 결과 (알림 대상이 아니면 empty)
     */
    public static Optional<Classification> classify(EventEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        Rule rule = RULES.get(envelope.kind());
        if (rule == null) {
            return Optional.empty();
        }

        AlertSeverity severity = rule.severity();
        String title = rule.title();
        if (rule.verdictSensitive()) {
            Optional<Verdict> verdict = Verdict.fromPayload(envelope.payload());
            if (verdict.isPresent() && verdict.get() == Verdict.REJECTED) {
                severity = AlertSeverity.MEDIUM;
            }
            title = title + " " + verdict.map(v -> v == Verdict.APPROVED ? "Approved" : "Rejected").orElse("Received");
        }
        return Optional.of(new Classification(severity, rule.category(), title, messageFor(envelope)));
    }

    private static String messageFor(EventEnvelope envelope) {
        String source = envelope.sourceModule().wireName();
        switch (envelope.kind()) {
            case INVENTORY_UPDATED:
                return String.format("%s reports inventory change: %s (%s) now at %s units", source,
                    orDefault(envelope, "item_name", "Unknown"), orDefault(envelope, "sku", ""),
                    orDefault(envelope, "quantity", "0"));
            case CAMPAIGN_PERFORMANCE:
                return String.format("%s campaign '%s' ROAS: %s", source,
                    orDefault(envelope, "campaign_name", "Unknown"), orDefault(envelope, "roas", "n/a"));
            case FINANCIAL_REPORT:
                return orDefault(envelope, "summary",
                    "Financial report (" + orDefault(envelope, "report_type", "general") + ") received from " + source);
            case SALES_DATA_UPDATED:
                return "New sales data received, analytics may need refresh. Period: "
                    + orDefault(envelope, "period", "unknown");
            case VALIDATION_TIMEOUT:
                return String.format("No %s response from %s for item %s before %s",
                    orDefault(envelope, "request_type", "validation"), orDefault(envelope, "responder", "unknown"),
                    orDefault(envelope, "pipeline_item_id", "unknown"), orDefault(envelope, "deadline", "deadline"));
            case DELIVERY_FAILED:
                return String.format("Envelope %s (%s) to %s undelivered: %s",
                    orDefault(envelope, "undelivered_envelope_id", "unknown"),
                    orDefault(envelope, "undelivered_type", "unknown"),
                    orDefault(envelope, "target_module", "all modules"),
                    orDefault(envelope, "reason", "unknown"));
            case MALFORMED_EVENT:
                return "Undecodable envelope dropped: " + orDefault(envelope, "reason", "unknown");
            case UNCLASSIFIED:
                return "Unrecognized event '" + envelope.type() + "' from " + source;
            default:
                return orDefault(envelope, "summary", envelope.type() + " from " + source);
        }
    }

    private static String orDefault(EventEnvelope envelope, String key, String fallback) {
        String value = envelope.payloadString(key);
        return value == null || value.isBlank() ? fallback : value;
    }

    private record Rule(AlertSeverity severity, String category, String title, boolean verdictSensitive) {
    }

    /**
     * 분류 결과.
     *
     * @param severity 심각도
     * @param category 분류
     * @param title 제목
     * @param message 본문
     */
    public record Classification(AlertSeverity severity, String category, String title, String message) {
    }
}
