package com.ryuqq.pipeline.core.contract;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Known event kinds exchanged between modules.
 *
 * <p>The wire {@code type} of an {@link EventEnvelope} is a free-form string. This enum is the
 * tagged view over it: every recognized wire name maps to exactly one constant and anything
 * else maps to {@link #UNCLASSIFIED}, so an unknown kind still reaches the alert path instead of
 * being dropped.</p>
 *
 * <p>Internal kinds ({@link #DELIVERY_FAILED}, {@link #VALIDATION_TIMEOUT},
 * {@link #MALFORMED_EVENT}) are produced inside this process and never leave it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventKind {

    // validation requests (outbound) and their responses (inbound)
    MARGIN_CHECK_REQUEST("margin_check_request"),
    MARGIN_CHECK_RESPONSE("margin_check_response"),
    CAPACITY_CHECK_REQUEST("capacity_check_request"),
    CAPACITY_CHECK_RESPONSE("capacity_check_response"),
    PRODUCT_APPROVAL_REQUEST("product_approval_request"),
    APPROVAL_DECIDED("approval_decided"),

    // outbound notices
    PRODUCT_PIPELINE_UPDATED("product_pipeline_updated"),
    PRODUCT_APPROVED_FOR_PRODUCTION("product_approved_for_production"),
    PRODUCT_BUDGET_ALLOCATED("product_budget_allocated"),
    PRODUCT_LAUNCH_SCHEDULED("product_launch_scheduled"),
    TECH_PACK_READY("tech_pack_ready"),
    DEMAND_FORECAST("demand_forecast"),
    TREND_ALERT("trend_alert"),
    PRODUCT_RECOMMENDATION("product_recommendation"),
    PERFORMANCE_REPORT("performance_report"),

    // inbound notices
    SALES_DATA_UPDATED("sales_data_updated"),
    INVENTORY_UPDATED("inventory_updated"),
    CAMPAIGN_PERFORMANCE("campaign_performance"),
    FINANCIAL_REPORT("financial_report"),

    // internal
    DELIVERY_FAILED("delivery_failed"),
    VALIDATION_TIMEOUT("validation_timeout"),
    MALFORMED_EVENT("malformed_event"),

    UNCLASSIFIED("unclassified");

    private static final Map<String, EventKind> BY_WIRE_NAME = Stream.of(values())
        .collect(Collectors.toUnmodifiableMap(EventKind::wireName, Function.identity()));

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Returns true for kinds that are generated locally and never published on the wire.
     */
    public boolean isInternal() {
        return this == DELIVERY_FAILED || this == VALIDATION_TIMEOUT || this == MALFORMED_EVENT;
    }

    /**
     * Resolves a wire type to its kind.
     *
     * @param wireType the envelope {@code type} value (may be null)
     * @return the matching kind, or {@link #UNCLASSIFIED} when unknown
     */
    public static EventKind fromWire(String wireType) {
        if (wireType == null) {
            return UNCLASSIFIED;
        }
        return BY_WIRE_NAME.getOrDefault(wireType, UNCLASSIFIED);
    }
}
