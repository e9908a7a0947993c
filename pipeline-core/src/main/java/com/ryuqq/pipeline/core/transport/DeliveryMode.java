package com.ryuqq.pipeline.core.transport;

/**
 * Which delivery paths a publish may use, or a subscription accepts.
 *
 * <ul>
 *   <li>BROADCAST_ONLY - publish fails when the broadcast is not acknowledged; a subscription
 *       only sees envelopes that arrived over the broadcast channel (and local ones)</li>
 *   <li>BROADCAST_WITH_FALLBACK - publish falls back to direct endpoints; a subscription also
 *       sees envelopes pushed to this module's direct endpoint</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeliveryMode {

    BROADCAST_ONLY,
    BROADCAST_WITH_FALLBACK;

    /**
     * @param path the path an inbound envelope arrived on
     * @return true when a subscription in this mode accepts it
     */
    public boolean accepts(DeliveryPath path) {
        return path != DeliveryPath.FALLBACK || this == BROADCAST_WITH_FALLBACK;
    }
}
