package com.ryuqq.pipeline.core.transport;

/**
 * The path an envelope travelled.
 *
 * <ul>
 *   <li>BROADCAST - primary broadcast channel</li>
 *   <li>FALLBACK - direct point-to-point endpoint</li>
 *   <li>LOCAL - produced and consumed inside this process, never on the wire</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeliveryPath {
    BROADCAST,
    FALLBACK,
    LOCAL
}
