package com.ryuqq.pipeline.core.transport;

import com.ryuqq.pipeline.core.contract.EventEnvelope;

/**
 * Callback invoked for every envelope delivered on a subscribed topic.
 *
 * <p>Envelopes of one topic reach a handler in order, one at a time. Delivery is at-least-once,
 * so implementations must tolerate the same envelope id more than once. Exceptions thrown here
 * are logged by the transport and do not stop delivery to other subscribers.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * @param envelope the delivered envelope
     */
    void handle(EventEnvelope envelope);
}
