package com.ryuqq.pipeline.core.transport;

import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.exception.DeliveryFailedException;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes and delivers event envelopes between modules.
 *
 * <p><strong>Outbound:</strong> an envelope goes to the primary broadcast channel first. When the
 * channel is unreachable, reports no receivers, or does not answer within the liveness window,
 * the envelope is pushed to the direct endpoints of its target module with bounded retries.
 * When both paths fail the caller gets {@link DeliveryFailedException} and a local
 * {@code delivery_failed} envelope is dispatched so the failure becomes an alert.</p>
 *
 * <p><strong>Inbound:</strong> every received envelope is dispatched to the subscribers of its
 * type. Envelopes of one topic are delivered in order; different topics are delivered
 * concurrently with no ordering between them. Envelopes with no subscriber go to the
 * {@code unclassified} topic.</p>
 *
 * <p>Delivery is at-least-once. Subscribers de-duplicate by envelope id.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventTransport {

    /**
     * Publishes with broadcast-then-fallback delivery.
     *
     * @param envelope envelope to publish
     * @return receipt naming the path that delivered it
     * @throws DeliveryFailedException when neither path acknowledged
     * @throws IllegalStateException when the transport is not running
     */
    default PublishReceipt publish(EventEnvelope envelope) {
        return publish(envelope, DeliveryMode.BROADCAST_WITH_FALLBACK);
    }

    /**
     * Publishes using the given mode.
     *
     * @param envelope envelope to publish
     * @param mode BROADCAST_ONLY skips the direct endpoints
     * @return receipt naming the path that delivered it
     * @throws DeliveryFailedException when no permitted path acknowledged
     */
    PublishReceipt publish(EventEnvelope envelope, DeliveryMode mode);

    /**
     * Publishes on the outbound pool.
     *
     * @param envelope envelope to publish
     * @return future completed with the receipt, or exceptionally with {@link DeliveryFailedException}
     */
    CompletableFuture<PublishReceipt> publishAsync(EventEnvelope envelope);

    /**
     * Registers a handler for a topic.
     *
     * @param topic event type wire name
     * @param handler handler
     * @param mode which inbound paths the subscription accepts
     * @return the subscription
     */
    Subscription subscribe(String topic, EventHandler handler, DeliveryMode mode);

    default Subscription subscribe(EventKind kind, EventHandler handler) {
        return subscribe(kind.wireName(), handler, DeliveryMode.BROADCAST_WITH_FALLBACK);
    }

    /**
     * Removes a subscription after everything already queued on its topic has been delivered.
     *
     * @param subscription subscription to remove
     */
    void unsubscribe(Subscription subscription);

    /**
     * Accepts an inbound envelope.
     *
     * @param envelope decoded envelope
     * @param path the path it arrived on
     */
    void receive(EventEnvelope envelope, DeliveryPath path);

    /**
     * Accepts inbound wire JSON. Undecodable input is dropped and reported as a
     * {@code malformed_event}; it never propagates an exception.
     *
     * @param json wire JSON
     * @param path the path it arrived on
     */
    void receiveWire(String json, DeliveryPath path);

    /**
     * Dispatches an envelope to local subscribers only. Used for internal events.
     *
     * @param envelope envelope to dispatch
     */
    void dispatchLocal(EventEnvelope envelope);

    /**
     * @return the module this transport publishes as
     */
    ModuleName localModule();
}
