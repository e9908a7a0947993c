package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.contract.ModuleName;

/**
 * Primary broadcast channel SPI (publish/subscribe broker).
 *
 * <p>Carries encoded envelopes between modules. Every module attaches one listener; a broadcast
 * reaches every attached listener except the sender's own.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: broadcast may be called from several publish workers at once</li>
 *   <li>The return value counts listeners that accepted the message, like a broker's
 *       subscriber count on publish</li>
 *   <li>An unreachable broker throws {@link BroadcastUnavailableException}; it must not
 *       silently return</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BroadcastChannel {

    /**
     * Sends an encoded envelope to every other attached module.
     *
     * @param sender the publishing module (its own listener is skipped)
     * @param wireEnvelope encoded envelope
     * @return number of listeners that accepted the message (0 when nobody is listening)
     * @throws BroadcastUnavailableException when the channel cannot be reached
     */
    int broadcast(ModuleName sender, String wireEnvelope);

    /**
     * Attaches the listener of a module, replacing any previous one.
     *
     * @param module the listening module
     * @param listener receives encoded envelopes
     */
    void attach(ModuleName module, Listener listener);

    /**
     * Detaches the listener of a module. No-op when none is attached.
     *
     * @param module the listening module
     */
    void detach(ModuleName module);

    /**
     * Receives encoded envelopes from the channel.
     */
    @FunctionalInterface
    interface Listener {

        /**
         * @param wireEnvelope encoded envelope
         */
        void onMessage(String wireEnvelope);
    }
}
