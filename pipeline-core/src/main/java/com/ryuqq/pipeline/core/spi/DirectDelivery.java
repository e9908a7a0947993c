package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.contract.ModuleName;

import java.net.URI;

/**
 * Point-to-point delivery SPI used when the broadcast cannot be confirmed.
 *
 * <p>Pushes the identical encoded envelope to one endpoint of the target module and returns
 * only when that endpoint acknowledged it. A single call is a single attempt; retries and
 * backoff belong to the caller.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DirectDelivery {

    /**
     * Delivers an encoded envelope.
     *
     * @param target the receiving module
     * @param endpoint the module's direct endpoint
     * @param wireEnvelope encoded envelope
     * @throws DirectDeliveryException when the endpoint did not acknowledge
     */
    void deliver(ModuleName target, URI endpoint, String wireEnvelope);
}
