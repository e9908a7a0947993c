package com.ryuqq.pipeline.core.exception;

/**
 * Raised when an envelope could be delivered neither over the broadcast channel nor over any
 * direct endpoint after the configured retries.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DeliveryFailedException extends PipelineException {

    private final String envelopeId;

    public DeliveryFailedException(String envelopeId, String message) {
        this(envelopeId, message, null);
    }

    public DeliveryFailedException(String envelopeId, String message, Throwable cause) {
        super("PIPE-DELIVERY", message, cause);
        this.envelopeId = envelopeId;
    }

    /**
     * @return id of the envelope that was not delivered
     */
    public String getEnvelopeId() {
        return envelopeId;
    }
}
