package com.ryuqq.pipeline.core.exception;

/**
 * Raised when wire input cannot be decoded into an envelope.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MalformedEnvelopeException extends PipelineException {

    public MalformedEnvelopeException(String message) {
        super("PIPE-MALFORMED", message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super("PIPE-MALFORMED", message, cause);
    }
}
