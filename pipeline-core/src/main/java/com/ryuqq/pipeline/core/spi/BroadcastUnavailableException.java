package com.ryuqq.pipeline.core.spi;

/**
 * Thrown by a {@link BroadcastChannel} that cannot reach its broker.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BroadcastUnavailableException extends RuntimeException {

    public BroadcastUnavailableException(String message) {
        super(message);
    }

    public BroadcastUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
