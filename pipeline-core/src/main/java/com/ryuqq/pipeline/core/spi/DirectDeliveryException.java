package com.ryuqq.pipeline.core.spi;

/**
 * Thrown by {@link DirectDelivery} when an endpoint did not acknowledge a delivery.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DirectDeliveryException extends RuntimeException {

    private final int statusCode;

    public DirectDeliveryException(String message) {
        this(message, -1, null);
    }

    public DirectDeliveryException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public DirectDeliveryException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return response status code, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
