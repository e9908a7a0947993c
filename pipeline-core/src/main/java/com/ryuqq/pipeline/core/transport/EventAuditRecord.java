package com.ryuqq.pipeline.core.transport;

import com.ryuqq.pipeline.core.contract.EventEnvelope;

import java.time.Instant;

/**
 * One line of the event audit trail.
 *
 * @param envelopeId envelope id (may be null for undecodable input)
 * @param type wire type (may be null for undecodable input)
 * @param direction INBOUND or OUTBOUND
 * @param path the path travelled (nullable when delivery failed)
 * @param status what happened to the envelope
 * @param detail free-form detail (nullable)
 * @param recordedAt when the record was written
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventAuditRecord(
    String envelopeId,
    String type,
    Direction direction,
    DeliveryPath path,
    Status status,
    String detail,
    Instant recordedAt
) {

    public enum Direction {
        INBOUND,
        OUTBOUND
    }

    public enum Status {
        DELIVERED,
        FAILED,
        RECEIVED,
        IGNORED,
        MALFORMED
    }

    public EventAuditRecord {
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("recordedAt cannot be null");
        }
    }

    public static EventAuditRecord outbound(EventEnvelope envelope, DeliveryPath path, Status status,
                                            String detail, Instant now) {
        return new EventAuditRecord(envelope.id(), envelope.type(), Direction.OUTBOUND, path, status, detail, now);
    }

    public static EventAuditRecord inbound(EventEnvelope envelope, DeliveryPath path, Status status,
                                           String detail, Instant now) {
        return new EventAuditRecord(envelope.id(), envelope.type(), Direction.INBOUND, path, status, detail, now);
    }
}
