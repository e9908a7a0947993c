package com.ryuqq.pipeline.core.transport;

import com.ryuqq.pipeline.core.contract.ModuleName;

import java.util.List;

/**
 * Outcome of a successful publish.
 *
 * @param envelopeId id of the published envelope
 * @param path BROADCAST or FALLBACK
 * @param receivers broadcast receivers, or direct endpoints that acknowledged
 * @param acknowledgedBy modules whose direct endpoint acknowledged (empty for BROADCAST)
 * @param attempts fallback rounds used (0 for BROADCAST)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PublishReceipt(
    String envelopeId,
    DeliveryPath path,
    int receivers,
    List<ModuleName> acknowledgedBy,
    int attempts
) {

    public PublishReceipt {
        if (envelopeId == null || envelopeId.isBlank()) {
            throw new IllegalArgumentException("envelopeId cannot be null or blank");
        }
        if (path == null || path == DeliveryPath.LOCAL) {
            throw new IllegalArgumentException("path must be BROADCAST or FALLBACK (current: " + path + ")");
        }
        if (receivers < 1) {
            throw new IllegalArgumentException("receivers must be positive (current: " + receivers + ")");
        }
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative");
        }
        acknowledgedBy = acknowledgedBy == null ? List.of() : List.copyOf(acknowledgedBy);
    }

    public static PublishReceipt broadcast(String envelopeId, int receivers) {
        return new PublishReceipt(envelopeId, DeliveryPath.BROADCAST, receivers, List.of(), 0);
    }

    public static PublishReceipt fallback(String envelopeId, List<ModuleName> acknowledgedBy, int attempts) {
        return new PublishReceipt(envelopeId, DeliveryPath.FALLBACK, acknowledgedBy.size(), acknowledgedBy, attempts);
    }

    public boolean isFallback() {
        return path == DeliveryPath.FALLBACK;
    }
}
