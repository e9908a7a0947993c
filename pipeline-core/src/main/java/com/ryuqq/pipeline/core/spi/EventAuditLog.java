package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.transport.EventAuditRecord;

import java.util.List;

/**
 * Audit trail of inbound and outbound envelopes.
 *
 * <p>The transport calls {@link #record(EventAuditRecord)} on its delivery paths, so
 * implementations must be thread-safe and fast.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EventAuditLog {

    /**
     * @param record record to append
     */
    void record(EventAuditRecord record);

    /**
     * @param envelopeId envelope id
     * @return records for the envelope in the order written
     */
    List<EventAuditRecord> findByEnvelopeId(String envelopeId);

    /**
     * @param limit maximum number of records
     * @return most recent records, newest first
     */
    List<EventAuditRecord> recent(int limit);
}
