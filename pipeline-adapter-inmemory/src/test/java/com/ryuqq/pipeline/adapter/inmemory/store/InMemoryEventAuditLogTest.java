package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.transport.DeliveryPath;
import com.ryuqq.pipeline.core.transport.EventAuditRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryEventAuditLog 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryEventAuditLogTest {

    private static EventAuditRecord record(String envelopeId, EventAuditRecord.Status status) {
        return new EventAuditRecord(envelopeId, "inventory_updated", EventAuditRecord.Direction.INBOUND,
            DeliveryPath.BROADCAST, status, null, Instant.parse("2024-03-01T09:00:00Z"));
    }

    @Test
    void 봉투별_기록을_작성_순서로_조회한다() {
        // given
        InMemoryEventAuditLog auditLog = new InMemoryEventAuditLog();
        auditLog.record(record("env-1", EventAuditRecord.Status.RECEIVED));
        auditLog.record(record("env-2", EventAuditRecord.Status.RECEIVED));
        auditLog.record(record("env-1", EventAuditRecord.Status.IGNORED));

        // when & then
        assertThat(auditLog.findByEnvelopeId("env-1")).extracting(EventAuditRecord::status)
            .containsExactly(EventAuditRecord.Status.RECEIVED, EventAuditRecord.Status.IGNORED);
        assertThat(auditLog.recent(2)).extracting(EventAuditRecord::envelopeId)
            .containsExactly("env-1", "env-2");
    }

    @Test
    void 용량을_넘으면_가장_오래된_기록을_버린다() {
        // given
        InMemoryEventAuditLog auditLog = new InMemoryEventAuditLog(2);

        // when
        auditLog.record(record("env-1", EventAuditRecord.Status.RECEIVED));
        auditLog.record(record("env-2", EventAuditRecord.Status.RECEIVED));
        auditLog.record(record("env-3", EventAuditRecord.Status.RECEIVED));

        // then
        assertThat(auditLog.size()).isEqualTo(2);
        assertThat(auditLog.findByEnvelopeId("env-1")).isEmpty();
        assertThat(auditLog.recent(10)).extracting(EventAuditRecord::envelopeId)
            .containsExactly("env-3", "env-2");
    }
}
