package com.ryuqq.pipeline.adapter.runner.alert;

import com.ryuqq.pipeline.adapter.inmemory.store.InMemoryAlertRepository;
import com.ryuqq.pipeline.adapter.inmemory.store.InMemoryDeduplicationRegistry;
import com.ryuqq.pipeline.core.alert.Alert;
import com.ryuqq.pipeline.core.alert.AlertQuery;
import com.ryuqq.pipeline.core.alert.AlertSeverity;
import com.ryuqq.pipeline.core.alert.AlertStatus;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.exception.AlreadyResolvedException;
import com.ryuqq.pipeline.core.exception.NotFoundException;
import com.ryuqq.pipeline.core.transport.EventHandler;
import com.ryuqq.pipeline.core.transport.EventTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * AlertManager 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AlertManagerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    @Mock
    private EventTransport transport;

    private InMemoryAlertRepository repository;
    private AlertManager alertManager;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAlertRepository();
        alertManager = new AlertManager(repository, new InMemoryDeduplicationRegistry(), Clock.fixed(T0, ZoneOffset.UTC));
    }

    // ============================================================
    // 1. 이벤트 → 알림
    // ============================================================

    @Test
    void 알림_대상_이벤트는_OPEN_알림으로_저장된다() {
        // given
        EventEnvelope envelope = EventEnvelope.create("financial_report", ModuleName.FINANCE, null,
            Map.of("summary", "Q1 margin 41%"), null, T0);

        // when
        Optional<Alert> alert = alertManager.onEvent(envelope);

        // then
        assertThat(alert).isPresent();
        assertThat(alert.get().status()).isEqualTo(AlertStatus.OPEN);
        assertThat(alert.get().severity()).isEqualTo(AlertSeverity.MEDIUM);
        assertThat(alert.get().message()).isEqualTo("Q1 margin 41%");
        assertThat(alert.get().sourceEvent()).isEqualTo(envelope);
        assertThat(alert.get().createdAt()).isEqualTo(T0);
        assertThat(alertManager.get(alert.get().id())).isEqualTo(alert.get());
    }

    @Test
    void 같은_봉투는_한_번만_알림이_된다() {
        // given
        EventEnvelope envelope = EventEnvelope.create("delivery_failed", ModuleName.DESIGN, ModuleName.DESIGN,
            Map.of("undelivered_envelope_id", "env-1"), null, T0);

        // when
        Optional<Alert> first = alertManager.onEvent(envelope);
        Optional<Alert> second = alertManager.onEvent(envelope);

        // then
        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    void 알림_대상이_아닌_이벤트는_무시된다() {
        // when
        Optional<Alert> alert = alertManager.onEvent(
            EventEnvelope.create("demand_forecast", ModuleName.MARKETING, null, Map.of(), null, T0));

        // then
        assertThat(alert).isEmpty();
        assertThat(repository.size()).isZero();
    }

    @Test
    void register는_알림_대상_종류마다_구독한다() {
        // when
        alertManager.register(transport);

        // then
        int kinds = SeverityTable.alertKinds().size();
        verify(transport, times(kinds)).subscribe(any(EventKind.class), any(EventHandler.class));
        verify(transport).subscribe(eq(EventKind.UNCLASSIFIED), any(EventHandler.class));
    }

    // ============================================================
    // 2. 해결
    // ============================================================

    @Test
    void 해결하면_RESOLVED로_바뀌고_해결_주체가_기록된다() {
        // given
        Alert alert = alertManager.raise(AlertSeverity.HIGH, "ops", "Warehouse offline", "no heartbeat");

        // when
        Alert resolved = alertManager.resolve(alert.id(), "coo@studio");

        // then
        assertThat(resolved.status()).isEqualTo(AlertStatus.RESOLVED);
        assertThat(resolved.resolvedBy()).isEqualTo("coo@studio");
        assertThat(resolved.resolvedAt()).isEqualTo(T0);
        assertThat(resolved.createdAt()).isEqualTo(alert.createdAt());
        assertThat(alertManager.get(alert.id()).isOpen()).isFalse();
    }

    @Test
    void 이미_해결된_알림은_AlreadyResolved() {
        // given
        Alert alert = alertManager.raise(AlertSeverity.LOW, "ops", "Noise", null);
        alertManager.resolve(alert.id(), "someone");

        // when & then
        assertThatThrownBy(() -> alertManager.resolve(alert.id(), "someone-else"))
            .isInstanceOf(AlreadyResolvedException.class);
        assertThat(alertManager.get(alert.id()).resolvedBy()).isEqualTo("someone");
    }

    @Test
    void 없는_알림은_NotFound() {
        assertThatThrownBy(() -> alertManager.resolve("missing", "someone"))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> alertManager.get("missing"))
            .isInstanceOf(NotFoundException.class);
    }

    // ============================================================
    // 3. 조회
    // ============================================================

    @Test
    void 상태와_심각도로_필터링한다() {
        // given
        Alert critical = alertManager.raise(AlertSeverity.CRITICAL, "delivery", "Down", null);
        Alert low = alertManager.raise(AlertSeverity.LOW, "ops", "Info", null);
        alertManager.resolve(low.id(), "someone");

        // when & then
        assertThat(alertManager.list(AlertQuery.open())).extracting(Alert::id).containsExactly(critical.id());
        assertThat(alertManager.list(new AlertQuery().withSeverity(AlertSeverity.LOW)))
            .extracting(Alert::id).containsExactly(low.id());
        assertThat(alertManager.list(null)).hasSize(2);
    }
}
