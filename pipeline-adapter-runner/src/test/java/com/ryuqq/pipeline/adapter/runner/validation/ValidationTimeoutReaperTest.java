package com.ryuqq.pipeline.adapter.runner.validation;

import com.ryuqq.pipeline.core.model.CorrelationId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ValidationTimeoutReaper 유닛 테스트.
 *
 * <ul>
 *   <li>기한 초과 기록 TIMED_OUT 확정</li>
 *   <li>보존 시간 초과 기록 정리</li>
 *   <li>예외 발생 시에도 계속 진행</li>
 *   <li>주기 실행 수명 주기</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ValidationTimeoutReaperTest {

    private static final Instant NOW = Instant.parse("2026-03-04T09:00:00Z");

    @Mock
    private ValidationOrchestrator orchestrator;

    private ReaperConfig config;
    private ValidationTimeoutReaper reaper;

    @BeforeEach
    void setUp() {
        config = new ReaperConfig(); // scanIntervalMs=3600000, batchSize=100
        reaper = new ValidationTimeoutReaper(orchestrator, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ============================================================
    // 1. 기한 초과 처리
    // ============================================================

    @Test
    void scan은_기한이_지난_대기_검증을_모두_만료시킨다() {
        // given
        CorrelationId c1 = CorrelationId.of("corr-1");
        CorrelationId c2 = CorrelationId.of("corr-2");
        when(orchestrator.scanOverdue(NOW, 100)).thenReturn(List.of(c1, c2));
        when(orchestrator.expire(c1)).thenReturn(true);
        when(orchestrator.expire(c2)).thenReturn(true);
        when(orchestrator.scanExpiredResolved(NOW, 100)).thenReturn(List.of());

        // when
        int expired = reaper.scan();

        // then
        assertThat(expired).isEqualTo(2);
        verify(orchestrator).expire(c1);
        verify(orchestrator).expire(c2);
    }

    @Test
    void 이미_응답으로_확정된_기록은_카운트하지_않는다() {
        // given
        CorrelationId raced = CorrelationId.of("corr-raced");
        when(orchestrator.scanOverdue(NOW, 100)).thenReturn(List.of(raced));
        when(orchestrator.expire(raced)).thenReturn(false);
        when(orchestrator.scanExpiredResolved(NOW, 100)).thenReturn(List.of());

        // when
        int expired = reaper.scan();

        // then
        assertThat(expired).isZero();
    }

    @Test
    void 한_기록에서_예외가_나도_나머지를_계속_처리한다() {
        // given
        CorrelationId broken = CorrelationId.of("corr-broken");
        CorrelationId healthy = CorrelationId.of("corr-healthy");
        when(orchestrator.scanOverdue(NOW, 100)).thenReturn(List.of(broken, healthy));
        when(orchestrator.expire(broken)).thenThrow(new IllegalStateException("listener failure"));
        when(orchestrator.expire(healthy)).thenReturn(true);
        when(orchestrator.scanExpiredResolved(NOW, 100)).thenReturn(List.of());

        // when
        int expired = reaper.scan();

        // then
        assertThat(expired).isEqualTo(1);
        verify(orchestrator).expire(healthy);
    }

    // ============================================================
    // 2. 정리
    // ============================================================

    @Test
    void scan은_보존_시간이_지난_확정_기록을_정리한다() {
        // given
        CorrelationId old = CorrelationId.of("corr-old");
        when(orchestrator.scanOverdue(NOW, 100)).thenReturn(List.of());
        when(orchestrator.scanExpiredResolved(NOW, 100)).thenReturn(List.of(old));
        when(orchestrator.purge(old)).thenReturn(true);

        // when
        reaper.scan();

        // then
        verify(orchestrator).purge(old);
        verify(orchestrator, never()).expire(any());
    }

    @Test
    void batchSize를_스캔_한도로_사용한다() {
        // given
        reaper = new ValidationTimeoutReaper(orchestrator, config.withBatchSize(5), Clock.fixed(NOW, ZoneOffset.UTC));
        when(orchestrator.scanOverdue(NOW, 5)).thenReturn(List.of());
        when(orchestrator.scanExpiredResolved(NOW, 5)).thenReturn(List.of());

        // when
        reaper.scan();

        // then
        verify(orchestrator).scanOverdue(NOW, 5);
        verify(orchestrator).scanExpiredResolved(NOW, 5);
    }

    // ============================================================
    // 3. 수명 주기
    // ============================================================

    @Test
    void start하면_주기적으로_스캔하고_stop하면_멈춘다() {
        // given
        reaper = new ValidationTimeoutReaper(orchestrator, config.withScanIntervalMs(20), Clock.fixed(NOW, ZoneOffset.UTC));
        when(orchestrator.scanOverdue(NOW, 100)).thenReturn(List.of());
        when(orchestrator.scanExpiredResolved(NOW, 100)).thenReturn(List.of());

        // when
        reaper.start();

        // then
        verify(orchestrator, timeout(1000).atLeastOnce()).scanOverdue(NOW, 100);
        reaper.stop();
        assertThat(reaper.isRunning()).isFalse();
        assertThatThrownBy(() -> reaper.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 생성자_의존성_검증() {
        assertThatThrownBy(() -> new ValidationTimeoutReaper(null, config, Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("orchestrator cannot be null");
        assertThatThrownBy(() -> new ValidationTimeoutReaper(orchestrator, null, Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
    }

    @Test
    void ReaperConfig_기본값과_검증() {
        assertThat(config.scanIntervalMs()).isEqualTo(3_600_000L);
        assertThat(config.batchSize()).isEqualTo(100);
        assertThatThrownBy(() -> config.withBatchSize(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withScanIntervalMs(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
