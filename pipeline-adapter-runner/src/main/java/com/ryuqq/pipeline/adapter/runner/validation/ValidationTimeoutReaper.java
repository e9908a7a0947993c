package com.ryuqq.pipeline.adapter.runner.validation;

import com.ryuqq.pipeline.application.runtime.ManagedLifecycle;
import com.ryuqq.pipeline.core.model.CorrelationId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 검증 기한 스캐너.
 *
 * <p>기한이 지났는데 아직 WAITING인 검증을 찾아 TIMED_OUT으로 확정하고,
 * 보존 시간이 지난 확정 기록을 정리합니다.</p>
 *
 * <p><strong>보정 시나리오:</strong></p>
 * <pre>
 * 1. 검증 요청 → 개별 기한 타이머 등록
 * 2. 타이머 유실 (스케줄러 지연, 시계 조정 등)
 * 3. 상태: WAITING으로 유지 (기한은 이미 지남)
 * 4. 스캐너가 주기적 스캔 (기본 1시간마다)
 * 5. 기한 초과 기록 발견 → expire() → TIMED_OUT 확정 + validation_timeout 발행
 * 6. 보존 시간 초과 확정 기록 → purge()
 * </pre>
 *
 * <p><strong>멱등성:</strong> expire()/purge()는 이미 처리된 기록에 대해 false를 반환할 뿐이므로
 * 타이머와 스캐너가 같은 기록을 동시에 처리해도 결과는 하나입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ValidationTimeoutReaper implements ManagedLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ValidationTimeoutReaper.class);

    private final ValidationOrchestrator orchestrator;
    private final ReaperConfig config;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param orchestrator 검증 관리자
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ValidationTimeoutReaper(ValidationOrchestrator orchestrator, ReaperConfig config, Clock clock) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.orchestrator = orchestrator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 기한 초과 검증 스캔 및 정리.
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. scanOverdue(now, batchSize) → [CorrelationId1, ...]
     * 2. For each: expire(correlationId)
     * 3. scanExpiredResolved(now, batchSize) → purge(correlationId)
     * 4. 처리 건수 로깅
     * </pre>
     *
     * @return 이번 스캔에서 TIMED_OUT으로 확정한 건수
     */
    public int scan() {
        log.debug("Validation reaper scan started");
        Instant now = clock.instant();

        // 1. 기한 초과 대기 기록
        List<CorrelationId> overdue = orchestrator.scanOverdue(now, config.batchSize());
        int expired = 0;
        for (CorrelationId correlationId : overdue) {
            if (tryExpire(correlationId)) {
                expired++;
            }
        }

        // 2. 보존 시간 초과 확정 기록
        int purged = 0;
        for (CorrelationId correlationId : orchestrator.scanExpiredResolved(now, config.batchSize())) {
            if (orchestrator.purge(correlationId)) {
                purged++;
            }
        }

        if (expired > 0 || purged > 0) {
            log.info("Validation reaper scan completed: {} timed out out of {} overdue, {} purged",
                expired, overdue.size(), purged);
        }
        return expired;
    }

    /**
     * 개별 기록 기한 처리.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 기록 처리를 방해하지 않습니다.</p>
     */
    private boolean tryExpire(CorrelationId correlationId) {
        try {
            return orchestrator.expire(correlationId);
        } catch (RuntimeException e) {
            log.error("Failed to expire validation {} in reaper scan", correlationId.getValue(), e);
            return false;
        }
    }

    @Override
    public void start() {
        if (stopped.get() || !running.compareAndSet(false, true)) {
            throw new IllegalStateException("ValidationTimeoutReaper already started or stopped");
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-validation-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::scanSafely,
            config.scanIntervalMs(), config.scanIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("ValidationTimeoutReaper started (interval: {}ms, batch: {})",
            config.scanIntervalMs(), config.batchSize());
    }

    @Override
    public void stop() {
        stopped.set(true);
        if (!running.compareAndSet(true, false)) {
            return;
        }
        scheduler.shutdownNow();
        log.info("ValidationTimeoutReaper stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void scanSafely() {
        try {
            scan();
        } catch (RuntimeException e) {
            log.error("Validation reaper scan failed", e);
        }
    }
}
