package com.ryuqq.pipeline.adapter.runner.transport;

/**
 * 이벤트 전송 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>livenessWindowMs: 브로드캐스트 확인 대기 시간 (기본 2000ms)</li>
 *   <li>maxAttempts: 직접 전달 최대 시도 횟수 (기본 3)</li>
 *   <li>baseBackoffMs / maxBackoffMs: 재시도 간격 범위 (기본 200ms / 2000ms)</li>
 *   <li>jitterFactor: 재시도 간격 jitter 비율 (기본 0.1)</li>
 *   <li>publishPoolSize: 발행 작업 스레드 수 (기본 4)</li>
 *   <li>drainTimeoutMs: 종료 시 토픽별 대기열 비우기 제한 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @param livenessWindowMs 브로드캐스트 확인 대기 시간 (밀리초, 양수)
 * @param maxAttempts 직접 전달 최대 시도 횟수 (1 이상)
 * @param baseBackoffMs 기본 재시도 간격 (밀리초, 양수)
 * @param maxBackoffMs 최대 재시도 간격 (밀리초, baseBackoffMs 이상)
 * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
 * @param publishPoolSize 발행 스레드 수 (1 이상)
 * @param drainTimeoutMs 종료 대기 시간 (밀리초, 양수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TransportConfig(
    long livenessWindowMs,
    int maxAttempts,
    long baseBackoffMs,
    long maxBackoffMs,
    double jitterFactor,
    int publishPoolSize,
    long drainTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     */
    public TransportConfig() {
        this(2000, 3, 200, 2000, 0.1, 4, 5000);
    }

    public TransportConfig {
        if (livenessWindowMs <= 0) {
            throw new IllegalArgumentException(
                "livenessWindowMs must be positive (current: " + livenessWindowMs + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "baseBackoffMs must be positive (current: " + baseBackoffMs + ")"
            );
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= baseBackoffMs (base: " + baseBackoffMs + ", max: " + maxBackoffMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (publishPoolSize <= 0) {
            throw new IllegalArgumentException(
                "publishPoolSize must be positive (current: " + publishPoolSize + ")"
            );
        }
        if (drainTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "drainTimeoutMs must be positive (current: " + drainTimeoutMs + ")"
            );
        }
    }

    public TransportConfig withLivenessWindowMs(long livenessWindowMs) {
        return new TransportConfig(livenessWindowMs, maxAttempts, baseBackoffMs, maxBackoffMs,
            jitterFactor, publishPoolSize, drainTimeoutMs);
    }

    public TransportConfig withMaxAttempts(int maxAttempts) {
        return new TransportConfig(livenessWindowMs, maxAttempts, baseBackoffMs, maxBackoffMs,
            jitterFactor, publishPoolSize, drainTimeoutMs);
    }

    /**
     * 재시도 간격 범위만 변경한 새 인스턴스 생성.
     */
    public TransportConfig withBackoff(long baseBackoffMs, long maxBackoffMs) {
        return new TransportConfig(livenessWindowMs, maxAttempts, baseBackoffMs, maxBackoffMs,
            jitterFactor, publishPoolSize, drainTimeoutMs);
    }

    public TransportConfig withJitterFactor(double jitterFactor) {
        return new TransportConfig(livenessWindowMs, maxAttempts, baseBackoffMs, maxBackoffMs,
            jitterFactor, publishPoolSize, drainTimeoutMs);
    }

    public TransportConfig withPublishPoolSize(int publishPoolSize) {
        return new TransportConfig(livenessWindowMs, maxAttempts, baseBackoffMs, maxBackoffMs,
            jitterFactor, publishPoolSize, drainTimeoutMs);
    }

    public TransportConfig withDrainTimeoutMs(long drainTimeoutMs) {
        return new TransportConfig(livenessWindowMs, maxAttempts, baseBackoffMs, maxBackoffMs,
            jitterFactor, publishPoolSize, drainTimeoutMs);
    }
}
