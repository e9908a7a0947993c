package com.ryuqq.pipeline.adapter.runner.transport;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 직접 전달 재시도 간격 계산기 (Exponential Backoff with Jitter).
 *
 * <p>브로드캐스트가 확인되지 않아 직접 전달로 넘어간 봉투는 제한된 횟수만큼 재시도하며,
 * 재시도 사이 간격을 지수적으로 늘리고 jitter를 더해 여러 발행자가 같은 엔드포인트를
 * 동시에 두드리지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=200ms, maxDelay=2000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 200-220ms</li>
 *   <li>attempt=2: 400-440ms</li>
 *   <li>attempt=3: 800-880ms</li>
 *   <li>attempt=5: 2000ms (maxDelay로 제한)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성 (baseDelay=200ms, maxDelay=2000ms, jitterFactor=0.1).
     */
    public BackoffCalculator() {
        this(200, 2000, 0.1);
    }

    /**
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수원을 지정해 생성 (테스트에서 jitter 고정용).
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 범위 난수원
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 전송 설정에서 생성.
     *
     * @param config 전송 설정
     * @return 설정값을 반영한 계산기
     */
    public static BackoffCalculator from(TransportConfig config) {
        return new BackoffCalculator(config.baseBackoffMs(), config.maxBackoffMs(), config.jitterFactor());
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException(
                "attempt must be positive (current: " + attempt + ")"
            );
        }

        // 시프트 overflow 방지: 62회 이상은 maxDelay와 같음
        long exponential = attempt > 62
            ? maxDelayMs
            : Math.min(baseDelayMs * (1L << (attempt - 1)), maxDelayMs);
        if (exponential <= 0) {
            exponential = maxDelayMs;
        }

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
