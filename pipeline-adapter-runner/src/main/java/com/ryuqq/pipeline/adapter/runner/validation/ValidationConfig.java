package com.ryuqq.pipeline.adapter.runner.validation;

import java.time.Duration;

/**
 * 교차 모듈 검증 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultTimeoutMs: 응답 대기 기한 (기본 172800000ms = 48시간)</li>
 *   <li>gracePeriodMs: 확정된 검증 기록 보존 시간 (기본 600000ms = 10분)</li>
 * </ul>
 *
 * <p>보존 시간 동안 도착한 늦은 응답은 "이미 확정됨"으로 버려지고,
 * 이후 도착한 응답은 "알 수 없는 상관 ID"로 버려집니다.</p>
 *
 * @param defaultTimeoutMs 응답 대기 기한 (밀리초, 양수)
 * @param gracePeriodMs 확정 기록 보존 시간 (밀리초, 0 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ValidationConfig(
    long defaultTimeoutMs,
    long gracePeriodMs
) {

    /**
     * 기본 설정 생성자.
     */
    public ValidationConfig() {
        this(172_800_000L, 600_000L);
    }

    public ValidationConfig {
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "defaultTimeoutMs must be positive (current: " + defaultTimeoutMs + ")"
            );
        }
        if (gracePeriodMs < 0) {
            throw new IllegalArgumentException(
                "gracePeriodMs cannot be negative (current: " + gracePeriodMs + ")"
            );
        }
    }

    public Duration defaultTimeout() {
        return Duration.ofMillis(defaultTimeoutMs);
    }

    public ValidationConfig withDefaultTimeoutMs(long defaultTimeoutMs) {
        return new ValidationConfig(defaultTimeoutMs, gracePeriodMs);
    }

    public ValidationConfig withGracePeriodMs(long gracePeriodMs) {
        return new ValidationConfig(defaultTimeoutMs, gracePeriodMs);
    }
}
