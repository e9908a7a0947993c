package com.ryuqq.pipeline.core.alert;

import java.util.Locale;

/**
 * 알림 심각도.
 *
 * <p>선언 순서가 심각도 순서입니다 (LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AlertSeverity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @return 소문자 와이어 이름 (예: "critical")
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param other 비교 대상
     * @return 이 심각도가 other 이상이면 true
     */
    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }

    /**
     * 와이어 이름 또는 enum 이름으로 조회 (대소문자 무시).
     *
     * @param value 심각도 이름
     * @return 대응하는 심각도
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static AlertSeverity fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("severity cannot be null or blank");
        }
        for (AlertSeverity severity : values()) {
            if (severity.name().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
