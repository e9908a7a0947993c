package com.ryuqq.pipeline.core.alert;

import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.exception.AlreadyResolvedException;

import java.time.Instant;
import java.util.UUID;

/**
 * 사람이 검토할 심각도 분류 알림.
 *
 * <p>알림 관리자가 생성하며, 해결(resolve) 외에는 변경되지 않습니다.</p>
 *
 * @param id 알림 식별자
 * @param severity 심각도
 * @param category 분류 (예: "inventory", "validation", "delivery")
 * @param title 제목
 * @param message 본문
 * @param sourceEvent 알림을 만든 봉투 (수동 알림은 null)
 * @param status 상태
 * @param createdAt 생성 시각
 * @param resolvedAt 해결 시각 (nullable)
 * @param resolvedBy 해결 주체 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Alert(
    String id,
    AlertSeverity severity,
    String category,
    String title,
    String message,
    EventEnvelope sourceEvent,
    AlertStatus status,
    Instant createdAt,
    Instant resolvedAt,
    String resolvedBy
) {

    public Alert {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be null or blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (status == AlertStatus.RESOLVED && resolvedAt == null) {
            throw new IllegalArgumentException("resolvedAt is required for a resolved alert");
        }
        if (message == null) {
            message = "";
        }
    }

    /**
     * 새 OPEN 알림 생성.
     *
     * @param severity 심각도
     * @param category 분류
     * @param title 제목
     * @param message 본문
     * @param sourceEvent 원인 봉투 (nullable)
     * @param now 생성 시각
     * @return OPEN 알림
     */
    public static Alert open(
        AlertSeverity severity,
        String category,
        String title,
        String message,
        EventEnvelope sourceEvent,
        Instant now
    ) {
        return new Alert(UUID.randomUUID().toString(), severity, category, title, message, sourceEvent,
            AlertStatus.OPEN, now, null, null);
    }

    /**
     * 해결된 사본 반환.
     *
     * @param by 해결 주체 (nullable)
     * @param now 해결 시각
     * @return RESOLVED 알림
     * @throws AlreadyResolvedException 이미 해결된 경우
     */
    public Alert resolve(String by, Instant now) {
        if (status == AlertStatus.RESOLVED) {
            throw new AlreadyResolvedException("Alert already resolved: " + id);
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        return new Alert(id, severity, category, title, message, sourceEvent, AlertStatus.RESOLVED,
            createdAt, now, by);
    }

    public boolean isOpen() {
        return status == AlertStatus.OPEN;
    }
}
