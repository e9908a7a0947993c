package com.ryuqq.pipeline.core.alert;

/**
 * 알림 목록 조회 조건.
 *
 * <p>null 필드는 필터를 적용하지 않습니다. 결과는 최신순이며 {@code limit}건까지 반환합니다.</p>
 *
 * @param status 상태 필터 (nullable)
 * @param severity 심각도 필터 (nullable)
 * @param category 분류 필터 (nullable)
 * @param limit 최대 건수 (1 이상)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AlertQuery(
    AlertStatus status,
    AlertSeverity severity,
    String category,
    int limit
) {

    public static final int DEFAULT_LIMIT = 50;

    public AlertQuery {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        if (category != null && category.isBlank()) {
            category = null;
        }
    }

    /**
     * 필터 없는 기본 조회.
     */
    public AlertQuery() {
        this(null, null, null, DEFAULT_LIMIT);
    }

    public static AlertQuery all() {
        return new AlertQuery();
    }

    public static AlertQuery open() {
        return new AlertQuery().withStatus(AlertStatus.OPEN);
    }

    public AlertQuery withStatus(AlertStatus newStatus) {
        return new AlertQuery(newStatus, severity, category, limit);
    }

    public AlertQuery withSeverity(AlertSeverity newSeverity) {
        return new AlertQuery(status, newSeverity, category, limit);
    }

    public AlertQuery withCategory(String newCategory) {
        return new AlertQuery(status, severity, newCategory, limit);
    }

    public AlertQuery withLimit(int newLimit) {
        return new AlertQuery(status, severity, category, newLimit);
    }

    /**
     * @param alert 검사할 알림
     * @return 모든 필터를 통과하면 true
     */
    public boolean matches(Alert alert) {
        if (status != null && alert.status() != status) {
            return false;
        }
        if (severity != null && alert.severity() != severity) {
            return false;
        }
        return category == null || category.equals(alert.category());
    }
}
