package com.ryuqq.pipeline.core.alert;

/**
 * 알림 상태. OPEN → RESOLVED 한 방향으로만 전이합니다.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum AlertStatus {
    OPEN,
    RESOLVED
}
