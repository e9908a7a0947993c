package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.alert.Alert;
import com.ryuqq.pipeline.core.alert.AlertQuery;

import java.util.List;
import java.util.Optional;

/**
 * 알림 저장소 SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AlertRepository {

    /**
     * 알림 저장 (같은 id는 덮어씀).
     *
     * @param alert 저장할 알림
     */
    void save(Alert alert);

    Optional<Alert> findById(String alertId);

    /**
     * 조건에 맞는 알림을 최신순으로 조회.
     *
     * @param query 조회 조건
     * @return 최대 {@code query.limit()}건
     */
    List<Alert> list(AlertQuery query);
}
