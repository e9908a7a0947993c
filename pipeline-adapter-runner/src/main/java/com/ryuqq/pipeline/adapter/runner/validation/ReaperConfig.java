package com.ryuqq.pipeline.adapter.runner.validation;

/**
 * 검증 기한 스캐너 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 3600000ms = 1시간)</li>
 *   <li>batchSize: 한 번에 처리할 항목 수 (기본 100)</li>
 * </ul>
 *
 * <p>스캔은 개별 타이머가 놓친 기한 초과 검증(재시작, 시계 조정 등)을 보정합니다.
 * 기한보다 짧은 주기일 필요는 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record ReaperConfig(
    long scanIntervalMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=3600000ms (1시간), batchSize=100</p>
     */
    public ReaperConfig() {
        this(3_600_000L, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReaperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withScanIntervalMs(long scanIntervalMs) {
        return new ReaperConfig(scanIntervalMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public ReaperConfig withBatchSize(int batchSize) {
        return new ReaperConfig(scanIntervalMs, batchSize);
    }
}
