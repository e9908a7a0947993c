package com.ryuqq.pipeline.core.statemachine;

/**
 * 제품 개발 파이프라인의 단계.
 *
 * <p><strong>단계 진행 규칙:</strong></p>
 * <ul>
 *   <li>단계 N의 유일한 정상 후속 단계는 N+1 (건너뛰기 불가)</li>
 *   <li>CANCELLED는 종료되지 않은 모든 단계에서 도달 가능</li>
 *   <li>COMPLETE, CANCELLED는 종료 단계</li>
 *   <li>관리자 강제 이동(override)만 순서를 벗어날 수 있으며 이력에 별도로 기록됨</li>
 * </ul>
 *
 * <p><strong>단계 다이어그램:</strong></p>
 * <pre>
 * DISCOVERY → IDEATION → DESIGN → SOURCING → SAMPLING → PRODUCTION → COMPLETE
 *     │           │         │         │          │            │
 *     └───────────┴─────────┴─────────┴──────────┴────────────┴──► CANCELLED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Stage {

    /**
     * 트렌드 탐색.
     */
    DISCOVERY,

    /**
     * 제품 아이디어 구체화.
     */
    IDEATION,

    /**
     * 디자인 및 테크팩 작성.
     */
    DESIGN,

    /**
     * 원부자재 조달 (마진 검증 필요).
     */
    SOURCING,

    /**
     * 샘플 제작 (생산 능력 검증 필요).
     */
    SAMPLING,

    /**
     * 양산 (경영진 승인 필요).
     */
    PRODUCTION,

    /**
     * 완료.
     */
    COMPLETE,

    /**
     * 취소.
     */
    CANCELLED;

    /**
     * 종료 단계인지 확인.
     *
     * @return COMPLETE 또는 CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == CANCELLED;
    }

    /**
     * 순서상 다음 단계 조회.
     *
     * @return 다음 단계
     * @throws IllegalStateException 종료 단계인 경우
     */
    public Stage next() {
        if (isTerminal()) {
            throw new IllegalStateException("Terminal stage has no successor: " + this);
        }
        return values()[ordinal() + 1];
    }

    /**
     * 진행 순서상 위치 비교.
     *
     * @param other 비교 대상
     * @return 이 단계가 other보다 뒤에 있으면 true
     */
    public boolean isAfter(Stage other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return ordinal() > other.ordinal();
    }
}
