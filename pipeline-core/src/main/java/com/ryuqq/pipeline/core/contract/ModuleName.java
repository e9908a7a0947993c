package com.ryuqq.pipeline.core.contract;

/**
 * 이벤트를 주고받는 조직 모듈.
 *
 * <p>각 모듈은 이벤트로만 도달 가능한 자율적인 상대방이며,
 * 와이어 포맷에서는 짧은 식별자({@link #wireName()})로 표현됩니다.</p>
 *
 * <ul>
 *   <li>EXECUTIVE (ceo) - 승인 결정</li>
 *   <li>FINANCE (cfo) - 마진 검증, 예산 배정</li>
 *   <li>OPERATIONS (coo) - 생산 능력 검증, 생산 착수</li>
 *   <li>MARKETING (cmo) - 출시 일정, 캠페인</li>
 *   <li>DESIGN (cdo) - 이 파이프라인을 소유하는 모듈</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ModuleName {

    EXECUTIVE("ceo"),
    FINANCE("cfo"),
    OPERATIONS("coo"),
    MARKETING("cmo"),
    DESIGN("cdo");

    private final String wireName;

    ModuleName(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 와이어 식별자 조회.
     *
     * @return 와이어 식별자 (예: "cfo")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 와이어 식별자 또는 enum 이름으로 모듈 조회.
     *
     * @param value 와이어 식별자 ("cfo") 또는 이름 ("FINANCE"), 대소문자 무시
     * @return 대응하는 모듈
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ModuleName fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("module name cannot be null or blank");
        }
        for (ModuleName module : values()) {
            if (module.wireName.equalsIgnoreCase(value) || module.name().equalsIgnoreCase(value)) {
                return module;
            }
        }
        throw new IllegalArgumentException("Unknown module: " + value);
    }
}
