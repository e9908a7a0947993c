package com.ryuqq.pipeline.core.model;

import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.contract.ModuleName;

import java.util.Optional;

/**
 * 모듈 간 검증 종류.
 *
 * <p>각 검증은 응답할 모듈과 요청/응답 이벤트 종류를 알고 있습니다.</p>
 *
 * <ul>
 *   <li>MARGIN_CHECK - FINANCE, margin_check_request / margin_check_response</li>
 *   <li>CAPACITY_CHECK - OPERATIONS, capacity_check_request / capacity_check_response</li>
 *   <li>PRODUCT_APPROVAL - EXECUTIVE, product_approval_request / approval_decided</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ValidationType {

    MARGIN_CHECK("margin_check", ModuleName.FINANCE,
        EventKind.MARGIN_CHECK_REQUEST, EventKind.MARGIN_CHECK_RESPONSE),
    CAPACITY_CHECK("capacity_check", ModuleName.OPERATIONS,
        EventKind.CAPACITY_CHECK_REQUEST, EventKind.CAPACITY_CHECK_RESPONSE),
    PRODUCT_APPROVAL("product_approval", ModuleName.EXECUTIVE,
        EventKind.PRODUCT_APPROVAL_REQUEST, EventKind.APPROVAL_DECIDED);

    private final String wireName;
    private final ModuleName responder;
    private final EventKind requestKind;
    private final EventKind responseKind;

    ValidationType(String wireName, ModuleName responder, EventKind requestKind, EventKind responseKind) {
        this.wireName = wireName;
        this.responder = responder;
        this.requestKind = requestKind;
        this.responseKind = responseKind;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return 검증에 응답하는 모듈 (요청 봉투의 targetModule)
     */
    public ModuleName responder() {
        return responder;
    }

    public EventKind requestKind() {
        return requestKind;
    }

    public EventKind responseKind() {
        return responseKind;
    }

    /**
     * 와이어 이름("margin_check") 또는 enum 이름으로 조회.
     *
     * @param value 검증 종류 이름, 대소문자 무시
     * @return 대응하는 검증 종류
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static ValidationType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("validation type cannot be null or blank");
        }
        for (ValidationType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown validation type: " + value);
    }

    /**
     * 응답 이벤트 종류로 검증 종류 조회.
     *
     * @param kind 이벤트 종류
     * @return 응답 종류가 일치하는 검증, 없으면 empty
     */
    public static Optional<ValidationType> forResponseKind(EventKind kind) {
        for (ValidationType type : values()) {
            if (type.responseKind == kind) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
