package com.ryuqq.pipeline.core.model;

import java.util.UUID;

/**
 * 검증 요청과 그 응답을 잇는 상관관계 식별자.
 *
 * <p>요청 봉투의 {@code correlationId}와 payload의 {@code validation_request_id}에
 * 같은 값이 실리며, 응답 봉투는 둘 중 하나로 요청을 지목합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CorrelationId {

    private final String value;

    private CorrelationId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CorrelationId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CorrelationId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * @param value 식별자 값
     * @return CorrelationId 인스턴스
     * @throws IllegalArgumentException null, 빈 문자열 또는 255자 초과인 경우
     */
    public static CorrelationId of(String value) {
        return new CorrelationId(value);
    }

    /**
     * @return 무작위 UUID 기반 새 식별자
     */
    public static CorrelationId generate() {
        return new CorrelationId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationId that = (CorrelationId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CorrelationId{" + value + '}';
    }
}
