package com.ryuqq.pipeline.core.model;

import java.util.UUID;

/**
 * 파이프라인 아이템의 고유 식별자.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PipelineItemId {

    private final String value;

    private PipelineItemId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("PipelineItemId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("PipelineItemId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("PipelineItemId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 식별자 생성.
     *
     * @param value 식별자 값
     * @return PipelineItemId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static PipelineItemId of(String value) {
        return new PipelineItemId(value);
    }

    /**
     * 무작위 UUID 기반 식별자 생성.
     *
     * @return 새 식별자
     */
    public static PipelineItemId generate() {
        return new PipelineItemId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineItemId that = (PipelineItemId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "PipelineItemId{" + value + '}';
    }
}
