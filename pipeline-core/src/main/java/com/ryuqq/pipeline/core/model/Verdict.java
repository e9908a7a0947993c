package com.ryuqq.pipeline.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * 검증 응답의 판정.
 *
 * <p>응답 payload에서 판정을 읽는 규칙 (먼저 발견된 것 사용):</p>
 * <ol>
 *   <li>{@code verdict}: "approved" / "rejected"</li>
 *   <li>{@code status}: "approved" / "rejected" (approval_decided 형태)</li>
 *   <li>{@code approved}: boolean 또는 "true" / "false"</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Verdict {

    APPROVED,
    REJECTED;

    /**
     * payload에서 판정 추출.
     *
     * @param payload 응답 payload (nullable)
     * @return 판정, 판정 필드가 없거나 해석할 수 없으면 empty
     */
    public static Optional<Verdict> fromPayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return Optional.empty();
        }
        Optional<Verdict> verdict = fromText(payload.get("verdict"));
        if (verdict.isPresent()) {
            return verdict;
        }
        verdict = fromText(payload.get("status"));
        if (verdict.isPresent()) {
            return verdict;
        }
        Object approved = payload.get("approved");
        if (approved instanceof Boolean) {
            return Optional.of(((Boolean) approved) ? APPROVED : REJECTED);
        }
        if (approved instanceof String) {
            String text = ((String) approved).trim();
            if ("true".equalsIgnoreCase(text)) {
                return Optional.of(APPROVED);
            }
            if ("false".equalsIgnoreCase(text)) {
                return Optional.of(REJECTED);
            }
        }
        return Optional.empty();
    }

    private static Optional<Verdict> fromText(Object value) {
        if (!(value instanceof String)) {
            return Optional.empty();
        }
        String text = ((String) value).trim();
        if ("approved".equalsIgnoreCase(text)) {
            return Optional.of(APPROVED);
        }
        if ("rejected".equalsIgnoreCase(text)) {
            return Optional.of(REJECTED);
        }
        return Optional.empty();
    }
}
