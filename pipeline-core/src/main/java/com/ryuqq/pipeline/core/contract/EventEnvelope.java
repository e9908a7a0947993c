package com.ryuqq.pipeline.core.contract;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 모듈 간 통신의 최소 단위인 이벤트 봉투 (Event Envelope).
 *
 * <p>봉투는 생성 후 변경되지 않으며 {@code id}로 유일하게 식별됩니다.
 * 전달은 최소 1회(at-least-once)이므로 같은 {@code id}의 봉투가 여러 번 도착할 수 있고,
 * 수신 측은 {@code id} 기준으로 멱등하게 처리해야 합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 봉투 고유 식별자 (생성 시 발급)</li>
 *   <li><strong>type:</strong> 이벤트 종류 와이어 이름 (예: margin_check_request)</li>
 *   <li><strong>sourceModule:</strong> 발신 모듈</li>
 *   <li><strong>targetModule:</strong> 수신 모듈 (null이면 브로드캐스트)</li>
 *   <li><strong>payload:</strong> 종류별 구조화 데이터 (수정 불가 사본)</li>
 *   <li><strong>correlationId:</strong> 검증 요청과 응답을 잇는 식별자 (선택)</li>
 *   <li><strong>timestamp:</strong> 생성 시각</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * EventEnvelope request = EventEnvelope.of(
 *     EventKind.MARGIN_CHECK_REQUEST, ModuleName.DESIGN, ModuleName.FINANCE,
 *     Map.of("product_id", "p-1"))
 *     .withCorrelationId("c-1");
 * </pre>
 *
 * @param id 봉투 고유 식별자
 * @param type 이벤트 종류 와이어 이름
 * @param sourceModule 발신 모듈
 * @param targetModule 수신 모듈 (nullable)
 * @param payload 구조화 데이터
 * @param correlationId 상관관계 식별자 (nullable)
 * @param timestamp 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EventEnvelope(
    String id,
    String type,
    ModuleName sourceModule,
    ModuleName targetModule,
    Map<String, Object> payload,
    String correlationId,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public EventEnvelope {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (sourceModule == null) {
            throw new IllegalArgumentException("sourceModule cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (correlationId != null && correlationId.isBlank()) {
            correlationId = null;
        }
        // null 값 허용, 키 순서 보존
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * 새 id와 현재 시각으로 봉투 생성.
     *
     * @param kind 이벤트 종류
     * @param source 발신 모듈
     * @param target 수신 모듈 (null이면 브로드캐스트)
     * @param payload 구조화 데이터
     * @return 생성된 봉투
     */
    public static EventEnvelope of(EventKind kind, ModuleName source, ModuleName target, Map<String, Object> payload) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return create(kind.wireName(), source, target, payload, null, Instant.now());
    }

    /**
     * 새 id로 봉투 생성 (모든 필드 지정).
     *
     * @param type 이벤트 종류 와이어 이름
     * @param source 발신 모듈
     * @param target 수신 모듈 (nullable)
     * @param payload 구조화 데이터
     * @param correlationId 상관관계 식별자 (nullable)
     * @param timestamp 생성 시각
     * @return 생성된 봉투
     */
    public static EventEnvelope create(
        String type,
        ModuleName source,
        ModuleName target,
        Map<String, Object> payload,
        String correlationId,
        Instant timestamp
    ) {
        return new EventEnvelope(UUID.randomUUID().toString(), type, source, target, payload, correlationId, timestamp);
    }

    /**
     * 상관관계 식별자를 지정한 사본 반환 (id 유지).
     *
     * @param newCorrelationId 상관관계 식별자
     * @return 새 봉투
     */
    public EventEnvelope withCorrelationId(String newCorrelationId) {
        return new EventEnvelope(id, type, sourceModule, targetModule, payload, newCorrelationId, timestamp);
    }

    /**
     * 태그된 이벤트 종류 조회.
     *
     * @return 알 수 없는 종류면 {@link EventKind#UNCLASSIFIED}
     */
    public EventKind kind() {
        return EventKind.fromWire(type);
    }

    /**
     * @return 수신 모듈이 지정되지 않은 경우 true
     */
    public boolean isBroadcast() {
        return targetModule == null;
    }

    /**
     * payload 값을 문자열로 조회.
     *
     * @param key payload 키
     * @return 값의 문자열 표현, 없으면 null
     */
    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }
}
