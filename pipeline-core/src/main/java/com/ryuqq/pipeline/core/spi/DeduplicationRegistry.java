package com.ryuqq.pipeline.core.spi;

/**
 * 봉투 중복 제거 SPI.
 *
 * <p>전달이 최소 1회이므로 같은 봉투 id가 여러 번 도착할 수 있습니다. 소비자는 부수 효과 전에
 * {@link #firstSeen(String, String)}을 호출하고, false면 조용히 버립니다. 중복은 발행자에게
 * 오류가 아닙니다.</p>
 *
 * <p><strong>동시성 보장:</strong></p>
 * <p>같은 (consumer, envelopeId)로 동시에 호출되어도 정확히 한 호출만 true를 받아야 합니다.</p>
 *
 * <p><strong>구현 예시:</strong></p>
 * <pre>
 * public class InMemoryDeduplicationRegistry implements DeduplicationRegistry {
 *     private final Set&lt;String&gt; seen = ConcurrentHashMap.newKeySet();
 *
 *     {@literal @}Override
 *     public boolean firstSeen(String consumer, String envelopeId) {
 *         return seen.add(consumer + ':' + envelopeId);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface DeduplicationRegistry {

    /**
     * 처음 보는 봉투인지 확인하고 기록.
     *
     * @param consumer 소비자 이름 (소비자마다 독립적으로 중복 제거)
     * @param envelopeId 봉투 id
     * @return 처음이면 true, 이미 본 경우 false
     * @throws IllegalArgumentException 인자가 null이거나 빈 문자열인 경우
     */
    boolean firstSeen(String consumer, String envelopeId);

    /**
     * 조회만 수행.
     *
     * @param consumer 소비자 이름
     * @param envelopeId 봉투 id
     * @return 이미 기록된 경우 true
     */
    boolean hasSeen(String consumer, String envelopeId);
}
