package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.spi.DeduplicationRegistry;

import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory implementation of {@link DeduplicationRegistry} SPI.
 *
 * <p>Uses {@link Set#add(Object)} on a concurrent key set, so of several concurrent calls with the
 * same (consumer, envelopeId) exactly one returns true.</p>
 *
 * <p>Keys are kept in insertion order up to {@code maxEntries}; past that the oldest keys are
 * forgotten, so an envelope re-delivered after that many newer ones would be processed again.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * DeduplicationRegistry registry = new InMemoryDeduplicationRegistry();
 *
 * registry.firstSeen("alert-manager", "env-1"); // true
 * registry.firstSeen("alert-manager", "env-1"); // false
 * registry.firstSeen("validation", "env-1");    // true (independent consumer)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryDeduplicationRegistry implements DeduplicationRegistry {

    public static final int DEFAULT_MAX_ENTRIES = 100_000;

    private final int maxEntries;
    private final Set<String> seen;
    private final Queue<String> order;

    public InMemoryDeduplicationRegistry() {
        this(DEFAULT_MAX_ENTRIES);
    }

    /**
     * @param maxEntries number of keys retained before the oldest are evicted
     * @throws IllegalArgumentException if maxEntries is not positive
     */
    public InMemoryDeduplicationRegistry(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.maxEntries = maxEntries;
        this.seen = ConcurrentHashMap.newKeySet();
        this.order = new ConcurrentLinkedQueue<>();
    }

    @Override
    public boolean firstSeen(String consumer, String envelopeId) {
        String key = key(consumer, envelopeId);
        if (!seen.add(key)) {
            return false;
        }
        order.add(key);
        while (seen.size() > maxEntries) {
            String oldest = order.poll();
            if (oldest == null) {
                break;
            }
            seen.remove(oldest);
        }
        return true;
    }

    @Override
    public boolean hasSeen(String consumer, String envelopeId) {
        return seen.contains(key(consumer, envelopeId));
    }

    public int size() {
        return seen.size();
    }

    public void clear() {
        seen.clear();
        order.clear();
    }

    private static String key(String consumer, String envelopeId) {
        if (consumer == null || consumer.isBlank()) {
            throw new IllegalArgumentException("consumer cannot be null or blank");
        }
        if (envelopeId == null || envelopeId.isBlank()) {
            throw new IllegalArgumentException("envelopeId cannot be null or blank");
        }
        return consumer + ':' + envelopeId;
    }
}
