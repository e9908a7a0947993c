package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.spi.DirectDelivery;
import com.ryuqq.pipeline.core.spi.DirectDeliveryException;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory {@link DirectDelivery} that routes POSTs to registered receivers.
 *
 * <p>Stands in for the HTTP fallback path. Each endpoint URI maps to a receiver (usually a
 * module transport's {@code receiveWire}). Failures can be scripted per target module.</p>
 *
 * <p><strong>Failure scripting:</strong></p>
 * <ul>
 *   <li>{@link #failNext(ModuleName, int)}: the next N attempts to the module fail with 503</li>
 *   <li>{@link #failAlways(ModuleName)}: every attempt fails until {@link #recover(ModuleName)}</li>
 *   <li>Unrouted endpoints fail like a refused connection (no status code)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedDirectDelivery implements DirectDelivery {

    private final Map<URI, Consumer<String>> routes = new ConcurrentHashMap<>();
    private final Map<ModuleName, AtomicInteger> pendingFailures = new ConcurrentHashMap<>();
    private final Set<ModuleName> unavailable = ConcurrentHashMap.newKeySet();
    private final List<Attempt> attempts = new CopyOnWriteArrayList<>();

    /**
     * Registers the receiver behind an endpoint.
     *
     * @param endpoint the endpoint URI
     * @param receiver consumer of the raw wire envelope
     */
    public void route(URI endpoint, Consumer<String> receiver) {
        if (endpoint == null || receiver == null) {
            throw new IllegalArgumentException("endpoint and receiver cannot be null");
        }
        routes.put(endpoint, receiver);
    }

    /**
     * Makes the next {@code times} attempts to the module fail.
     */
    public void failNext(ModuleName target, int times) {
        if (times < 0) {
            throw new IllegalArgumentException("times cannot be negative");
        }
        pendingFailures.computeIfAbsent(target, key -> new AtomicInteger()).set(times);
    }

    /**
     * Makes every attempt to the module fail until {@link #recover(ModuleName)}.
     */
    public void failAlways(ModuleName target) {
        unavailable.add(target);
    }

    public void recover(ModuleName target) {
        unavailable.remove(target);
        pendingFailures.remove(target);
    }

    @Override
    public void deliver(ModuleName target, URI endpoint, String wireEnvelope) {
        boolean scriptedFailure = unavailable.contains(target) || consumeFailure(target);
        attempts.add(new Attempt(target, endpoint, wireEnvelope, !scriptedFailure));
        if (scriptedFailure) {
            throw new DirectDeliveryException("Scripted failure for " + target.wireName() + " at " + endpoint, 503, null);
        }
        Consumer<String> receiver = routes.get(endpoint);
        if (receiver == null) {
            throw new DirectDeliveryException("Connection refused: " + endpoint);
        }
        receiver.accept(wireEnvelope);
    }

    /**
     * @return every attempt so far, in order
     */
    public List<Attempt> attempts() {
        return new ArrayList<>(attempts);
    }

    /**
     * @return the number of attempts addressed to the module
     */
    public int attemptsTo(ModuleName target) {
        int count = 0;
        for (Attempt attempt : attempts) {
            if (attempt.target() == target) {
                count++;
            }
        }
        return count;
    }

    public void clear() {
        attempts.clear();
        pendingFailures.clear();
        unavailable.clear();
    }

    private boolean consumeFailure(ModuleName target) {
        AtomicInteger remaining = pendingFailures.get(target);
        if (remaining == null) {
            return false;
        }
        return remaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    /**
     * One recorded delivery attempt.
     *
     * @param target the addressed module
     * @param endpoint the endpoint used
     * @param wireEnvelope the posted body
     * @param accepted false when the attempt was scripted to fail
     */
    public record Attempt(ModuleName target, URI endpoint, String wireEnvelope, boolean accepted) {
    }
}
