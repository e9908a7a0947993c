package com.ryuqq.pipeline.adapter.inmemory.bus;

import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.spi.BroadcastChannel;
import com.ryuqq.pipeline.core.spi.BroadcastUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link BroadcastChannel} SPI for testing and reference purposes.
 *
 * <p>Listeners are invoked synchronously on the publishing thread, in no particular order.
 * Several transports (one per simulated module) can share one instance to model a broker.</p>
 *
 * <p><strong>Fault injection:</strong></p>
 * <ul>
 *   <li>{@link #setReachable(boolean)} - an unreachable channel throws
 *       {@link BroadcastUnavailableException} on every broadcast</li>
 *   <li>{@link #setLatencyMillis(long)} - delays every broadcast, to exercise the publisher's
 *       liveness window</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryBroadcastChannel channel = new InMemoryBroadcastChannel();
 * channel.attach(ModuleName.FINANCE, wire -&gt; financeInbox.add(wire));
 *
 * int receivers = channel.broadcast(ModuleName.DESIGN, wire); // 1
 *
 * channel.setReachable(false);
 * channel.broadcast(ModuleName.DESIGN, wire);                 // BroadcastUnavailableException
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryBroadcastChannel implements BroadcastChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroadcastChannel.class);

    private final Map<ModuleName, Listener> listeners;

    /**
     * Every message accepted by {@link #broadcast(ModuleName, String)}, in broadcast order.
     */
    private final List<String> published;

    private volatile boolean reachable;
    private volatile long latencyMillis;

    public InMemoryBroadcastChannel() {
        this.listeners = new ConcurrentHashMap<>();
        this.published = new CopyOnWriteArrayList<>();
        this.reachable = true;
        this.latencyMillis = 0L;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>A listener that throws is logged and not counted as a receiver</li>
     *   <li>The sender's own listener is skipped</li>
     * </ul>
     */
    @Override
    public int broadcast(ModuleName sender, String wireEnvelope) {
        if (sender == null) {
            throw new IllegalArgumentException("sender cannot be null");
        }
        if (wireEnvelope == null) {
            throw new IllegalArgumentException("wireEnvelope cannot be null");
        }
        if (!reachable) {
            throw new BroadcastUnavailableException("In-memory channel is unreachable");
        }
        pause();

        published.add(wireEnvelope);
        int receivers = 0;
        for (Map.Entry<ModuleName, Listener> entry : listeners.entrySet()) {
            if (entry.getKey() == sender) {
                continue;
            }
            try {
                entry.getValue().onMessage(wireEnvelope);
                receivers++;
            } catch (RuntimeException e) {
                log.warn("Listener of {} failed to accept broadcast from {}", entry.getKey(), sender, e);
            }
        }
        return receivers;
    }

    @Override
    public void attach(ModuleName module, Listener listener) {
        if (module == null) {
            throw new IllegalArgumentException("module cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        Listener previous = listeners.put(module, listener);
        if (previous != null) {
            log.debug("Replaced broadcast listener of {}", module);
        }
    }

    @Override
    public void detach(ModuleName module) {
        if (module == null) {
            throw new IllegalArgumentException("module cannot be null");
        }
        listeners.remove(module);
    }

    /**
     * @param reachable false makes every broadcast throw {@link BroadcastUnavailableException}
     */
    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public boolean isReachable() {
        return reachable;
    }

    /**
     * @param latencyMillis delay applied before every broadcast (0 disables)
     */
    public void setLatencyMillis(long latencyMillis) {
        if (latencyMillis < 0) {
            throw new IllegalArgumentException("latencyMillis cannot be negative, but was: " + latencyMillis);
        }
        this.latencyMillis = latencyMillis;
    }

    public boolean isAttached(ModuleName module) {
        return listeners.containsKey(module);
    }

    /**
     * @return snapshot of broadcast messages (for test verification)
     */
    public List<String> getPublished() {
        return List.copyOf(published);
    }

    /**
     * Clears recorded messages and restores reachability. Listeners stay attached.
     */
    public void reset() {
        published.clear();
        reachable = true;
        latencyMillis = 0L;
    }

    private void pause() {
        long delay = latencyMillis;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BroadcastUnavailableException("Broadcast interrupted", e);
        }
    }
}
