package com.ryuqq.pipeline.adapter.runner.transport;

import com.ryuqq.pipeline.application.runtime.ManagedLifecycle;
import com.ryuqq.pipeline.core.contract.EnvelopeCodec;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.exception.DeliveryFailedException;
import com.ryuqq.pipeline.core.exception.MalformedEnvelopeException;
import com.ryuqq.pipeline.core.spi.BroadcastChannel;
import com.ryuqq.pipeline.core.spi.DirectDelivery;
import com.ryuqq.pipeline.core.spi.DirectDeliveryException;
import com.ryuqq.pipeline.core.spi.EventAuditLog;
import com.ryuqq.pipeline.core.transport.DeliveryMode;
import com.ryuqq.pipeline.core.transport.DeliveryPath;
import com.ryuqq.pipeline.core.transport.EventAuditRecord;
import com.ryuqq.pipeline.core.transport.EventHandler;
import com.ryuqq.pipeline.core.transport.EventTransport;
import com.ryuqq.pipeline.core.transport.PublishReceipt;
import com.ryuqq.pipeline.core.transport.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 브로드캐스트 우선, 직접 전달 대체 경로를 갖는 이벤트 전송.
 *
 * <p><strong>발행 흐름:</strong></p>
 * <ol>
 *   <li>봉투를 인코딩해 브로드캐스트 채널에 발행</li>
 *   <li>liveness window 안에 1명 이상 수신이 확인되면 성공</li>
 *   <li>수신자 0명, 채널 장애, 시간 초과 시 대상 모듈 엔드포인트로 직접 전달</li>
 *   <li>직접 전달은 maxAttempts 회까지 backoff 간격으로 재시도</li>
 *   <li>모두 실패하면 로컬에 delivery_failed를 발행하고 {@link DeliveryFailedException}</li>
 * </ol>
 *
 * <p><strong>수신 흐름:</strong> 브로드캐스트 리스너와 웹훅 양쪽에서 들어온 봉투는
 * {@link #receive(EventEnvelope, DeliveryPath)}로 모여 토픽별 {@link TopicDispatcher}에서
 * 순서대로 처리됩니다. 같은 봉투가 두 경로로 모두 도착할 수 있으므로 (at-least-once)
 * 중복 제거는 구독자 책임입니다.</p>
 *
 * <p>해석할 수 없는 입력은 예외를 던지지 않고 malformed_event로 로컬 발행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FallbackEventTransport implements EventTransport, ManagedLifecycle {

    private static final Logger log = LoggerFactory.getLogger(FallbackEventTransport.class);

    private static final int RAW_INPUT_LIMIT = 512;

    private enum State { NEW, RUNNING, STOPPED }

    private final ModuleName localModule;
    private final BroadcastChannel channel;
    private final DirectDelivery directDelivery;
    private final ModuleEndpoints endpoints;
    private final EnvelopeCodec codec;
    private final TransportConfig config;
    private final EventAuditLog auditLog;
    private final Clock clock;
    private final BackoffCalculator backoff;

    private final Map<String, TopicDispatcher> dispatchers = new ConcurrentHashMap<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);

    private volatile ExecutorService broadcastPool;
    private volatile ExecutorService publishPool;

    public FallbackEventTransport(
        ModuleName localModule,
        BroadcastChannel channel,
        DirectDelivery directDelivery,
        ModuleEndpoints endpoints,
        EnvelopeCodec codec,
        TransportConfig config,
        EventAuditLog auditLog,
        Clock clock
    ) {
        this(localModule, channel, directDelivery, endpoints, codec, config, auditLog, clock,
            config == null ? null : BackoffCalculator.from(config));
    }

    /**
     * 재시도 간격 계산기를 지정하는 생성자.
     *
     * @param auditLog 감사 로그 (null이면 기록하지 않음)
     */
    public FallbackEventTransport(
        ModuleName localModule,
        BroadcastChannel channel,
        DirectDelivery directDelivery,
        ModuleEndpoints endpoints,
        EnvelopeCodec codec,
        TransportConfig config,
        EventAuditLog auditLog,
        Clock clock,
        BackoffCalculator backoff
    ) {
        if (localModule == null) {
            throw new IllegalArgumentException("localModule cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (directDelivery == null) {
            throw new IllegalArgumentException("directDelivery cannot be null");
        }
        if (endpoints == null) {
            throw new IllegalArgumentException("endpoints cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        this.localModule = localModule;
        this.channel = channel;
        this.directDelivery = directDelivery;
        this.endpoints = endpoints;
        this.codec = codec;
        this.config = config;
        this.auditLog = auditLog;
        this.clock = clock;
        this.backoff = backoff;
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Override
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Transport already started or stopped (state: " + state.get() + ")");
        }
        AtomicInteger broadcastSeq = new AtomicInteger();
        broadcastPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-broadcast-" + broadcastSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        AtomicInteger publishSeq = new AtomicInteger();
        publishPool = Executors.newFixedThreadPool(config.publishPoolSize(), runnable -> {
            Thread thread = new Thread(runnable, "pipeline-publish-" + publishSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        channel.attach(localModule, wire -> receiveWire(wire, DeliveryPath.BROADCAST));
        log.info("Event transport started for module {} (endpoints: {})", localModule.wireName(), endpoints);
    }

    @Override
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            state.compareAndSet(State.NEW, State.STOPPED);
            return;
        }
        channel.detach(localModule);
        for (TopicDispatcher dispatcher : dispatchers.values()) {
            dispatcher.drain(config.drainTimeoutMs());
        }
        publishPool.shutdown();
        broadcastPool.shutdownNow();
        try {
            if (!publishPool.awaitTermination(config.drainTimeoutMs(), TimeUnit.MILLISECONDS)) {
                publishPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            publishPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Event transport stopped for module {}", localModule.wireName());
    }

    @Override
    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    @Override
    public ModuleName localModule() {
        return localModule;
    }

    // ============================================================
    // Publish
    // ============================================================

    @Override
    public PublishReceipt publish(EventEnvelope envelope, DeliveryMode mode) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (envelope.kind().isInternal()) {
            throw new IllegalArgumentException(
                "Internal event " + envelope.type() + " cannot be published; use dispatchLocal");
        }
        requireRunning();

        String wire = codec.encode(envelope);
        String broadcastFailure;
        try {
            int receivers = broadcastWithinWindow(wire);
            if (receivers > 0) {
                audit(EventAuditRecord.outbound(envelope, DeliveryPath.BROADCAST,
                    EventAuditRecord.Status.DELIVERED, receivers + " receivers", clock.instant()));
                log.debug("Broadcast {} ({}) to {} receivers", envelope.id(), envelope.type(), receivers);
                return PublishReceipt.broadcast(envelope.id(), receivers);
            }
            broadcastFailure = "no broadcast receivers";
        } catch (TimeoutException e) {
            broadcastFailure = "broadcast not confirmed within " + config.livenessWindowMs() + "ms";
        } catch (RuntimeException e) {
            broadcastFailure = "broadcast failed: " + e.getMessage();
        }

        if (mode == DeliveryMode.BROADCAST_ONLY) {
            throw fail(envelope, broadcastFailure);
        }
        log.warn("Falling back to direct delivery for {} ({}): {}", envelope.id(), envelope.type(), broadcastFailure);
        return deliverDirect(envelope, wire, broadcastFailure);
    }

    @Override
    public CompletableFuture<PublishReceipt> publishAsync(EventEnvelope envelope) {
        requireRunning();
        return CompletableFuture.supplyAsync(() -> publish(envelope), publishPool);
    }

    private int broadcastWithinWindow(String wire) throws TimeoutException {
        Future<Integer> future = broadcastPool.submit(() -> channel.broadcast(localModule, wire));
        try {
            return future.get(config.livenessWindowMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw cause instanceof RuntimeException re ? re : new IllegalStateException(cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Broadcast interrupted", e);
        }
    }

    private PublishReceipt deliverDirect(EventEnvelope envelope, String wire, String broadcastFailure) {
        Set<ModuleName> targets = fallbackTargets(envelope);
        if (targets.isEmpty()) {
            throw fail(envelope, broadcastFailure + "; no direct endpoint configured");
        }

        String lastError = broadcastFailure;
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            List<ModuleName> acknowledged = new ArrayList<>();
            for (ModuleName target : targets) {
                for (URI endpoint : endpoints.endpointsFor(target)) {
                    try {
                        directDelivery.deliver(target, endpoint, wire);
                        acknowledged.add(target);
                        break;
                    } catch (DirectDeliveryException e) {
                        lastError = e.getMessage();
                        log.debug("Direct delivery attempt {} of {} to {} failed: {}",
                            attempt, envelope.id(), endpoint, e.getMessage());
                    }
                }
            }
            if (!acknowledged.isEmpty()) {
                audit(EventAuditRecord.outbound(envelope, DeliveryPath.FALLBACK,
                    EventAuditRecord.Status.DELIVERED, "acknowledged by " + acknowledged, clock.instant()));
                log.info("Delivered {} ({}) directly to {} after {} attempt(s)",
                    envelope.id(), envelope.type(), acknowledged, attempt);
                return PublishReceipt.fallback(envelope.id(), acknowledged, attempt);
            }
            if (attempt < config.maxAttempts()) {
                long delay = backoff.calculate(attempt);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw fail(envelope, "direct delivery interrupted after " + attempt + " attempt(s)");
                }
            }
        }
        throw fail(envelope, "direct delivery failed after " + config.maxAttempts() + " attempt(s): " + lastError);
    }

    private Set<ModuleName> fallbackTargets(EventEnvelope envelope) {
        Set<ModuleName> targets = new LinkedHashSet<>();
        if (envelope.targetModule() != null) {
            if (!endpoints.endpointsFor(envelope.targetModule()).isEmpty()) {
                targets.add(envelope.targetModule());
            }
            return targets;
        }
        for (ModuleName module : endpoints.configuredModules()) {
            if (module != localModule) {
                targets.add(module);
            }
        }
        return targets;
    }

    private DeliveryFailedException fail(EventEnvelope envelope, String reason) {
        audit(EventAuditRecord.outbound(envelope, null, EventAuditRecord.Status.FAILED, reason, clock.instant()));
        log.error("Delivery failed for {} ({}) to {}: {}", envelope.id(), envelope.type(),
            envelope.targetModule() == null ? "all" : envelope.targetModule().wireName(), reason);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("undelivered_envelope_id", envelope.id());
        payload.put("undelivered_type", envelope.type());
        payload.put("target_module", envelope.targetModule() == null ? null : envelope.targetModule().wireName());
        payload.put("reason", reason);
        dispatchLocal(EventEnvelope.create(EventKind.DELIVERY_FAILED.wireName(), localModule, localModule,
            payload, envelope.correlationId(), clock.instant()));

        return new DeliveryFailedException(envelope.id(), reason);
    }

    // ============================================================
    // Receive
    // ============================================================

    @Override
    public void receive(EventEnvelope envelope, DeliveryPath path) {
        if (envelope == null || path == null) {
            throw new IllegalArgumentException("envelope and path cannot be null");
        }
        if (!isRunning()) {
            log.debug("Transport not running, dropping {} ({})", envelope.id(), envelope.type());
            return;
        }
        if (path != DeliveryPath.LOCAL && envelope.sourceModule() == localModule) {
            audit(EventAuditRecord.inbound(envelope, path, EventAuditRecord.Status.IGNORED, "own event", clock.instant()));
            return;
        }
        if (envelope.targetModule() != null && envelope.targetModule() != localModule) {
            audit(EventAuditRecord.inbound(envelope, path, EventAuditRecord.Status.IGNORED,
                "targeted at " + envelope.targetModule().wireName(), clock.instant()));
            return;
        }
        audit(EventAuditRecord.inbound(envelope, path, EventAuditRecord.Status.RECEIVED, null, clock.instant()));
        route(envelope, path);
    }

    @Override
    public void receiveWire(String json, DeliveryPath path) {
        EventEnvelope envelope;
        try {
            envelope = codec.decode(json);
        } catch (MalformedEnvelopeException e) {
            log.warn("Malformed envelope via {}: {}", path, e.getMessage());
            audit(new EventAuditRecord(null, null, EventAuditRecord.Direction.INBOUND, path,
                EventAuditRecord.Status.MALFORMED, e.getMessage(), clock.instant()));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("reason", e.getMessage());
            payload.put("raw", truncate(json));
            dispatchLocal(EventEnvelope.create(EventKind.MALFORMED_EVENT.wireName(), localModule, localModule,
                payload, null, clock.instant()));
            return;
        }
        receive(envelope, path);
    }

    @Override
    public void dispatchLocal(EventEnvelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (state.get() == State.STOPPED) {
            log.warn("Transport stopped, dropping local event {} ({})", envelope.id(), envelope.type());
            return;
        }
        route(envelope, DeliveryPath.LOCAL);
    }

    private void route(EventEnvelope envelope, DeliveryPath path) {
        TopicDispatcher dispatcher = dispatchers.get(envelope.type());
        if (dispatcher != null && dispatcher.accepts(path)) {
            dispatcher.dispatch(envelope, path);
            return;
        }
        if (dispatcher == null || !dispatcher.hasSubscribers()) {
            TopicDispatcher unclassified = dispatchers.get(EventKind.UNCLASSIFIED.wireName());
            if (unclassified != null && unclassified.accepts(path)) {
                unclassified.dispatch(envelope, path);
                return;
            }
        }
        log.debug("No subscriber for {} via {}, dropping {}", envelope.type(), path, envelope.id());
    }

    // ============================================================
    // Subscriptions
    // ============================================================

    @Override
    public Subscription subscribe(String topic, EventHandler handler, DeliveryMode mode) {
        if (state.get() == State.STOPPED) {
            throw new IllegalStateException("Transport stopped");
        }
        Subscription subscription = new Subscription(topic, handler, mode);
        dispatchers.computeIfAbsent(topic, TopicDispatcher::new).add(subscription);
        log.debug("Subscribed {} to {} ({})", subscription.id(), topic, mode);
        return subscription;
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        if (subscription == null) {
            throw new IllegalArgumentException("subscription cannot be null");
        }
        TopicDispatcher dispatcher = dispatchers.get(subscription.topic());
        if (dispatcher != null) {
            dispatcher.remove(subscription);
        }
    }

    private void requireRunning() {
        if (state.get() != State.RUNNING) {
            throw new IllegalStateException("Transport not running (state: " + state.get() + ")");
        }
    }

    private void audit(EventAuditRecord record) {
        if (auditLog != null) {
            auditLog.record(record);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.length() <= RAW_INPUT_LIMIT ? raw : raw.substring(0, RAW_INPUT_LIMIT);
    }
}
