package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.adapter.runner.transport.FallbackEventTransport;
import com.ryuqq.pipeline.adapter.runner.transport.ModuleEndpoints;
import com.ryuqq.pipeline.adapter.runner.transport.TransportConfig;
import com.ryuqq.pipeline.core.contract.EnvelopeCodec;
import com.ryuqq.pipeline.core.contract.EventEnvelope;
import com.ryuqq.pipeline.core.contract.EventKind;
import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.model.ValidationType;
import com.ryuqq.pipeline.core.model.Verdict;
import com.ryuqq.pipeline.core.spi.BroadcastChannel;
import com.ryuqq.pipeline.core.spi.DirectDelivery;
import com.ryuqq.pipeline.core.transport.PublishReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A peer business module (finance, operations, executive, marketing) for contract tests.
 *
 * <p>Runs its own {@link FallbackEventTransport} on the shared channel, records every envelope
 * it receives, and answers validation requests addressed to it with a scripted verdict.</p>
 *
 * <p><strong>Responder behavior:</strong></p>
 * <ul>
 *   <li>Default verdict is APPROVED for every validation type the module answers</li>
 *   <li>{@link #respondWith(ValidationType, Verdict)} with {@code null} makes the module silent</li>
 *   <li>approval_decided carries {@code status}; margin and capacity responses carry {@code approved}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SimulatedModule implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedModule.class);

    private final ModuleName module;
    private final FallbackEventTransport transport;
    private final EnvelopeCodec codec;
    private final List<EventEnvelope> received = new CopyOnWriteArrayList<>();
    private final List<EventEnvelope> responses = new CopyOnWriteArrayList<>();
    private final Map<ValidationType, Verdict> verdicts = new ConcurrentHashMap<>();
    private final Set<ValidationType> silent = ConcurrentHashMap.newKeySet();

    public SimulatedModule(
        ModuleName module,
        BroadcastChannel channel,
        DirectDelivery directDelivery,
        ModuleEndpoints endpoints,
        TransportConfig config
    ) {
        if (module == null) {
            throw new IllegalArgumentException("module cannot be null");
        }
        this.module = module;
        this.codec = new EnvelopeCodec();
        this.transport = new FallbackEventTransport(
            module, channel, directDelivery, endpoints, codec, config, null, Clock.systemUTC());
        for (ValidationType type : ValidationType.values()) {
            if (type.responder() == module) {
                verdicts.put(type, Verdict.APPROVED);
            }
        }
    }

    /**
     * Subscribes to every wire kind and attaches to the channel.
     */
    public void start() {
        for (EventKind kind : EventKind.values()) {
            if (kind.isInternal()) {
                continue;
            }
            transport.subscribe(kind, this::onEvent);
        }
        transport.start();
    }

    @Override
    public void close() {
        transport.stop();
    }

    /**
     * Scripts the verdict for a validation type; {@code null} means never answer.
     */
    public void respondWith(ValidationType type, Verdict verdict) {
        if (type.responder() != module) {
            throw new IllegalArgumentException(module.wireName() + " does not answer " + type.wireName());
        }
        if (verdict == null) {
            silent.add(type);
            verdicts.remove(type);
        } else {
            silent.remove(type);
            verdicts.put(type, verdict);
        }
    }

    /**
     * Publishes an envelope from this module.
     */
    public PublishReceipt publish(EventEnvelope envelope) {
        return transport.publish(envelope);
    }

    /**
     * Builds and publishes an envelope of the given kind from this module.
     */
    public PublishReceipt publish(String type, ModuleName target, Map<String, Object> payload) {
        return publish(EventEnvelope.create(type, module, target, payload, null, Clock.systemUTC().instant()));
    }

    /**
     * Answers a request manually, regardless of the scripted verdict.
     *
     * @return the published response envelope
     */
    public EventEnvelope answer(EventEnvelope request, Verdict verdict) {
        ValidationType type = ValidationType.fromWire(request.payloadString("request_type"));
        EventEnvelope response = responseTo(request, type, verdict);
        responses.add(response);
        transport.publish(response);
        return response;
    }

    public ModuleName module() {
        return module;
    }

    public FallbackEventTransport transport() {
        return transport;
    }

    public EnvelopeCodec codec() {
        return codec;
    }

    /**
     * @return every received envelope of the kind, in arrival order
     */
    public List<EventEnvelope> received(EventKind kind) {
        List<EventEnvelope> matching = new ArrayList<>();
        for (EventEnvelope envelope : received) {
            if (envelope.kind() == kind) {
                matching.add(envelope);
            }
        }
        return matching;
    }

    /**
     * @return responses this module has published, in order
     */
    public List<EventEnvelope> responses() {
        return new ArrayList<>(responses);
    }

    private void onEvent(EventEnvelope envelope) {
        received.add(envelope);
        for (ValidationType type : ValidationType.values()) {
            if (type.requestKind() != envelope.kind() || type.responder() != module) {
                continue;
            }
            if (silent.contains(type)) {
                log.debug("{} stays silent on {}", module.wireName(), envelope.correlationId());
                return;
            }
            EventEnvelope response = responseTo(envelope, type, verdicts.getOrDefault(type, Verdict.APPROVED));
            responses.add(response);
            transport.publishAsync(response).whenComplete((receipt, error) -> {
                if (error != null) {
                    log.warn("{} could not answer {}: {}", module.wireName(), envelope.correlationId(), error.getMessage());
                }
            });
        }
    }

    private EventEnvelope responseTo(EventEnvelope request, ValidationType type, Verdict verdict) {
        String correlationId = request.correlationId() != null
            ? request.correlationId()
            : request.payloadString("validation_request_id");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("validation_request_id", correlationId);
        payload.put("pipeline_item_id", request.payloadString("pipeline_item_id"));
        if (type == ValidationType.PRODUCT_APPROVAL) {
            payload.put("status", verdict == Verdict.APPROVED ? "approved" : "rejected");
        } else {
            payload.put("approved", verdict == Verdict.APPROVED);
        }
        payload.put("summary", module.wireName() + " " + verdict.name().toLowerCase(Locale.ROOT));
        return EventEnvelope.create(type.responseKind().wireName(), module, request.sourceModule(), payload,
            correlationId, Clock.systemUTC().instant());
    }
}
