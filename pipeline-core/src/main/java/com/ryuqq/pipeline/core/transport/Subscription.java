package com.ryuqq.pipeline.core.transport;

import java.util.UUID;

/**
 * Binding of a topic (an event type wire name) to a handler.
 *
 * <p>Returned by {@link EventTransport#subscribe(String, EventHandler, DeliveryMode)} and passed
 * back to {@link EventTransport#unsubscribe(Subscription)}. Identity is the generated id.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Subscription {

    private final String id;
    private final String topic;
    private final EventHandler handler;
    private final DeliveryMode mode;

    public Subscription(String topic, EventHandler handler, DeliveryMode mode) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        this.id = UUID.randomUUID().toString();
        this.topic = topic;
        this.handler = handler;
        this.mode = mode;
    }

    public String id() {
        return id;
    }

    public String topic() {
        return topic;
    }

    public EventHandler handler() {
        return handler;
    }

    public DeliveryMode mode() {
        return mode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Subscription) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Subscription{" + topic + ", " + mode + ", id=" + id + '}';
    }
}
