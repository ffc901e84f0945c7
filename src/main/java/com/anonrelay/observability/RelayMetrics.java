package com.anonrelay.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class RelayMetrics {

    private final MeterRegistry registry;

    public RelayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public RelayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter messagesCreated() {
        return Counter.builder("anonrelay.messages.created").register(registry);
    }

    public Counter messagesModerated(String action) {
        return Counter.builder("anonrelay.messages.moderated").tag("action", action).register(registry);
    }

    public Counter deliveryFailures() {
        return Counter.builder("anonrelay.delivery.failures").register(registry);
    }

    public Counter rateLimited() {
        return Counter.builder("anonrelay.ratelimit.denied").register(registry);
    }

    public Counter autoBlocks() {
        return Counter.builder("anonrelay.ratelimit.autoblocks").register(registry);
    }

    public Counter alerts(String type) {
        return Counter.builder("anonrelay.alerts").tag("type", type).register(registry);
    }
}
