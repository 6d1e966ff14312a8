package com.jguard.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized Micrometer metrics for the filtering pipeline.
 */
@Component
public class JguardMetrics {

    private final MeterRegistry registry;

    public JguardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // --- Dispatch metrics ---

    public void recordMessageEvaluated(String event) {
        Counter.builder("jguard.messages.evaluated")
                .tag("event", event)
                .register(registry).increment();
    }

    public void recordFilterTriggered(String filterList) {
        Counter.builder("jguard.filters.triggered")
                .tag("list", filterList)
                .register(registry).increment();
    }

    public void recordFilterListError(String filterList) {
        Counter.builder("jguard.filter_lists.errors")
                .tag("list", filterList)
                .register(registry).increment();
    }

    // --- Action metrics ---

    public void recordActionApplied(String action) {
        Counter.builder("jguard.actions.applied")
                .tag("action", action)
                .register(registry).increment();
    }

    public void recordActionFailed(String action) {
        Counter.builder("jguard.actions.failed")
                .tag("action", action)
                .register(registry).increment();
    }

    // --- Alert metrics ---

    public void recordAlert(String outcome) {
        Counter.builder("jguard.alerts")
                .tag("outcome", outcome)
                .register(registry).increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
