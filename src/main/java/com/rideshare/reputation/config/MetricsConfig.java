package com.rideshare.reputation.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRecalculation(String category, int total) {
        Counter.builder("trust.recalculation.count")
                .tag("category", category)
                .register(registry)
                .increment();

        DistributionSummary.builder("trust.total_score")
                .register(registry)
                .record(total);
    }

    public void recordModeration(String action) {
        Counter.builder("rating.moderation.count")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordSideEffect(String name, String status) {
        Counter.builder("side_effect.count")
                .tag("name", name)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordVerificationDecision(String decision) {
        Counter.builder("verification.decision.count")
                .tag("decision", decision)
                .register(registry)
                .increment();
    }
}
