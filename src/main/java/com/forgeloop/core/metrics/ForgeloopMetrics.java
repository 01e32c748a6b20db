package com.forgeloop.core.metrics;

import com.forgeloop.core.build.HealResult;
import com.forgeloop.core.model.AgentRole;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for builds, self-healing and webhook delivery.
 */
@Service
public class ForgeloopMetrics {

    private final MeterRegistry registry;

    public ForgeloopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordFileGeneration(AgentRole role, long ms) {
        Timer.builder("forgeloop.file.generation.duration")
                .tag("role", role.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordHealResult(HealResult result) {
        Counter.builder("forgeloop.selfheal.results")
                .tag("result", result.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordDebugAttempts(int attempts) {
        DistributionSummary.builder("forgeloop.selfheal.debug_attempts")
                .register(registry)
                .record(attempts);
    }

    public void recordBuildResult(String status) {
        Counter.builder("forgeloop.builds.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordWebhookDelivery(boolean delivered) {
        Counter.builder("forgeloop.webhook.deliveries")
                .description("Webhook delivery attempts by outcome")
                .tag("outcome", delivered ? "delivered" : "failed")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "inserted", "duplicate" or "rejected"
     */
    public void recordAdaptiveInsertion(String outcome) {
        Counter.builder("forgeloop.planner.insertions")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
