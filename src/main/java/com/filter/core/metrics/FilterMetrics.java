package com.filter.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for board and workspace operations.
 */
@Service
public class FilterMetrics {

    private final MeterRegistry registry;

    public FilterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTransition(String toStage, boolean changed) {
        Counter.builder("filter.kanban.transitions")
                .tag("stage", toStage)
                .tag("changed", String.valueOf(changed))
                .register(registry)
                .increment();
    }

    public void recordConflictRepair(String winningStage) {
        Counter.builder("filter.kanban.conflict_repairs")
                .description("Duplicate stage links resolved by the repair path")
                .tag("winner", winningStage)
                .register(registry)
                .increment();
    }

    public void recordListingProblems(int count) {
        if (count == 0) {
            return;
        }
        Counter.builder("filter.kanban.listing_problems")
                .register(registry)
                .increment(count);
    }

    public void recordProvisioning(String outcome, long ms) {
        Timer.builder("filter.workspace.provisioning")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGitRetry(String operation) {
        Counter.builder("filter.git.retries")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordStoryCreated() {
        Counter.builder("filter.stories.created")
                .register(registry)
                .increment();
    }
}
