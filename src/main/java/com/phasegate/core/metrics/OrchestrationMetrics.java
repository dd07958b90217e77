package com.phasegate.core.metrics;

import com.phasegate.core.model.FailureReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task, phase and run outcomes.
 */
@Service
public class OrchestrationMetrics {

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskExecution(boolean success, long ms) {
        Timer.builder("phasegate.task.duration")
                .tag("outcome", success ? "complete" : "failed")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void incrementRetries() {
        Counter.builder("phasegate.task.retries")
                .description("Task attempts beyond the first")
                .register(registry)
                .increment();
    }

    public void recordTaskFailure(FailureReason reason) {
        Counter.builder("phasegate.task.failures")
                .tag("reason", reason.code())
                .register(registry)
                .increment();
    }

    public void recordPhaseResult(boolean success) {
        Counter.builder("phasegate.phases.total")
                .tag("result", success ? "completed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordRunResult(String status) {
        Counter.builder("phasegate.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
