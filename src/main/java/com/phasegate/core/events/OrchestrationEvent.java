package com.phasegate.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Event published to the {@link EventBus} during an orchestration run.
 * Ephemeral: consumed for display, never persisted.
 *
 * @param type        event kind
 * @param runId       the run that emitted the event
 * @param phaseNumber phase the event relates to, null for run-level events
 * @param taskId      task the event relates to, null for phase- and run-level events
 * @param message     human-readable description
 * @param payload     additional data (counts, durations, failure reasons)
 * @param timestamp   when the event was created
 */
public record OrchestrationEvent(
    OrchestrationEventType type,
    String runId,
    Integer phaseNumber,
    String taskId,
    String message,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public OrchestrationEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static OrchestrationEvent run(OrchestrationEventType type, String runId, String message,
                                         Map<String, Object> payload) {
        return new OrchestrationEvent(type, runId, null, null, message, payload, Instant.now());
    }

    public static OrchestrationEvent phase(OrchestrationEventType type, String runId, int phaseNumber,
                                           String message, Map<String, Object> payload) {
        return new OrchestrationEvent(type, runId, phaseNumber, null, message, payload, Instant.now());
    }

    public static OrchestrationEvent task(OrchestrationEventType type, String runId, int phaseNumber,
                                          String taskId, String message, Map<String, Object> payload) {
        return new OrchestrationEvent(type, runId, phaseNumber, taskId, message, payload, Instant.now());
    }
}
