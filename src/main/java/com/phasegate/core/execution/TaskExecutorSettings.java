package com.phasegate.core.execution;

import java.time.Duration;

/**
 * @param timeout         limit for a single agent invocation
 * @param maxRetries      attempts beyond the first made by {@link TaskExecutor#executeWithRetry}
 * @param validateResults run the secondary validation pass on apparently successful output
 */
public record TaskExecutorSettings(Duration timeout, int maxRetries, boolean validateResults) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);
    public static final int DEFAULT_MAX_RETRIES = 2;

    public TaskExecutorSettings {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = DEFAULT_TIMEOUT;
        }
        maxRetries = Math.max(0, maxRetries);
    }

    public static TaskExecutorSettings defaults() {
        return new TaskExecutorSettings(DEFAULT_TIMEOUT, DEFAULT_MAX_RETRIES, true);
    }
}
