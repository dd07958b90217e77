package com.phasegate.core.errors;

import java.util.Map;

/**
 * Base of all orchestration errors. Carries a stable machine-readable code and
 * the identifiers needed to attribute the failure to a task or phase.
 */
public class PhasegateException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;

    public PhasegateException(String code, String message, Map<String, Object> context) {
        super(message);
        this.code = code;
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    public PhasegateException(String code, String message, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = context == null ? Map.of() : Map.copyOf(context);
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
