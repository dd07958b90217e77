package com.phasegate.core.errors;

import java.nio.file.Path;
import java.util.Map;

/**
 * A version-control operation failed. Callers treat checkpoints as best-effort and log these.
 */
public class GitException extends PhasegateException {

    public static final String NOT_REPO = "not_repo";
    public static final String OPERATION_FAILED = "operation_failed";

    public GitException(String code, String message, Map<String, Object> context) {
        super(code, message, context);
    }

    public GitException(String code, String message, Map<String, Object> context, Throwable cause) {
        super(code, message, context, cause);
    }

    public static GitException notRepo(Path dir) {
        return new GitException(NOT_REPO, "Not a git repository: " + dir, Map.of("path", dir.toString()));
    }

    public static GitException operationFailed(String operation, int exitCode, String output) {
        return new GitException(OPERATION_FAILED,
                "git %s failed (exit code %d): %s".formatted(operation, exitCode, output == null ? "" : output.strip()),
                Map.of("operation", operation, "exitCode", exitCode));
    }

    public static GitException operationFailed(String operation, Throwable cause) {
        return new GitException(OPERATION_FAILED, "git %s failed".formatted(operation),
                Map.of("operation", operation), cause);
    }
}
