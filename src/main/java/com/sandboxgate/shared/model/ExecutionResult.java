package com.sandboxgate.shared.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one tool call attempt. A failed result always carries a non-empty error.
 */
public record ExecutionResult(
    boolean success,
    String output,
    String error,
    int exitCode,
    long elapsedMs,
    String sandboxId,
    List<String> filesCreated,
    List<String> filesModified,
    List<String> filesDeleted,
    Instant timestamp
) {

    public static final String UNKNOWN_ERROR = "Unknown error";
    public static final String DENIED_PREFIX = "Security validation failed: ";

    public ExecutionResult {
        output = output == null ? "" : output;
        if (!success && (error == null || error.isBlank())) {
            error = UNKNOWN_ERROR;
        }
        filesCreated = filesCreated == null ? List.of() : List.copyOf(filesCreated);
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
        filesDeleted = filesDeleted == null ? List.of() : List.copyOf(filesDeleted);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ExecutionResult ok(String output) {
        return new ExecutionResult(true, output, null, 0, 0, null, null, null, null, null);
    }

    public static ExecutionResult failure(String error) {
        return failure(error, 1);
    }

    public static ExecutionResult failure(String error, int exitCode) {
        return new ExecutionResult(false, "", error, exitCode, 0, null, null, null, null, null);
    }

    /** Maps a process exit to a result: exit 0 succeeds, anything else reports stderr. */
    public static ExecutionResult fromExit(int exitCode, String stdout, String stderr) {
        var ok = exitCode == 0;
        return new ExecutionResult(ok, stdout, ok ? null : stderr, exitCode, 0, null, null, null, null, null);
    }

    /** Result for a call rejected by policy; the backend is never contacted. */
    public static ExecutionResult denied(String reason) {
        return new ExecutionResult(false, "", DENIED_PREFIX + reason, -1, 0, null, null, null, null, null);
    }

    public ExecutionResult withExecution(long elapsedMs, String sandboxId) {
        return new ExecutionResult(success, output, error, exitCode, elapsedMs, sandboxId,
                filesCreated, filesModified, filesDeleted, timestamp);
    }

    public ExecutionResult withFileChanges(List<String> created, List<String> modified) {
        return new ExecutionResult(success, output, error, exitCode, elapsedMs, sandboxId,
                created, modified, filesDeleted, timestamp);
    }

    public boolean isError() {
        return !success;
    }

    /** Content block shape expected by the agent runtime for tool results. */
    public Map<String, Object> toToolResult() {
        var block = new LinkedHashMap<String, Object>();
        block.put("type", "text");
        block.put("text", success ? output : "Error: " + error);
        var result = new LinkedHashMap<String, Object>();
        result.put("content", List.of(block));
        if (!success) result.put("isError", true);
        return result;
    }
}
