package com.sandboxgate.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One tool-call attempt and its outcome. {@code hash} covers every other field plus
 * {@code previousHash}, linking the entry to its predecessor.
 */
public record AuditEntry(
    long sequence,
    Instant timestamp,
    String toolName,
    Map<String, Object> arguments,
    boolean success,
    String output,
    String error,
    int exitCode,
    long elapsedMs,
    String sandboxId,
    String callId,
    String userId,
    String sessionId,
    String previousHash,
    String hash
) {

    public static final int MAX_EXPORTED_OUTPUT = 1000;

    public AuditEntry {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        output = output == null ? "" : output;
    }

    /** Flat record for log shipping; output is truncated. */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("timestamp", timestamp.toString());
        map.put("tool_name", toolName);
        map.put("arguments", arguments);
        map.put("success", success);
        map.put("output", truncate(output));
        map.put("error", error);
        map.put("exit_code", exitCode);
        map.put("execution_time_ms", elapsedMs);
        map.put("sandbox_id", sandboxId);
        map.put("call_id", callId);
        map.put("user_id", userId);
        map.put("session_id", sessionId);
        map.put("previous_hash", previousHash);
        map.put("hash", hash);
        return map;
    }

    /** Fields covered by the hash, untruncated. */
    Map<String, Object> hashedContent() {
        var map = new LinkedHashMap<String, Object>();
        map.put("sequence", sequence);
        map.put("timestamp", timestamp.toString());
        map.put("tool_name", toolName);
        map.put("arguments", arguments);
        map.put("success", success);
        map.put("output", output);
        map.put("error", error);
        map.put("exit_code", exitCode);
        map.put("execution_time_ms", elapsedMs);
        map.put("sandbox_id", sandboxId);
        map.put("call_id", callId);
        map.put("user_id", userId);
        map.put("session_id", sessionId);
        return map;
    }

    static String truncate(String s) {
        if (s == null || s.length() <= MAX_EXPORTED_OUTPUT) return s;
        return s.substring(0, MAX_EXPORTED_OUTPUT);
    }
}
