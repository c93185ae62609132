package com.sandboxgate.security;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One policy match against a tool call. Immutable.
 */
public record RiskFinding(
    Instant timestamp,
    RiskCategory category,
    String description,
    RiskLevel level,
    String toolName,
    Map<String, Object> arguments,
    boolean blocked
) {

    public RiskFinding {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /** A rule match; it blocks only at a blocking level. */
    public static RiskFinding of(RiskCategory category, String description, RiskLevel level,
                                 String toolName, Map<String, Object> arguments) {
        return new RiskFinding(Instant.now(), category, description, level, toolName, arguments, level.isBlocking());
    }

    /** A call that was refused, recorded as blocked whatever its level. */
    public static RiskFinding violation(RiskCategory category, String description, RiskLevel level,
                                        String toolName, Map<String, Object> arguments) {
        return new RiskFinding(Instant.now(), category, description, level, toolName, arguments, true);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("timestamp", timestamp.toString());
        map.put("violation_type", category.value());
        map.put("description", description);
        map.put("tool_name", toolName);
        map.put("risk_level", level.value());
        map.put("blocked", blocked);
        return map;
    }
}
