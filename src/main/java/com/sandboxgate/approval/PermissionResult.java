package com.sandboxgate.approval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Either an allow decision, optionally carrying rewritten tool input, or a deny decision
 * with a reason. Instances come only from the static factories.
 */
public final class PermissionResult {

    public static final String SANDBOX_RESULT_KEY = "_sandbox_result";
    public static final String SANDBOX_EXECUTED_KEY = "_sandbox_executed";

    private final boolean allowed;
    private final Map<String, Object> updatedInput;
    private final String message;

    private PermissionResult(boolean allowed, Map<String, Object> updatedInput, String message) {
        this.allowed = allowed;
        this.updatedInput = updatedInput;
        this.message = message;
    }

    public static PermissionResult allow() {
        return new PermissionResult(true, null, null);
    }

    public static PermissionResult allow(Map<String, Object> updatedInput) {
        return new PermissionResult(true, Collections.unmodifiableMap(new LinkedHashMap<>(updatedInput)), null);
    }

    public static PermissionResult deny(String message) {
        return new PermissionResult(false, null, message);
    }

    public boolean isAllowed() { return allowed; }

    /** Rewritten input for an allow decision, or {@code null} to run the call unchanged. */
    public Map<String, Object> updatedInput() { return updatedInput; }

    /** Reason for a deny decision; {@code null} when allowed. */
    public String message() { return message; }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        if (allowed) {
            map.put("behavior", "allow");
            if (updatedInput != null) map.put("updated_input", updatedInput);
        } else {
            map.put("behavior", "deny");
            map.put("message", message);
            map.put("interrupt", false);
        }
        return map;
    }

    @Override
    public String toString() {
        return allowed ? "Allow" + (updatedInput == null ? "" : "{updatedInput}") : "Deny{" + message + "}";
    }
}
