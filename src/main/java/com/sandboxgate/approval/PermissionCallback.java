package com.sandboxgate.approval;

import java.util.Map;

/** Decides whether the agent runtime may run a tool call. */
@FunctionalInterface
public interface PermissionCallback {

    PermissionResult check(String toolName, Map<String, Object> input);
}
