package com.sandboxgate.approval;

import com.sandboxgate.proxy.ToolProxy;
import com.sandboxgate.sandbox.UnsupportedToolException;
import com.sandboxgate.shared.model.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs sandbox-required tools through the {@link ToolProxy} and reports the outcome as a
 * permission decision. A successful run is returned as an allow decision whose input
 * carries the sandbox output, so the runtime can use it instead of running the tool itself.
 * Other tools are allowed untouched.
 */
public class SandboxPermissionCallback implements PermissionCallback {

    private static final Logger log = LoggerFactory.getLogger(SandboxPermissionCallback.class);

    static final String FAILURE_PREFIX = "Sandbox execution failed: ";

    private final ToolProxy proxy;

    public SandboxPermissionCallback(ToolProxy proxy) {
        this.proxy = proxy;
    }

    @Override
    public PermissionResult check(String toolName, Map<String, Object> input) {
        if (!proxy.shouldSandbox(toolName)) {
            log.debug("Tool {} does not need a sandbox, allowing", toolName);
            return PermissionResult.allow();
        }

        var args = input == null ? Map.<String, Object>of() : input;
        try {
            var result = proxy.execute(new ToolCall(toolName, args));
            if (!result.success()) {
                return PermissionResult.deny(FAILURE_PREFIX + result.error());
            }
            var updated = new LinkedHashMap<String, Object>(args);
            updated.put(PermissionResult.SANDBOX_RESULT_KEY, result.output());
            updated.put(PermissionResult.SANDBOX_EXECUTED_KEY, true);
            return PermissionResult.allow(updated);
        } catch (UnsupportedToolException e) {
            return PermissionResult.deny(e.getMessage());
        }
    }
}
