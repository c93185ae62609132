package com.sandboxgate.sandbox;

import com.sandboxgate.approval.PermissionCallback;
import com.sandboxgate.approval.SandboxPermissionCallback;
import com.sandboxgate.audit.AuditLogger;
import com.sandboxgate.observability.SandboxMetrics;
import com.sandboxgate.proxy.ToolProxy;
import com.sandboxgate.security.SecurityManager;
import com.sandboxgate.shared.config.SandboxConfig;
import com.sandboxgate.shared.model.ExecutionResult;
import com.sandboxgate.shared.model.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Lifecycle facade over configuration, sandbox source, security and proxy.
 *
 * <pre>{@code
 * try (var executor = new SandboxExecutor(config)) {
 *     executor.start();
 *     var result = executor.executeBash("echo hello");
 * }
 * }</pre>
 */
public class SandboxExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SandboxExecutor.class);

    private final SandboxConfig config;
    private final SandboxFactory factory;
    private final SandboxMetrics metrics;

    private SandboxSource source;
    private SecurityManager security;
    private AuditLogger audit;
    private ToolProxy proxy;
    private PermissionCallback callback;
    private volatile boolean running;

    /** Uses the built-in provider for the configured sandbox type. */
    public SandboxExecutor(SandboxConfig config) {
        this(config, null, new SandboxMetrics());
    }

    public SandboxExecutor(SandboxConfig config, SandboxFactory factory) {
        this(config, factory, new SandboxMetrics());
    }

    public SandboxExecutor(SandboxConfig config, SandboxFactory factory, SandboxMetrics metrics) {
        this.config = config;
        this.factory = factory;
        this.metrics = metrics;
    }

    /**
     * Validates the configuration and wires the components.
     * @throws com.sandboxgate.shared.config.ConfigurationException if the configuration is invalid
     */
    public synchronized void start() {
        if (running) throw new IllegalStateException("Executor is already started");
        log.info("[Executor] Starting ({} sandbox, pool={})", config.sandboxType().id(), config.usePool());
        config.validateOrThrow();

        var sandboxFactory = factory != null ? factory : SandboxFactories.forConfig(config);
        source = config.usePool()
                ? new SandboxPool(config, sandboxFactory)
                : new PersistentSandbox(config, sandboxFactory);
        security = new SecurityManager(config.security(), config.workingDirectory());
        security.addViolationListener(v -> metrics.securityViolations().increment());
        audit = new AuditLogger(config.security().auditEnabled());
        metrics.bindPool(source);
        proxy = new ToolProxy(security, audit, source, metrics, config.resourceLimits().timeoutSeconds());
        callback = new SandboxPermissionCallback(proxy);
        running = true;
        log.info("[Executor] Started");
    }

    /** Tears down in reverse order. Backend errors are logged, never thrown. */
    public synchronized void stop() {
        if (!running) return;
        running = false;
        log.info("[Executor] Stopping");
        proxy.shutdown();
        try {
            source.closeAll();
        } catch (RuntimeException e) {
            log.warn("[Executor] Error while closing sandboxes: {}", e.getMessage());
        }
        log.info("[Executor] Stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public ExecutionResult executeTool(ToolCall call) {
        return requireStarted().execute(call);
    }

    public ExecutionResult executeBash(String command) {
        return executeBash(command, null);
    }

    public ExecutionResult executeBash(String command, Integer timeoutSeconds) {
        return executeTool(new ToolCall("Bash", args("command", command, "timeout", timeoutSeconds)));
    }

    public ExecutionResult readFile(String path) {
        return executeTool(new ToolCall("Read", args("path", path)));
    }

    public ExecutionResult writeFile(String path, String content) {
        return executeTool(new ToolCall("Write", args("path", path, "content", content)));
    }

    public ExecutionResult listFiles(String path, String pattern) {
        return executeTool(new ToolCall("Glob", args("path", path, "pattern", pattern)));
    }

    public ExecutionResult searchFiles(String pattern, String path, String include) {
        return executeTool(new ToolCall("Grep", args("pattern", pattern, "path", path, "include", include)));
    }

    public ExecutionResult editFile(String path, String oldString, String newString) {
        return executeTool(new ToolCall("Edit", args("path", path, "old_string", oldString, "new_string", newString)));
    }

    /**
     * Runs {@code work} against one sandbox held for its whole duration. Calls made this way
     * go straight to the sandbox, without policy checks or auditing.
     */
    public <T> T withSandbox(Function<Sandbox, T> work) {
        requireStarted();
        var sandbox = source.acquire();
        try {
            var value = work.apply(sandbox);
            source.release(sandbox);
            return value;
        } catch (SandboxException e) {
            source.invalidate(sandbox);
            throw e;
        } catch (RuntimeException e) {
            source.release(sandbox);
            throw e;
        }
    }

    public PermissionCallback getPermissionCallback() {
        requireStarted();
        return callback;
    }

    public List<Map<String, Object>> getAuditLogs() {
        return audit == null ? List.of() : audit.exportLogs();
    }

    public AuditLogger auditLogger() {
        return audit;
    }

    public SecurityManager securityManager() {
        return security;
    }

    public SandboxMetrics metrics() {
        return metrics;
    }

    public Map<String, Object> stats() {
        var stats = new LinkedHashMap<String, Object>();
        stats.put("sandbox_type", config.sandboxType().id());
        stats.put("use_pool", config.usePool());
        stats.put("running", running);
        if (source != null) stats.put("pool", source.stats().toMap());
        return stats;
    }

    private ToolProxy requireStarted() {
        if (!running) throw new IllegalStateException("Executor is not started; call start() first");
        return proxy;
    }

    private static Map<String, Object> args(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
