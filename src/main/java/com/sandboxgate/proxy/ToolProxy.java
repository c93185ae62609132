package com.sandboxgate.proxy;

import com.sandboxgate.audit.AuditLogger;
import com.sandboxgate.observability.MdcContext;
import com.sandboxgate.observability.SandboxMetrics;
import com.sandboxgate.sandbox.Sandbox;
import com.sandboxgate.sandbox.SandboxException;
import com.sandboxgate.sandbox.SandboxSource;
import com.sandboxgate.sandbox.UnsupportedToolException;
import com.sandboxgate.security.SecurityManager;
import com.sandboxgate.shared.model.ExecutionResult;
import com.sandboxgate.shared.model.ToolCall;
import com.sandboxgate.shared.model.ToolType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-call entry point: validate, route to a sandbox, execute, audit.
 *
 * <p>{@link #execute} always returns a result. Policy denials never reach a sandbox and
 * backend failures become unsuccessful results with exit code -1. Every outcome is audited
 * before returning, including the one contract error, {@link UnsupportedToolException},
 * which is rethrown.
 *
 * <p>The call timeout plus a grace period bounds both the wait for a free sandbox and the
 * execution itself. A call that outlives it returns immediately; the sandbox goes back to its
 * source only once the backend call finishes, so a handle is never used by two calls.
 */
public class ToolProxy {

    private static final Logger log = LoggerFactory.getLogger(ToolProxy.class);

    static final Duration DEFAULT_GRACE = Duration.ofSeconds(5);

    private final SecurityManager security;
    private final AuditLogger audit;
    private final SandboxSource sandboxes;
    private final SandboxMetrics metrics;
    private final ExecutorService callExecutor;
    private final long defaultTimeoutSeconds;
    private final Duration grace;

    private volatile String userId;
    private volatile String sessionId;

    public ToolProxy(SecurityManager security, AuditLogger audit, SandboxSource sandboxes,
                     SandboxMetrics metrics, long defaultTimeoutSeconds) {
        this(security, audit, sandboxes, metrics, defaultTimeoutSeconds, DEFAULT_GRACE, newCallExecutor());
    }

    public ToolProxy(SecurityManager security, AuditLogger audit, SandboxSource sandboxes,
                     SandboxMetrics metrics, long defaultTimeoutSeconds, Duration grace,
                     ExecutorService callExecutor) {
        this.security = security;
        this.audit = audit;
        this.sandboxes = sandboxes;
        this.metrics = metrics;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.grace = grace;
        this.callExecutor = callExecutor;
    }

    /** Caller identity for subsequent calls; {@code userId} is the rate-limit key. */
    public void setContext(String userId, String sessionId) {
        this.userId = userId;
        this.sessionId = sessionId;
    }

    public ExecutionResult execute(ToolCall call) {
        return execute(call, userId, sessionId);
    }

    public ExecutionResult execute(ToolCall call, String userId, String sessionId) {
        MdcContext.setCall(call.callId(), call.toolName(), userId, sessionId);
        try {
            var verdict = security.validate(call, userId);
            if (!verdict.allowed()) {
                var denied = ExecutionResult.denied(verdict.reason());
                return finish(call, denied, SandboxMetrics.OUTCOME_DENIED, userId, sessionId);
            }

            if (!call.toolType().isSandboxExecutable()) {
                var unsupported = new UnsupportedToolException(call.toolName());
                finish(call, ExecutionResult.failure(unsupported.getMessage(), -1),
                        SandboxMetrics.OUTCOME_FAILED, userId, sessionId);
                throw unsupported;
            }

            var result = route(call, userId, sessionId);
            return finish(call, result, result.success() ? SandboxMetrics.OUTCOME_COMPLETED
                    : SandboxMetrics.OUTCOME_FAILED, userId, sessionId);
        } finally {
            MdcContext.clear();
        }
    }

    /** Whether the permission callback should divert this tool into a sandbox. */
    public boolean shouldSandbox(String toolName) {
        return ToolType.fromName(toolName).requiresSandbox();
    }

    public void shutdown() {
        callExecutor.shutdownNow();
    }

    private ExecutionResult route(ToolCall call, String userId, String sessionId) {
        var started = System.nanoTime();
        var timeoutSeconds = timeoutSeconds(call);
        var budgetMs = TimeUnit.SECONDS.toMillis(timeoutSeconds) + grace.toMillis();
        Sandbox sandbox;
        try {
            sandbox = sandboxes.acquire(Duration.ofMillis(budgetMs));
        } catch (IllegalStateException e) {
            audit.log(call, ExecutionResult.failure(e.getMessage(), -1), userId, sessionId);
            throw e;
        } catch (RuntimeException e) {
            log.error("[Proxy] Could not obtain a sandbox for {}", call.toolName(), e);
            return ExecutionResult.failure("Sandbox unavailable: " + describe(e), -1)
                    .withExecution(elapsedMs(started), null);
        }

        var sandboxId = sandbox.sandboxId();
        CompletableFuture<ExecutionResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> sandbox.executeTool(call), callExecutor);
        } catch (RejectedExecutionException e) {
            sandboxes.release(sandbox);
            return ExecutionResult.failure("Tool proxy is shut down", -1).withExecution(elapsedMs(started), sandboxId);
        }
        future.whenComplete((r, error) -> returnSandbox(sandbox, error));

        // waiting for the sandbox counts against the same deadline
        var remainingMs = Math.max(budgetMs - elapsedMs(started), 1);
        try {
            var result = future.get(remainingMs, TimeUnit.MILLISECONDS);
            return result.withExecution(elapsedMs(started), sandboxId);
        } catch (TimeoutException e) {
            log.warn("[Proxy] {} timed out after {}s on {}", call.toolName(), timeoutSeconds, sandboxId);
            return ExecutionResult.failure("Tool execution timed out after " + timeoutSeconds + "s", -1)
                    .withExecution(elapsedMs(started), sandboxId);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof UnsupportedToolException) {
                audit.log(call, ExecutionResult.failure(cause.getMessage(), -1), userId, sessionId);
                throw (UnsupportedToolException) cause;
            }
            log.error("[Proxy] {} failed on {}", call.toolName(), sandboxId, cause);
            return ExecutionResult.failure(describe(cause), -1).withExecution(elapsedMs(started), sandboxId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("Interrupted while waiting for " + call.toolName(), -1)
                    .withExecution(elapsedMs(started), sandboxId);
        }
    }

    private void returnSandbox(Sandbox sandbox, Throwable error) {
        var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        try {
            if (cause instanceof SandboxException) {
                sandboxes.invalidate(sandbox);
            } else {
                sandboxes.release(sandbox);
            }
        } catch (RuntimeException e) {
            log.warn("[Proxy] Failed to return sandbox {}: {}", sandbox.sandboxId(), e.getMessage());
        }
    }

    private ExecutionResult finish(ToolCall call, ExecutionResult result, String outcome,
                                   String userId, String sessionId) {
        if (metrics != null) metrics.recordCall(outcome, result.elapsedMs());
        audit.log(call, result, userId, sessionId);
        return result;
    }

    private long timeoutSeconds(ToolCall call) {
        if (call.toolType() == ToolType.BASH) {
            try {
                var requested = call.intArg("timeout");
                if (requested != null && requested > 0) return requested;
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed timeout argument: {}", e.getMessage());
            }
        }
        return defaultTimeoutSeconds;
    }

    private static String describe(Throwable e) {
        var message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static ExecutorService newCallExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "sandboxgate-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
