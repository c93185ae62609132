package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.SandboxConfig;
import com.sandboxgate.shared.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Connection state handling shared by the built-in providers. Subclasses implement
 * {@link #doConnect()} and {@link #doDisconnect()} and guard operations with
 * {@link #notConnected()}.
 */
public abstract class AbstractSandbox implements Sandbox {

    private static final Logger log = LoggerFactory.getLogger(AbstractSandbox.class);

    protected final SandboxConfig config;
    private volatile SandboxState state = SandboxState.DISCONNECTED;
    private volatile String sandboxId;

    protected AbstractSandbox(SandboxConfig config) {
        this.config = config;
    }

    /** Starts the backend and returns its identifier. */
    protected abstract String doConnect();

    protected abstract void doDisconnect();

    @Override
    public String sandboxId() {
        return sandboxId;
    }

    @Override
    public SandboxState state() {
        return state;
    }

    @Override
    public synchronized void connect() {
        if (state == SandboxState.CONNECTED) return;
        sandboxId = doConnect();
        state = SandboxState.CONNECTED;
        log.info("[Sandbox] Connected {} ({})", sandboxId, getClass().getSimpleName());
    }

    @Override
    public synchronized void disconnect() {
        if (state != SandboxState.CONNECTED) return;
        state = SandboxState.CLOSING;
        try {
            doDisconnect();
            log.info("[Sandbox] Disconnected {}", sandboxId);
        } finally {
            state = SandboxState.DISCONNECTED;
        }
    }

    /** Failure result for operations invoked while disconnected, {@code null} when connected. */
    protected ExecutionResult notConnected() {
        return isConnected() ? null : ExecutionResult.failure("Sandbox is not connected", -1);
    }

    /** Absolute, normalized sandbox path; relative paths are anchored at the working directory. */
    protected String resolvePath(String path) {
        var p = path == null || path.isBlank() ? "." : path;
        return Path.of(config.workingDirectory()).resolve(p).normalize().toString();
    }

    protected long timeoutSeconds(Integer requested) {
        return requested != null && requested > 0 ? requested : config.resourceLimits().timeoutSeconds();
    }
}
