package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.SandboxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Single sandbox shared by all calls when pooling is disabled. Created lazily on the first
 * acquire and handed to one caller at a time.
 */
public class PersistentSandbox implements SandboxSource {

    private static final Logger log = LoggerFactory.getLogger(PersistentSandbox.class);

    private final SandboxConfig config;
    private final SandboxFactory factory;
    private final Semaphore permit = new Semaphore(1, true);
    private final Object stateLock = new Object();

    private Sandbox current;
    private boolean held;
    private boolean closed;

    public PersistentSandbox(SandboxConfig config, SandboxFactory factory) {
        this.config = config;
        this.factory = factory;
    }

    @Override
    public Sandbox acquire() {
        try {
            permit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while waiting for the sandbox", e, false);
        }
        return bind();
    }

    @Override
    public Sandbox acquire(Duration maxWait) {
        try {
            if (!permit.tryAcquire(maxWait.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new SandboxException("Sandbox still busy after " + maxWait.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while waiting for the sandbox", e, false);
        }
        return bind();
    }

    private Sandbox bind() {
        try {
            synchronized (stateLock) {
                if (closed) throw new IllegalStateException("Sandbox is closed");
                if (current == null || !current.isConnected()) {
                    var sandbox = factory.create(config);
                    ResilientCall.execute(() -> {
                        sandbox.connect();
                        return null;
                    });
                    current = sandbox;
                    log.info("[Sandbox] Persistent sandbox {} ready", sandbox.sandboxId());
                }
                held = true;
                return current;
            }
        } catch (RuntimeException e) {
            permit.release();
            throw e;
        }
    }

    @Override
    public void release(Sandbox sandbox) {
        synchronized (stateLock) {
            if (!held || sandbox != current) return;
            held = false;
        }
        permit.release();
    }

    @Override
    public void invalidate(Sandbox sandbox) {
        synchronized (stateLock) {
            if (!held || sandbox != current) return;
            held = false;
            current = null;
        }
        log.warn("[Sandbox] Discarding persistent sandbox {} after a backend failure", sandbox.sandboxId());
        disconnectQuietly(sandbox);
        permit.release();
    }

    /**
     * Disconnects the sandbox and wakes any caller waiting in {@link #acquire()}, which then
     * fails with {@link IllegalStateException}. A later release by the previous holder is ignored.
     */
    @Override
    public void closeAll() {
        Sandbox toClose;
        boolean wasHeld;
        synchronized (stateLock) {
            closed = true;
            wasHeld = held;
            held = false;
            toClose = current;
            current = null;
        }
        // the holder's permit would otherwise be lost; bind() passes it on to the next waiter
        if (wasHeld) permit.release();
        if (toClose != null) disconnectQuietly(toClose);
    }

    @Override
    public PoolStats stats() {
        synchronized (stateLock) {
            int created = current == null ? 0 : 1;
            int inUse = held ? 1 : 0;
            return new PoolStats(created, inUse, created - inUse, 1);
        }
    }

    private static void disconnectQuietly(Sandbox sandbox) {
        try {
            sandbox.disconnect();
        } catch (RuntimeException e) {
            log.warn("[Sandbox] Failed to disconnect {}: {}", sandbox.sandboxId(), e.getMessage());
        }
    }
}
