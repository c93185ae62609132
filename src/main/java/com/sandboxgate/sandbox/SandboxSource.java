package com.sandboxgate.sandbox;

import java.time.Duration;

/**
 * Hands out connected sandboxes for exclusive use. Every successful {@link #acquire()}
 * must be followed by exactly one {@link #release} or {@link #invalidate}.
 */
public interface SandboxSource {

    /** Blocks until a connected sandbox is available. */
    Sandbox acquire();

    /**
     * Like {@link #acquire()} but gives up after {@code maxWait}.
     * @throws SandboxException when nothing became available in time
     */
    Sandbox acquire(Duration maxWait);

    /** Returns a healthy sandbox. Releasing a sandbox that is not held is a no-op. */
    void release(Sandbox sandbox);

    /** Discards a sandbox after a backend failure and frees its slot. */
    void invalidate(Sandbox sandbox);

    /** Disconnects everything. Later acquires fail with {@link IllegalStateException}. */
    void closeAll();

    PoolStats stats();
}
