package com.sandboxgate.sandbox;

import com.sandboxgate.shared.config.SandboxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of connected sandboxes. Idle and in-use bookkeeping is guarded by one lock;
 * connecting and disconnecting happen outside it so a slow backend never stalls other callers.
 *
 * <p>Released sandboxes are kept for reuse only when auto-cleanup is off; otherwise they are
 * disconnected and their slot is freed. Idle sandboxes older than the session timeout are
 * retired on the next acquire.
 */
public class SandboxPool implements SandboxSource {

    private static final Logger log = LoggerFactory.getLogger(SandboxPool.class);

    private final SandboxConfig config;
    private final SandboxFactory factory;
    private final int maxSize;
    private final Duration idleTimeout;
    private final Clock clock;
    private final boolean reuse;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();
    private final Deque<IdleSandbox> idle = new ArrayDeque<>();
    private final Set<Sandbox> inUse = Collections.newSetFromMap(new IdentityHashMap<>());
    private int totalCreated;
    private boolean closed;

    public SandboxPool(SandboxConfig config, SandboxFactory factory) {
        this(config, factory, config.poolSize(), Duration.ofMinutes(config.sessionTimeoutMinutes()), Clock.systemUTC());
    }

    public SandboxPool(SandboxConfig config, SandboxFactory factory, int maxSize, Duration idleTimeout, Clock clock) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be at least 1");
        this.config = config;
        this.factory = factory;
        this.maxSize = maxSize;
        this.idleTimeout = idleTimeout;
        this.clock = clock;
        this.reuse = !config.autoCleanup();
    }

    @Override
    public Sandbox acquire() {
        return acquire(null);
    }

    @Override
    public Sandbox acquire(Duration maxWait) {
        var retired = new ArrayList<Sandbox>();
        try {
            var reused = reserve(maxWait, retired);
            if (reused != null) {
                log.debug("[Pool] Reusing sandbox {}", reused.sandboxId());
                return reused;
            }
        } finally {
            disconnectQuietly(retired);
        }
        return createReserved();
    }

    /** Returns an idle sandbox, or {@code null} after reserving a slot for a new one. */
    private Sandbox reserve(Duration maxWait, List<Sandbox> retired) {
        long remaining = maxWait == null ? Long.MAX_VALUE : maxWait.toNanos();
        lock.lock();
        try {
            while (true) {
                if (closed) throw new IllegalStateException("Sandbox pool is closed");
                retireExpired(retired);

                var candidate = idle.pollLast();
                if (candidate != null) {
                    if (candidate.sandbox().isConnected()) {
                        inUse.add(candidate.sandbox());
                        return candidate.sandbox();
                    }
                    totalCreated--;
                    continue;
                }

                if (totalCreated < maxSize) {
                    totalCreated++;
                    return null;
                }

                log.debug("[Pool] All {} sandboxes busy, waiting", maxSize);
                if (maxWait == null) {
                    slotFreed.await();
                } else {
                    if (remaining <= 0) {
                        throw new SandboxException("No sandbox available within " + maxWait.toMillis() + "ms");
                    }
                    remaining = slotFreed.awaitNanos(remaining);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while waiting for a sandbox", e, false);
        } finally {
            lock.unlock();
        }
    }

    private Sandbox createReserved() {
        Sandbox created;
        try {
            created = connectNew();
        } catch (RuntimeException e) {
            lock.lock();
            try {
                if (!closed) totalCreated--;
                slotFreed.signal();
            } finally {
                lock.unlock();
            }
            log.error("[Pool] Failed to create sandbox", e);
            throw e;
        }

        lock.lock();
        try {
            if (!closed) {
                inUse.add(created);
                log.debug("[Pool] Created sandbox {} ({}/{})", created.sandboxId(), totalCreated, maxSize);
                return created;
            }
        } finally {
            lock.unlock();
        }
        disconnectQuietly(List.of(created));
        throw new IllegalStateException("Sandbox pool is closed");
    }

    private Sandbox connectNew() {
        var sandbox = factory.create(config);
        ResilientCall.execute(() -> {
            sandbox.connect();
            return null;
        });
        return sandbox;
    }

    @Override
    public void release(Sandbox sandbox) {
        lock.lock();
        try {
            if (!inUse.remove(sandbox)) {
                log.debug("[Pool] Ignoring release of sandbox {} that is not in use", sandbox.sandboxId());
                return;
            }
            if (reuse && sandbox.isConnected()) {
                idle.addLast(new IdleSandbox(sandbox, clock.instant()));
                slotFreed.signal();
                log.debug("[Pool] Returned sandbox {} to the pool", sandbox.sandboxId());
                return;
            }
            totalCreated--;
            slotFreed.signal();
        } finally {
            lock.unlock();
        }
        disconnectQuietly(List.of(sandbox));
    }

    @Override
    public void invalidate(Sandbox sandbox) {
        lock.lock();
        try {
            if (!inUse.remove(sandbox)) return;
            totalCreated--;
            slotFreed.signal();
        } finally {
            lock.unlock();
        }
        log.warn("[Pool] Discarding sandbox {} after a backend failure", sandbox.sandboxId());
        disconnectQuietly(List.of(sandbox));
    }

    @Override
    public void closeAll() {
        var all = new ArrayList<Sandbox>();
        lock.lock();
        try {
            closed = true;
            all.addAll(inUse);
            idle.forEach(s -> all.add(s.sandbox()));
            inUse.clear();
            idle.clear();
            totalCreated = 0;
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("[Pool] Closing {} sandboxes", all.size());
        disconnectQuietly(all);
    }

    @Override
    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(totalCreated, inUse.size(), idle.size(), maxSize);
        } finally {
            lock.unlock();
        }
    }

    private void retireExpired(List<Sandbox> retired) {
        var cutoff = clock.instant().minus(idleTimeout);
        while (!idle.isEmpty() && idle.peekFirst().lastUsed().isBefore(cutoff)) {
            retired.add(idle.pollFirst().sandbox());
            totalCreated--;
        }
    }

    private static void disconnectQuietly(List<Sandbox> sandboxes) {
        for (var sandbox : sandboxes) {
            try {
                sandbox.disconnect();
            } catch (RuntimeException e) {
                log.warn("[Pool] Failed to disconnect sandbox {}: {}", sandbox.sandboxId(), e.getMessage());
            }
        }
    }

    private record IdleSandbox(Sandbox sandbox, Instant lastUsed) {}
}
