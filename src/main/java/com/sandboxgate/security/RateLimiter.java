package com.sandboxgate.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window request counter keyed by caller. In memory only: windows reset on restart.
 */
public class RateLimiter {

    public static final String DEFAULT_KEY = "default";
    static final int SWEEP_THRESHOLD = 1024;

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final ConcurrentHashMap<String, ArrayDeque<Instant>> windows = new ConcurrentHashMap<>();

    public RateLimiter(int maxRequests, int windowSeconds) {
        this(maxRequests, Duration.ofSeconds(windowSeconds), Clock.systemUTC());
    }

    public RateLimiter(int maxRequests, Duration window, Clock clock) {
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Records the request when allowed; a rejected request does not consume a slot. A key
     * whose window empties is dropped, so idle callers do not accumulate.
     */
    public Verdict check(String key) {
        var now = clock.instant();
        var verdict = new Verdict[1];
        windows.compute(key == null ? DEFAULT_KEY : key, (k, deque) -> {
            var requests = deque == null ? new ArrayDeque<Instant>() : deque;
            prune(requests, now);
            if (requests.size() >= maxRequests) {
                verdict[0] = Verdict.deny("Rate limit exceeded: max " + maxRequests
                        + " requests per " + window.toSeconds() + " seconds");
                return requests.isEmpty() ? null : requests;
            }
            requests.addLast(now);
            verdict[0] = Verdict.allow();
            return requests;
        });
        if (windows.size() > SWEEP_THRESHOLD) evictExpired();
        return verdict[0];
    }

    public Verdict check() {
        return check(DEFAULT_KEY);
    }

    public int count(String key) {
        var now = clock.instant();
        var size = new int[1];
        windows.computeIfPresent(key, (k, requests) -> {
            prune(requests, now);
            size[0] = requests.size();
            return requests.isEmpty() ? null : requests;
        });
        return size[0];
    }

    /** Drops every key with no request left in its window. */
    public void evictExpired() {
        var now = clock.instant();
        for (var key : windows.keySet()) {
            windows.computeIfPresent(key, (k, requests) -> {
                prune(requests, now);
                return requests.isEmpty() ? null : requests;
            });
        }
    }

    /** Number of callers currently holding a window. */
    public int trackedKeys() {
        return windows.size();
    }

    public int maxRequests() { return maxRequests; }

    public Duration window() { return window; }

    private void prune(ArrayDeque<Instant> deque, Instant now) {
        var cutoff = now.minus(window);
        while (!deque.isEmpty() && !deque.peekFirst().isAfter(cutoff)) {
            deque.pollFirst();
        }
    }
}
