package com.sandboxgate.observability;

import com.sandboxgate.sandbox.PoolStats;
import com.sandboxgate.sandbox.SandboxSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToIntFunction;

public class SandboxMetrics {

    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_DENIED = "denied";

    private final MeterRegistry registry;
    private final AtomicReference<SandboxSource> pool = new AtomicReference<>();
    private final AtomicBoolean poolGaugesRegistered = new AtomicBoolean();

    public SandboxMetrics() {
        this(new SimpleMeterRegistry());
    }

    public SandboxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter toolCalls(String outcome) {
        return Counter.builder("sandboxgate.tool.calls").tag("outcome", outcome).register(registry);
    }

    public Timer toolLatency() {
        return Timer.builder("sandboxgate.tool.latency").register(registry);
    }

    public Counter securityViolations() {
        return Counter.builder("sandboxgate.security.violations").register(registry);
    }

    public void recordCall(String outcome, long elapsedMs) {
        toolCalls(outcome).increment();
        if (!OUTCOME_DENIED.equals(outcome)) {
            toolLatency().record(Duration.ofMillis(elapsedMs));
        }
    }

    /**
     * Points the pool gauges at {@code source}. The gauges are registered on the first call
     * and follow whichever source was bound last, so a restarted executor reports its new pool.
     */
    public void bindPool(SandboxSource source) {
        pool.set(source);
        if (poolGaugesRegistered.compareAndSet(false, true)) {
            Gauge.builder("sandboxgate.pool.in_use", this, m -> m.poolStat(PoolStats::inUse)).register(registry);
            Gauge.builder("sandboxgate.pool.available", this, m -> m.poolStat(PoolStats::available)).register(registry);
        }
    }

    private double poolStat(ToIntFunction<PoolStats> stat) {
        var source = pool.get();
        return source == null ? 0 : stat.applyAsInt(source.stats());
    }
}
