package com.fleetdiag.engine.metrics;

import com.fleetdiag.core.model.ToolKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the fencing lock and the session orchestrator.
 *
 * Metrics exposed:
 * - Sessions completed, split by forced vs. all-instances-done
 * - Local collections started / finished by outcome, with duration
 * - Collections currently running on this instance
 * - Lock acquisition attempts and reclaims of stale locks
 *
 * Calls made before {@link #bindTo(MeterRegistry)} are ignored, so components can be
 * constructed with an unbound instance outside of Spring.
 */
public class SessionMetrics implements MeterBinder {

    public static final String SESSIONS_COMPLETED = "fleetdiag.sessions.completed";
    public static final String COLLECTIONS_STARTED = "fleetdiag.collections.started";
    public static final String COLLECTIONS_FINISHED = "fleetdiag.collections.finished";
    public static final String COLLECTIONS_RUNNING = "fleetdiag.collections.running";
    public static final String COLLECTION_DURATION = "fleetdiag.collection.duration";
    public static final String LOCK_ACQUISITIONS = "fleetdiag.lock.acquisitions";
    public static final String LOCK_RECLAIMS = "fleetdiag.lock.reclaims";

    private volatile MeterRegistry registry;
    private final AtomicInteger runningCollections = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(COLLECTIONS_RUNNING, runningCollections, AtomicInteger::get)
            .description("Diagnostic collections running on this instance")
            .register(registry);
    }

    // ========== Session Metrics ==========

    public void sessionCompleted(ToolKind tool, boolean forced) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(SESSIONS_COMPLETED)
            .tag("tool", String.valueOf(tool))
            .tag("forced", String.valueOf(forced))
            .description("Sessions marked complete by this instance")
            .register(r)
            .increment();
    }

    // ========== Collection Metrics ==========

    public void collectionStarted(ToolKind tool) {
        runningCollections.incrementAndGet();
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(COLLECTIONS_STARTED)
            .tag("tool", String.valueOf(tool))
            .description("Local diagnostic collections started")
            .register(r)
            .increment();
    }

    public void collectionFinished(ToolKind tool, String outcome, Duration duration) {
        runningCollections.updateAndGet(v -> Math.max(0, v - 1));
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(COLLECTIONS_FINISHED)
            .tag("tool", String.valueOf(tool))
            .tag("outcome", outcome)
            .description("Local diagnostic collections finished")
            .register(r)
            .increment();

        Timer.builder(COLLECTION_DURATION)
            .tag("tool", String.valueOf(tool))
            .tag("outcome", outcome)
            .description("Local diagnostic collection duration")
            .register(r)
            .record(duration);
    }

    /**
     * A session could not be collected at all (unsupported tool).
     */
    public void collectionRejected(ToolKind tool) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(COLLECTIONS_FINISHED)
            .tag("tool", String.valueOf(tool))
            .tag("outcome", "unsupported")
            .description("Local diagnostic collections finished")
            .register(r)
            .increment();
    }

    public int runningCollections() {
        return runningCollections.get();
    }

    // ========== Lock Metrics ==========

    public void lockAcquired(String resource, boolean success) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(LOCK_ACQUISITIONS)
            .tag("resource", resource)
            .tag("success", String.valueOf(success))
            .description("Fencing lock acquisition attempts")
            .register(r)
            .increment();
    }

    public void lockReclaimed(String resource, String reason) {
        MeterRegistry r = registry;
        if (r == null) {
            return;
        }
        Counter.builder(LOCK_RECLAIMS)
            .tag("resource", resource)
            .tag("reason", reason)
            .description("Stale fencing locks reclaimed")
            .register(r)
            .increment();
    }
}
