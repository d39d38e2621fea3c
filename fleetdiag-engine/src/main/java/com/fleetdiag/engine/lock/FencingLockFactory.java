package com.fleetdiag.engine.lock;

import com.fleetdiag.core.lock.OperationLock;
import com.fleetdiag.engine.metrics.SessionMetrics;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out {@link FileFencingLock}s rooted at the same shared locks directory and
 * owned by the local instance.
 *
 * Locks this process takes are obtained through {@link #forResource(String)} and
 * tracked, so shutdown can release them. Inspection of arbitrary resources goes
 * through {@link #lookup(String)}, which tracks nothing.
 */
public class FencingLockFactory {

    private final Path locksRoot;
    private final String workerId;
    private final Clock clock;
    private final Duration timeout;
    private final Duration settleDelay;
    private final SessionMetrics metrics;
    private final Map<String, OperationLock> locks = new ConcurrentHashMap<>();

    public FencingLockFactory(
            Path locksRoot,
            String workerId,
            Clock clock,
            Duration timeout,
            Duration settleDelay,
            SessionMetrics metrics) {
        this.locksRoot = locksRoot;
        this.workerId = workerId;
        this.clock = clock;
        this.timeout = timeout;
        this.settleDelay = settleDelay;
        this.metrics = metrics;
    }

    /**
     * The tracked lock for a resource this process acquires.
     */
    public OperationLock forResource(String resource) {
        return locks.computeIfAbsent(resource, this::newLock);
    }

    /**
     * An untracked lock handle, for reading or clearing a resource by name.
     */
    public OperationLock lookup(String resource) {
        return newLock(resource);
    }

    private OperationLock newLock(String resource) {
        return new FileFencingLock(locksRoot, resource, workerId, clock, timeout, settleDelay, metrics);
    }

    /**
     * Locks handed out so far by this factory.
     */
    public Collection<OperationLock> issuedLocks() {
        return List.copyOf(locks.values());
    }

    public Path locksRoot() {
        return locksRoot;
    }
}
