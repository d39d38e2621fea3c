package com.fleetdiag.engine.lifecycle;

import com.fleetdiag.core.lock.OperationLock;
import com.fleetdiag.engine.lock.FencingLockFactory;
import com.fleetdiag.engine.session.SessionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown of an instance.
 *
 * On shutdown:
 * 1. Runs stop hooks (the tick scheduler) so no new tick starts
 * 2. Stops the orchestrator, cancelling local collections and waiting for them
 * 3. Releases fencing locks this process still holds
 *
 * Leaving a lock behind blocks the fleet until it expires; a killed collection
 * leaves no completion marker and is picked up again after restart.
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final SessionOrchestrator orchestrator;
    private final FencingLockFactory lockFactory;
    private final Duration timeout;
    private final List<Runnable> stopHooks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(SessionOrchestrator orchestrator, FencingLockFactory lockFactory, Duration timeout) {
        this.orchestrator = orchestrator;
        this.lockFactory = lockFactory;
        this.timeout = timeout;
    }

    /**
     * Register something to stop before local collections are cancelled.
     */
    public void onStop(Runnable hook) {
        stopHooks.add(hook);
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        shutdown();
    }

    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Initiating graceful shutdown for instance: {}", orchestrator.instanceId());

        for (Runnable hook : stopHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Stop hook failed: {}", e.getMessage());
            }
        }

        boolean drained = orchestrator.shutdown(timeout);
        if (!drained) {
            log.warn("Shutdown timeout reached with {} collection(s) still running: {}",
                orchestrator.runningCount(), orchestrator.runningSessionIds());
        } else {
            log.info("All local collections stopped");
        }

        releaseOwnedLocks();

        log.info("Graceful shutdown complete for instance: {}", orchestrator.instanceId());
    }

    private void releaseOwnedLocks() {
        int released = 0;
        for (OperationLock lock : lockFactory.issuedLocks()) {
            try {
                if (lock.isHeld() && lock.releaseIfOwned()) {
                    released++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to release lock {}: {}", lock.resource(), e.getMessage());
            }
        }
        log.info("Released {} owned lock(s)", released);
    }
}
