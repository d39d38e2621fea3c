package com.fleetdiag.scheduler;

import com.fleetdiag.engine.session.SessionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Drives the session orchestrator's control loop on this instance.
 *
 * Responsibilities:
 * - Tick the orchestrator at a fixed delay, so ticks never overlap
 * - Skip ticks while the feature gate is closed
 * - Keep the loop alive when a tick throws
 */
public class SessionRunnerScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionRunnerScheduler.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(1);

    private final SessionOrchestrator orchestrator;
    private final BooleanSupplier featureGate;
    private final Duration interval;
    private final Duration initialDelay;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public SessionRunnerScheduler(SessionOrchestrator orchestrator, BooleanSupplier featureGate, Duration interval) {
        this(orchestrator, featureGate, interval, interval);
    }

    public SessionRunnerScheduler(
            SessionOrchestrator orchestrator,
            BooleanSupplier featureGate,
            Duration interval,
            Duration initialDelay) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + interval);
        }
        this.orchestrator = orchestrator;
        this.featureGate = featureGate;
        this.interval = interval;
        this.initialDelay = initialDelay;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-runner");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the scheduler.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Session runner already running");
            return;
        }

        running = true;
        log.info("Starting session runner on {} every {}", orchestrator.instanceId(), interval);

        scheduler.scheduleWithFixedDelay(
            this::runTick,
            initialDelay.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    /**
     * Stop the scheduler. A tick in progress is allowed to finish.
     */
    public synchronized void stop() {
        if (!running && scheduler.isShutdown()) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Session runner stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One scheduled tick. Exceptions must not escape or the executor cancels the schedule.
     */
    void runTick() {
        if (!running) {
            return;
        }
        try {
            if (!featureGate.getAsBoolean()) {
                log.debug("Session runner disabled, skipping tick");
                return;
            }
            orchestrator.tick();
        } catch (Exception e) {
            log.error("Error in session runner tick", e);
        }
    }
}
