package com.fleetdiag.engine.session;

import com.fleetdiag.core.exception.NotFoundException;
import com.fleetdiag.core.exception.UnsupportedToolException;
import com.fleetdiag.core.model.LocalSessionState;
import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.Session;
import com.fleetdiag.core.model.ToolKind;
import com.fleetdiag.core.store.InstanceRegistry;
import com.fleetdiag.core.store.SessionStore;
import com.fleetdiag.core.tool.CancellationSignal;
import com.fleetdiag.core.tool.DiagnosticTool;
import com.fleetdiag.core.tool.DiagnosticToolException;
import com.fleetdiag.engine.logging.LoggingContext;
import com.fleetdiag.engine.metrics.SessionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Per-instance control loop for fleet-wide diagnostic sessions.
 *
 * Every instance runs one orchestrator against the shared {@link SessionStore}. There
 * is no leader: each tick independently
 * 1. Discovers the active session
 * 2. Completes it if every required instance has collected
 * 3. Forces completion once it has run longer than the maximum duration
 * 4. Decides whether this instance participates
 * 5. Skips it if a local task already exists or this instance already collected
 * 6. Starts the session's tool on the collection executor
 * 7. Reaps local tasks that have finished
 *
 * Steps 2 and 3 end session handling for the tick. Completion is also checked right
 * after a local collection finishes, so the last finisher closes the session without
 * waiting for the next tick.
 *
 * A failed collection leaves no completion marker, so a later tick starts it again
 * until the session completes or is forced complete. An unsupported tool is fatal
 * for the session and is not retried by this instance.
 */
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    public static final Duration DEFAULT_MAX_SESSION_DURATION = Duration.ofMinutes(15);

    private final SessionStore store;
    private final InstanceRegistry instanceRegistry;
    private final DiagnosticToolRegistry toolRegistry;
    private final ExecutorService collectionExecutor;
    private final Clock clock;
    private final SessionMetrics metrics;
    private final Duration maxSessionDuration;
    private final boolean cancelOnForcedCompletion;

    private final Map<String, LocalTaskHandle> runningTasks = new ConcurrentHashMap<>();
    private final Set<String> unsupportedSessions = ConcurrentHashMap.newKeySet();
    private volatile boolean stopped = false;

    public SessionOrchestrator(
            SessionStore store,
            InstanceRegistry instanceRegistry,
            DiagnosticToolRegistry toolRegistry,
            ExecutorService collectionExecutor,
            Clock clock,
            SessionMetrics metrics,
            Duration maxSessionDuration,
            boolean cancelOnForcedCompletion) {
        this.store = store;
        this.instanceRegistry = instanceRegistry;
        this.toolRegistry = toolRegistry;
        this.collectionExecutor = collectionExecutor;
        this.clock = clock;
        this.metrics = metrics;
        this.maxSessionDuration = maxSessionDuration;
        this.cancelOnForcedCompletion = cancelOnForcedCompletion;
    }

    /**
     * Run one pass of the control loop. Failures are logged; the next tick runs normally.
     */
    public synchronized void tick() {
        if (stopped) {
            log.debug("Orchestrator stopped, skipping tick");
            return;
        }

        try (var ctx = LoggingContext.forInstance(instanceId())) {
            heartbeat();

            try {
                runActiveSession();
            } catch (RuntimeException e) {
                log.error("Session tick failed on {}: {}", instanceId(), e.getMessage(), e);
            }

            reapCompletedTasks();
        } finally {
            LoggingContext.clearAll();
        }
    }

    private void heartbeat() {
        try {
            instanceRegistry.heartbeat();
        } catch (RuntimeException e) {
            log.warn("Heartbeat failed for {}: {}", instanceId(), e.getMessage());
        }
    }

    private void runActiveSession() {
        Optional<Session> active = store.getActiveSession();
        if (active.isEmpty()) {
            unsupportedSessions.clear();
            log.debug("No active session");
            return;
        }

        Session session = active.get();
        unsupportedSessions.retainAll(Set.of(session.sessionId()));

        try (var ctx = LoggingContext.forSession(session.sessionId(), session.tool())) {
            if (store.allInstancesCollected(session)) {
                completeSession(session, false);
                return;
            }

            Duration age = session.age(clock.instant());
            if (age.compareTo(maxSessionDuration) > 0) {
                log.warn("Session {} has run for {} (max {}), forcing completion",
                    session.sessionId(), age, maxSessionDuration);
                completeSession(session, true);
                if (cancelOnForcedCompletion) {
                    cancel(session.sessionId());
                }
                return;
            }

            if (!store.shouldCollectOnThisInstance(session)) {
                log.debug("Instance {} not in scope of session {}", instanceId(), session.sessionId());
                return;
            }

            if (runningTasks.containsKey(session.sessionId())) {
                log.debug("Collection for session {} already running", session.sessionId());
                return;
            }

            if (store.hasThisInstanceCollected(session)) {
                log.debug("Instance {} already collected session {}", instanceId(), session.sessionId());
                return;
            }

            if (unsupportedSessions.contains(session.sessionId())) {
                return;
            }

            startCollection(session);
        }
    }

    private void startCollection(Session session) {
        DiagnosticTool tool;
        try {
            tool = toolRegistry.resolve(session.tool());
        } catch (UnsupportedToolException e) {
            log.error("Cannot collect session {}: {}", session.sessionId(), e.getMessage());
            unsupportedSessions.add(session.sessionId());
            metrics.collectionRejected(session.tool());
            return;
        }

        store.markInstanceStarted(session);

        CancellationSignal cancellation = new CancellationSignal();
        Instant startedAt = clock.instant();
        metrics.collectionStarted(session.tool());
        try {
            Future<CollectionOutcome> task = collectionExecutor.submit(
                () -> runTool(session, tool, cancellation, startedAt));
            runningTasks.putIfAbsent(session.sessionId(), new LocalTaskHandle(
                session.sessionId(), task, cancellation, startedAt));
            log.info("Started {} collection for session {} on {}",
                session.tool(), session.sessionId(), instanceId());
        } catch (RejectedExecutionException e) {
            log.error("Collection executor rejected session {}: {}", session.sessionId(), e.getMessage());
            metrics.collectionFinished(session.tool(), CollectionOutcome.FAILED.tag(), Duration.ZERO);
        }
    }

    /**
     * Body of a collection task. Never throws; the outcome is the task's result.
     */
    private CollectionOutcome runTool(
            Session session, DiagnosticTool tool, CancellationSignal cancellation, Instant startedAt) {
        CollectionOutcome outcome = CollectionOutcome.FAILED;
        try (var ctx = LoggingContext.forCollection(session.sessionId(), instanceId(), session.tool())) {
            List<LogFile> produced = tool.invoke(session.toolParameters(), cancellation);
            List<LogFile> logs = describe(produced);

            store.addLogs(session, logs);
            store.markInstanceComplete(session);
            log.info("Collected {} artifact(s) for session {}", logs.size(), session.sessionId());

            if (store.allInstancesCollected(session)) {
                completeSession(session, false);
            }
            outcome = CollectionOutcome.SUCCEEDED;
        } catch (DiagnosticToolException e) {
            if (e.isCancellation()) {
                log.info("Collection for session {} cancelled", session.sessionId());
                outcome = CollectionOutcome.CANCELLED;
            } else {
                log.error("Collection for session {} failed [{}]: {}",
                    session.sessionId(), e.getErrorCode(), e.getMessage(), e);
            }
        } catch (RuntimeException e) {
            log.error("Collection for session {} failed: {}", session.sessionId(), e.getMessage(), e);
        } finally {
            metrics.collectionFinished(session.tool(), outcome.tag(), Duration.between(startedAt, clock.instant()));
            LoggingContext.clearAll();
        }
        return outcome;
    }

    /**
     * Stamp artifacts with this instance and the file's name and size on disk.
     */
    private List<LogFile> describe(List<LogFile> produced) {
        List<LogFile> described = new ArrayList<>(produced.size());
        for (LogFile file : produced) {
            Path path = Path.of(file.fullPath());
            long size;
            try {
                size = Files.size(path);
            } catch (IOException e) {
                log.warn("Cannot read size of artifact {}: {}", path, e.getMessage());
                size = 0L;
            }
            Path fileName = path.getFileName();
            described.add(file.withDetails(instanceId(), fileName != null ? fileName.toString() : file.fullPath(), size));
        }
        return described;
    }

    private void completeSession(Session session, boolean forced) {
        if (store.markSessionComplete(session)) {
            metrics.sessionCompleted(session.tool(), forced);
            if (forced) {
                log.info("Session {} forced complete by {}", session.sessionId(), instanceId());
            } else {
                log.info("All instances collected, session {} complete", session.sessionId());
            }
        }
    }

    private void reapCompletedTasks() {
        runningTasks.forEach((sessionId, handle) -> {
            if (handle.isTerminal() && runningTasks.remove(sessionId, handle)) {
                log.debug("Reaped {} collection task for session {}", outcomeOf(handle), sessionId);
            }
        });
    }

    private CollectionOutcome outcomeOf(LocalTaskHandle handle) {
        try {
            return handle.task().get(0, TimeUnit.MILLISECONDS);
        } catch (CancellationException | ExecutionException | TimeoutException e) {
            return CollectionOutcome.FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CollectionOutcome.FAILED;
        }
    }

    // ========== Status & control ==========

    /**
     * Where the active session stands on this instance.
     */
    public LocalSessionState localState() {
        return store.getActiveSession()
            .map(this::localState)
            .orElse(LocalSessionState.NO_ACTIVE_SESSION);
    }

    /**
     * Where the given session stands on this instance.
     */
    public LocalSessionState localState(String sessionId) {
        return store.getSession(sessionId)
            .map(this::localState)
            .orElseThrow(() -> new NotFoundException("Session", sessionId));
    }

    private LocalSessionState localState(Session session) {
        if (session.complete()) {
            return LocalSessionState.GLOBALLY_COMPLETE;
        }
        if (!store.shouldCollectOnThisInstance(session)) {
            return LocalSessionState.NOT_PARTICIPATING;
        }
        LocalTaskHandle handle = runningTasks.get(session.sessionId());
        if (handle != null && !handle.isTerminal()) {
            return LocalSessionState.RUNNING;
        }
        if (store.hasThisInstanceCollected(session)) {
            return LocalSessionState.COMPLETED;
        }
        return LocalSessionState.NOT_STARTED;
    }

    /**
     * Ask the local collection for a session to stop.
     *
     * @return true if a local task was tracked for the session
     */
    public boolean cancel(String sessionId) {
        LocalTaskHandle handle = runningTasks.get(sessionId);
        if (handle == null) {
            return false;
        }
        log.info("Cancelling local collection for session {}", sessionId);
        handle.cancel();
        return true;
    }

    /**
     * Number of local collection tasks that have not finished yet.
     */
    public int runningCount() {
        return (int) runningTasks.values().stream().filter(h -> !h.isTerminal()).count();
    }

    public Set<String> runningSessionIds() {
        return runningTasks.values().stream()
            .filter(h -> !h.isTerminal())
            .map(LocalTaskHandle::sessionId)
            .collect(Collectors.toSet());
    }

    /**
     * Whether a task handle is tracked for the session, finished or not.
     */
    boolean isTracked(String sessionId) {
        return runningTasks.containsKey(sessionId);
    }

    /**
     * Stop ticking, cancel local collections and wait for them to finish.
     *
     * @return true if every local task finished within the timeout
     */
    public boolean shutdown(Duration timeout) {
        stopped = true;
        List<LocalTaskHandle> handles = List.copyOf(runningTasks.values());
        if (handles.isEmpty()) {
            return true;
        }

        log.info("Cancelling {} local collection(s)", handles.size());
        handles.forEach(LocalTaskHandle::cancel);

        long deadline = System.nanoTime() + timeout.toNanos();
        boolean allDone = true;
        for (LocalTaskHandle handle : handles) {
            long remaining = deadline - System.nanoTime();
            try {
                handle.task().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("Collection for session {} did not stop within {}", handle.sessionId(), timeout);
                allDone = false;
            } catch (CancellationException | ExecutionException e) {
                log.debug("Collection for session {} ended abnormally: {}", handle.sessionId(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return allDone;
    }

    public boolean isStopped() {
        return stopped;
    }

    public String instanceId() {
        return instanceRegistry.localInstanceId();
    }

    public Duration maxSessionDuration() {
        return maxSessionDuration;
    }
}
