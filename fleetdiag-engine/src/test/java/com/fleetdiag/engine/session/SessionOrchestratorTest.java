package com.fleetdiag.engine.session;

import com.fleetdiag.core.exception.StoreAccessException;
import com.fleetdiag.core.model.LocalSessionState;
import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.Session;
import com.fleetdiag.core.model.SessionRequest;
import com.fleetdiag.core.model.ToolKind;
import com.fleetdiag.core.store.SessionStore;
import com.fleetdiag.core.tool.DiagnosticToolException;
import com.fleetdiag.engine.metrics.SessionMetrics;
import com.fleetdiag.engine.persistence.InMemorySessionStore;
import com.fleetdiag.engine.persistence.StaticInstanceRegistry;
import com.fleetdiag.engine.test.DirectExecutorService;
import com.fleetdiag.engine.test.MutableClock;
import com.fleetdiag.engine.test.TestTool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Control-loop behaviour of {@link SessionOrchestrator} against an in-memory store.
 * Instances A and B share one store.
 */
class SessionOrchestratorTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final Set<String> FLEET = Set.of("A", "B");

    @TempDir
    Path outputDir;

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private InMemorySessionStore storeA;
    private InMemorySessionStore storeB;
    private final List<ExecutorService> executors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        registry = new SimpleMeterRegistry();
        storeA = new InMemorySessionStore(new StaticInstanceRegistry("A", FLEET), clock);
        storeB = storeA.forInstance(new StaticInstanceRegistry("B", FLEET));
    }

    @AfterEach
    void tearDown() {
        executors.forEach(ExecutorService::shutdownNow);
    }

    private SessionOrchestrator orchestrator(
            InMemorySessionStore store, TestTool tool, ExecutorService executor, boolean cancelOnForced) {
        executors.add(executor);
        SessionMetrics metrics = new SessionMetrics();
        metrics.bindTo(registry);
        return new SessionOrchestrator(
            store,
            new StaticInstanceRegistry(store == storeA ? "A" : "B", FLEET),
            new DiagnosticToolRegistry(List.of(tool)),
            executor,
            clock,
            metrics,
            SessionOrchestrator.DEFAULT_MAX_SESSION_DURATION,
            cancelOnForced);
    }

    private SessionOrchestrator direct(InMemorySessionStore store, TestTool tool) {
        return orchestrator(store, tool, new DirectExecutorService(), false);
    }

    private double completedCount(boolean forced) {
        var counter = registry.find(SessionMetrics.SESSIONS_COMPLETED).tag("forced", String.valueOf(forced)).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private double finishedCount(String outcome) {
        var counter = registry.find(SessionMetrics.COLLECTIONS_FINISHED).tag("outcome", outcome).counter();
        return counter == null ? 0.0 : counter.count();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 10s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Tick without an active session does nothing")
    void noActiveSession() {
        TestTool tool = new TestTool(ToolKind.MEMORY_DUMP, outputDir);
        SessionOrchestrator orchestrator = direct(storeA, tool);

        orchestrator.tick();

        assertThat(tool.invocations()).isZero();
        assertThat(orchestrator.localState()).isEqualTo(LocalSessionState.NO_ACTIVE_SESSION);
    }

    @Test
    @DisplayName("Scoped session: both instances collect and the session completes exactly once")
    void scopedSessionCompletesOnce() {
        TestTool toolA = new TestTool(ToolKind.MEMORY_DUMP, outputDir);
        TestTool toolB = new TestTool(ToolKind.MEMORY_DUMP, outputDir);
        SessionOrchestrator a = direct(storeA, toolA);
        SessionOrchestrator b = direct(storeB, toolB);
        Session s1 = storeA.submitSession(new SessionRequest(ToolKind.MEMORY_DUMP, null, List.of("A", "B")));

        a.tick();
        assertThat(toolA.invocations()).isEqualTo(1);
        assertThat(a.localState()).isEqualTo(LocalSessionState.COMPLETED);
        assertThat(storeA.getSession(s1.sessionId()).orElseThrow().complete()).isFalse();

        b.tick();
        Session done = storeA.getSession(s1.sessionId()).orElseThrow();
        assertThat(done.complete()).isTrue();
        assertThat(done.completedInstances()).containsExactlyInAnyOrder("A", "B");
        assertThat(done.logs()).hasSize(2);
        assertThat(done.logs()).allSatisfy(log -> {
            assertThat(log.size()).isEqualTo(TestTool.ARTIFACT_CONTENT.length());
            assertThat(log.name()).endsWith(".out");
        });
        assertThat(done.logs()).extracting(LogFile::instanceId).containsExactlyInAnyOrder("A", "B");

        Instant endTime = done.endTime();
        clock.advance(Duration.ofMinutes(1));
        a.tick();
        b.tick();

        assertThat(completedCount(false)).isEqualTo(1.0);
        assertThat(storeA.getSession(s1.sessionId()).orElseThrow().endTime()).isEqualTo(endTime);
        assertThat(toolA.invocations()).isEqualTo(1);
        assertThat(toolB.invocations()).isEqualTo(1);
        assertThat(a.localState(s1.sessionId())).isEqualTo(LocalSessionState.GLOBALLY_COMPLETE);
    }

    @Test
    @DisplayName("Next tick completes a session whose instances have all reported")
    void periodicCompletionCheck() {
        SessionOrchestrator a = direct(storeA, new TestTool(ToolKind.MEMORY_DUMP, outputDir));
        SessionOrchestrator b = direct(storeB, new TestTool(ToolKind.MEMORY_DUMP, outputDir));
        Session s1 = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));
        storeA.markInstanceStarted(s1);
        storeA.markInstanceComplete(s1);
        storeB.markInstanceStarted(s1);
        storeB.markInstanceComplete(s1);

        b.tick();
        a.tick();

        assertThat(storeA.getSession(s1.sessionId()).orElseThrow().complete()).isTrue();
        assertThat(completedCount(false)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("All-instances session stays open until every live instance has collected, then completes once")
    void allInstancesSessionCompletesOnce() {
        TestTool toolA = new TestTool(ToolKind.MEMORY_DUMP, outputDir);
        TestTool toolB = new TestTool(ToolKind.MEMORY_DUMP, outputDir);
        SessionOrchestrator a = direct(storeA, toolA);
        SessionOrchestrator b = direct(storeB, toolB);
        Session s1 = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        a.tick();
        Session afterA = storeA.getSession(s1.sessionId()).orElseThrow();
        assertThat(toolA.invocations()).isEqualTo(1);
        assertThat(afterA.complete()).isFalse();
        assertThat(afterA.completedInstances()).containsExactly("A");
        assertThat(storeA.getActiveSession()).isPresent();
        assertThat(completedCount(false)).isZero();

        b.tick();
        Session done = storeA.getSession(s1.sessionId()).orElseThrow();
        assertThat(toolB.invocations()).isEqualTo(1);
        assertThat(done.complete()).isTrue();
        assertThat(done.completedInstances()).containsExactlyInAnyOrder("A", "B");
        assertThat(completedCount(false)).isEqualTo(1.0);

        clock.advance(Duration.ofMinutes(1));
        a.tick();
        b.tick();

        assertThat(completedCount(false)).isEqualTo(1.0);
        assertThat(completedCount(true)).isZero();
        assertThat(toolA.invocations()).isEqualTo(1);
        assertThat(toolB.invocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Overrun session is forced complete even if no instance started")
    void deadlineForcesCompletionWithZeroStarted() {
        TestTool tool = new TestTool(ToolKind.MEMORY_DUMP, outputDir);
        SessionOrchestrator a = direct(storeA, tool);
        Session s1 = storeA.submitSession(new SessionRequest(ToolKind.MEMORY_DUMP, null, List.of("C")));

        a.tick();
        assertThat(storeA.getActiveSession()).isPresent();
        assertThat(a.localState()).isEqualTo(LocalSessionState.NOT_PARTICIPATING);

        clock.advance(Duration.ofMinutes(16));
        a.tick();

        Session done = storeA.getSession(s1.sessionId()).orElseThrow();
        assertThat(done.complete()).isTrue();
        assertThat(done.startedInstances()).isEmpty();
        assertThat(completedCount(true)).isEqualTo(1.0);
        assertThat(tool.invocations()).isZero();
    }

    @Test
    @DisplayName("Forced completion ends session handling for the tick")
    void forcedCompletionDoesNotStartCollection() {
        TestTool tool = new TestTool(ToolKind.MEMORY_DUMP, outputDir);
        SessionOrchestrator a = direct(storeA, tool);
        storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        clock.advance(Duration.ofMinutes(15).plusSeconds(1));
        a.tick();

        assertThat(storeA.getActiveSession()).isEmpty();
        assertThat(tool.invocations()).isZero();
    }

    @Test
    @DisplayName("A running local task is not started a second time")
    void runningTaskNotDuplicated() throws Exception {
        TestTool tool = new TestTool(ToolKind.PROFILER, outputDir).blocking();
        SessionOrchestrator a = orchestrator(storeA, tool, Executors.newSingleThreadExecutor(), false);
        Session s1 = storeA.submitSession(SessionRequest.allInstances(ToolKind.PROFILER, "duration=5"));

        a.tick();
        assertThat(tool.awaitStarted(10)).isTrue();
        a.tick();
        clock.advance(Duration.ofMinutes(1));
        a.tick();

        assertThat(tool.invocations()).isEqualTo(1);
        assertThat(a.localState()).isEqualTo(LocalSessionState.RUNNING);
        assertThat(a.runningSessionIds()).containsExactly(s1.sessionId());
        assertThat(registry.get(SessionMetrics.COLLECTIONS_RUNNING).gauge().value()).isEqualTo(1.0);

        tool.release();
        await(() -> a.runningCount() == 0);
        a.tick();

        assertThat(a.isTracked(s1.sessionId())).isFalse();
        assertThat(tool.invocations()).isEqualTo(1);
        assertThat(storeA.hasThisInstanceCollected(s1)).isTrue();
    }

    @Test
    @DisplayName("Unknown tool is fatal for its session but later sessions still run")
    void unknownToolDoesNotStopLoop() {
        TestTool tool = new TestTool(ToolKind.MEMORY_DUMP, outputDir);
        SessionOrchestrator a = direct(storeA, tool);
        Session unknown = storeA.submitSession(SessionRequest.allInstances(ToolKind.UNKNOWN, null));

        assertThatCode(a::tick).doesNotThrowAnyException();
        assertThatCode(a::tick).doesNotThrowAnyException();

        assertThat(finishedCount("unsupported")).isEqualTo(1.0);
        assertThat(storeA.getSession(unknown.sessionId()).orElseThrow().startedInstances()).isEmpty();

        storeA.markSessionComplete(unknown);
        clock.advance(Duration.ofSeconds(1));
        Session next = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        a.tick();

        assertThat(tool.invocations()).isEqualTo(1);
        assertThat(storeA.hasThisInstanceCollected(next)).isTrue();
    }

    @Test
    @DisplayName("Profiler session with only a memory dump tool registered is unsupported")
    void unregisteredToolIsUnsupported() {
        SessionOrchestrator a = direct(storeA, new TestTool(ToolKind.MEMORY_DUMP, outputDir));
        storeA.submitSession(SessionRequest.allInstances(ToolKind.PROFILER, null));

        a.tick();

        assertThat(finishedCount("unsupported")).isEqualTo(1.0);
        assertThat(a.localState()).isEqualTo(LocalSessionState.NOT_STARTED);
    }

    @Test
    @DisplayName("Failed tool runs are reaped and retried on a later tick")
    void failedRunIsReapedAndRetried() {
        TestTool tool = new TestTool(ToolKind.MEMORY_DUMP, outputDir)
            .failNext(new DiagnosticToolException(DiagnosticToolException.EXIT_CODE, "jcmd exited with 1"))
            .failNext(new IllegalStateException("boom"));
        SessionOrchestrator a = direct(storeA, tool);
        Session s1 = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        a.tick();
        assertThat(a.isTracked(s1.sessionId())).isFalse();
        assertThat(storeA.hasThisInstanceCollected(s1)).isFalse();

        a.tick();
        assertThat(finishedCount("failed")).isEqualTo(2.0);

        a.tick();
        assertThat(tool.invocations()).isEqualTo(3);
        assertThat(finishedCount("succeeded")).isEqualTo(1.0);
        assertThat(storeA.hasThisInstanceCollected(s1)).isTrue();
    }

    @Test
    @DisplayName("Store failure in one tick is logged and the next tick runs")
    void storeFailureDoesNotStopLoop() {
        SessionStore store = mock(SessionStore.class);
        when(store.getActiveSession())
            .thenThrow(new StoreAccessException("share unavailable", new IOException("EIO")))
            .thenReturn(Optional.empty());
        SessionOrchestrator a = new SessionOrchestrator(
            store,
            StaticInstanceRegistry.single("A"),
            new DiagnosticToolRegistry(List.of()),
            new DirectExecutorService(),
            clock,
            new SessionMetrics(),
            Duration.ofMinutes(15),
            false);

        assertThatCode(a::tick).doesNotThrowAnyException();
        assertThatCode(a::tick).doesNotThrowAnyException();

        verify(store, times(2)).getActiveSession();
    }

    @Test
    @DisplayName("By default forced completion lets the local task finish and keeps its artifacts")
    void forcedCompletionLetsTaskRun() throws Exception {
        TestTool tool = new TestTool(ToolKind.MEMORY_DUMP, outputDir).blocking();
        SessionOrchestrator a = orchestrator(storeA, tool, Executors.newSingleThreadExecutor(), false);
        Session s1 = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        a.tick();
        assertThat(tool.awaitStarted(10)).isTrue();
        clock.advance(Duration.ofMinutes(16));
        a.tick();

        assertThat(storeA.getSession(s1.sessionId()).orElseThrow().complete()).isTrue();
        assertThat(a.runningCount()).isEqualTo(1);

        tool.release();
        await(() -> a.runningCount() == 0);

        Session done = storeA.getSession(s1.sessionId()).orElseThrow();
        assertThat(done.logs()).hasSize(1);
        assertThat(done.completedInstances()).contains("A");
        assertThat(completedCount(true)).isEqualTo(1.0);
        assertThat(completedCount(false)).isZero();
    }

    @Test
    @DisplayName("cancelOnForcedCompletion cancels the local task")
    void forcedCompletionCancelsWhenConfigured() throws Exception {
        TestTool tool = new TestTool(ToolKind.MEMORY_DUMP, outputDir).blocking();
        SessionOrchestrator a = orchestrator(storeA, tool, Executors.newSingleThreadExecutor(), true);
        Session s1 = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        a.tick();
        assertThat(tool.awaitStarted(10)).isTrue();
        clock.advance(Duration.ofMinutes(16));
        a.tick();

        await(() -> a.runningCount() == 0);
        a.tick();

        assertThat(finishedCount("cancelled")).isEqualTo(1.0);
        assertThat(storeA.getSession(s1.sessionId()).orElseThrow().logs()).isEmpty();
        assertThat(a.isTracked(s1.sessionId())).isFalse();
    }

    @Test
    @DisplayName("Shutdown cancels local collections and stops further ticks")
    void shutdownCancelsAndStops() throws Exception {
        TestTool tool = new TestTool(ToolKind.MEMORY_DUMP, outputDir).blocking();
        SessionOrchestrator a = orchestrator(storeA, tool, Executors.newSingleThreadExecutor(), false);
        storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        assertThat(a.cancel("missing")).isFalse();
        a.tick();
        assertThat(tool.awaitStarted(10)).isTrue();

        assertThat(a.shutdown(Duration.ofSeconds(10))).isTrue();
        assertThat(a.isStopped()).isTrue();
        assertThat(finishedCount("cancelled")).isEqualTo(1.0);

        a.tick();
        assertThat(tool.invocations()).isEqualTo(1);
    }
}
