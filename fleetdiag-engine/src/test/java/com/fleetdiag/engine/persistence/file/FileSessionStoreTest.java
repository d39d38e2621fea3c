package com.fleetdiag.engine.persistence.file;

import com.fleetdiag.core.exception.LockContentionException;
import com.fleetdiag.core.exception.SessionAlreadyActiveException;
import com.fleetdiag.core.lock.OperationLock;
import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.Session;
import com.fleetdiag.core.model.SessionRequest;
import com.fleetdiag.core.model.ToolKind;
import com.fleetdiag.engine.lock.FileFencingLock;
import com.fleetdiag.engine.persistence.StaticInstanceRegistry;
import com.fleetdiag.engine.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class FileSessionStoreTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path sharedRoot;

    private MutableClock clock;
    private FileSessionStore storeA;
    private FileSessionStore storeB;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        storeA = store("A");
        storeB = store("B");
    }

    private FileSessionStore store(String instanceId) {
        Set<String> fleet = Set.of("A", "B");
        OperationLock lock = new FileFencingLock(sharedRoot.resolve("locks"), "session-submit", instanceId, clock);
        return new FileSessionStore(sharedRoot.resolve("sessions"),
            new StaticInstanceRegistry(instanceId, fleet), lock, clock);
    }

    @Test
    @DisplayName("Submitted session is visible to every instance")
    void submittedSessionIsShared() {
        Session submitted = storeA.submitSession(
            new SessionRequest(ToolKind.PROFILER, "duration=30", List.of("A", "B")));

        Session seen = storeB.getActiveSession().orElseThrow();
        assertThat(seen.sessionId()).isEqualTo(submitted.sessionId());
        assertThat(seen.tool()).isEqualTo(ToolKind.PROFILER);
        assertThat(seen.toolParameters()).isEqualTo("duration=30");
        assertThat(seen.instances()).containsExactly("A", "B");
        assertThat(seen.startTime()).isEqualTo(START);
        assertThat(seen.complete()).isFalse();
        assertThat(Files.exists(sharedRoot.resolve("locks").resolve("session-submit"))).isFalse();
    }

    @Test
    @DisplayName("Submission while a session is active is rejected")
    void rejectsSecondActiveSession() {
        Session first = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        assertThatThrownBy(() -> storeB.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null)))
            .isInstanceOf(SessionAlreadyActiveException.class)
            .hasMessageContaining(first.sessionId());

        assertThat(storeB.listSessions()).hasSize(1);
    }

    @Test
    @DisplayName("Submission fails fast while the submission lock is held elsewhere")
    void submissionRequiresLock() {
        FileFencingLock holder = new FileFencingLock(sharedRoot.resolve("locks"), "session-submit", "C", clock);
        assertThat(holder.acquire("maintenance")).isTrue();

        assertThatThrownBy(() -> storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null)))
            .isInstanceOf(LockContentionException.class)
            .hasMessage(FileFencingLock.DEFAULT_MESSAGE);

        assertThat(holder.isHeld()).isTrue();
        assertThat(storeA.listSessions()).isEmpty();
    }

    @Test
    @DisplayName("Concurrent submissions produce a single active session")
    void concurrentSubmissionsYieldOneSession() throws Exception {
        int contenders = 6;
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                FileSessionStore store = store(i % 2 == 0 ? "A" : "B");
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));
                        return true;
                    } catch (LockContentionException | SessionAlreadyActiveException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int submitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    submitted++;
                }
            }
            assertThat(submitted).isEqualTo(1);
            assertThat(storeA.listSessions()).hasSize(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Per-instance markers and logs drive completion")
    void instanceProgress() {
        Session session = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));

        storeA.markInstanceStarted(session);
        storeA.addLogs(session, List.of(new LogFile("A", "/dumps/a.hprof", "a.hprof", 100)));
        storeA.markInstanceComplete(session);

        assertThat(storeA.hasThisInstanceCollected(session)).isTrue();
        assertThat(storeB.hasThisInstanceCollected(session)).isFalse();
        assertThat(storeB.allInstancesCollected(session)).isFalse();

        storeB.markInstanceStarted(session);
        storeB.addLogs(session, List.of(new LogFile("B", "/dumps/b.hprof", "b.hprof", 200)));
        storeB.markInstanceComplete(session);

        assertThat(storeA.allInstancesCollected(session)).isTrue();

        Session loaded = storeA.getSession(session.sessionId()).orElseThrow();
        assertThat(loaded.startedInstances()).containsExactlyInAnyOrder("A", "B");
        assertThat(loaded.completedInstances()).containsExactlyInAnyOrder("A", "B");
        assertThat(loaded.logs()).extracting(LogFile::name).containsExactly("a.hprof", "b.hprof");
    }

    @Test
    @DisplayName("Completion marker is created once")
    void markSessionCompleteOnce() {
        Session session = storeA.submitSession(SessionRequest.allInstances(ToolKind.MEMORY_DUMP, null));
        clock.advance(Duration.ofMinutes(2));

        assertThat(storeA.markSessionComplete(session)).isTrue();
        assertThat(storeB.markSessionComplete(session)).isFalse();

        Session loaded = storeB.getSession(session.sessionId()).orElseThrow();
        assertThat(loaded.complete()).isTrue();
        assertThat(loaded.endTime()).isEqualTo(START.plus(Duration.ofMinutes(2)));
        assertThat(storeB.getActiveSession()).isEmpty();
    }

    @Test
    @DisplayName("Unknown tool values read back as UNKNOWN")
    void unknownToolReadsAsUnknown() throws Exception {
        Path dir = Files.createDirectories(sharedRoot.resolve("sessions").resolve("legacy"));
        Files.writeString(dir.resolve(FileSessionStore.DESCRIPTOR),
            "{\"sessionId\":\"legacy\",\"tool\":\"Telemetry\",\"startTime\":\"2024-05-01T09:59:00Z\"}",
            StandardCharsets.UTF_8);

        Session session = storeA.getActiveSession().orElseThrow();
        assertThat(session.sessionId()).isEqualTo("legacy");
        assertThat(session.tool()).isEqualTo(ToolKind.UNKNOWN);
        assertThat(session.isAllInstances()).isTrue();
    }

    @Test
    @DisplayName("Corrupt descriptors are skipped")
    void corruptDescriptorIsSkipped() throws Exception {
        Path dir = Files.createDirectories(sharedRoot.resolve("sessions").resolve("broken"));
        Files.writeString(dir.resolve(FileSessionStore.DESCRIPTOR), "{oops", StandardCharsets.UTF_8);
        Files.createDirectories(sharedRoot.resolve("sessions").resolve("empty"));

        assertThat(storeA.getActiveSession()).isEmpty();
        assertThat(storeA.listSessions()).isEmpty();
        assertThat(storeA.getSession("broken")).isEmpty();
        assertThat(storeA.getSession("../x")).isEmpty();
    }
}
