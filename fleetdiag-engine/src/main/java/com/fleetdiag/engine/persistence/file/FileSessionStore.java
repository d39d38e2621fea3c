package com.fleetdiag.engine.persistence.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fleetdiag.core.exception.LockContentionException;
import com.fleetdiag.core.exception.NotFoundException;
import com.fleetdiag.core.exception.SessionAlreadyActiveException;
import com.fleetdiag.core.exception.StoreAccessException;
import com.fleetdiag.core.lock.OperationLock;
import com.fleetdiag.core.model.LogFile;
import com.fleetdiag.core.model.Session;
import com.fleetdiag.core.model.SessionRequest;
import com.fleetdiag.core.store.InstanceRegistry;
import com.fleetdiag.core.store.SessionStore;
import com.fleetdiag.engine.json.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Session store on a directory shared by every instance of the fleet.
 *
 * <pre>
 * sessions/
 *   {sessionId}/
 *     session.json          immutable descriptor, written once at submission
 *     started/{instanceId}  marker, written by that instance
 *     completed/{instanceId}
 *     logs/{instanceId}.json artifacts of that instance
 *     complete.json         created once, marks the session complete
 * </pre>
 *
 * Each instance only writes its own marker and log files, so instances never
 * contend on a file. Completion uses {@code CREATE_NEW}, making it take effect once.
 * Submission is serialized across the fleet by the given fencing lock.
 */
public class FileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSessionStore.class);

    static final String DESCRIPTOR = "session.json";
    static final String COMPLETE_MARKER = "complete.json";
    static final String STARTED_DIR = "started";
    static final String COMPLETED_DIR = "completed";
    static final String LOGS_DIR = "logs";

    public static final String SUBMIT_OPERATION = "submit-session";

    private static final TypeReference<List<LogFile>> LOG_LIST = new TypeReference<>() {
    };

    private final Path sessionsRoot;
    private final InstanceRegistry registry;
    private final OperationLock submissionLock;
    private final Clock clock;

    public FileSessionStore(Path sessionsRoot, InstanceRegistry registry, OperationLock submissionLock, Clock clock) {
        this.sessionsRoot = sessionsRoot;
        this.registry = registry;
        this.submissionLock = submissionLock;
        this.clock = clock;
    }

    @Override
    public Optional<Session> getActiveSession() {
        return loadAll().stream()
            .filter(s -> !s.complete())
            .max(Comparator.comparing(Session::startTime));
    }

    @Override
    public boolean shouldCollectOnThisInstance(Session session) {
        return session.includes(registry.localInstanceId());
    }

    @Override
    public boolean hasThisInstanceCollected(Session session) {
        return Files.exists(markerFile(session, COMPLETED_DIR));
    }

    @Override
    public void markInstanceStarted(Session session) {
        writeMarker(markerFile(session, STARTED_DIR));
    }

    @Override
    public void markInstanceComplete(Session session) {
        writeMarker(markerFile(session, COMPLETED_DIR));
    }

    @Override
    public boolean allInstancesCollected(Session session) {
        return load(sessionDir(session.sessionId()))
            .map(s -> s.allCollected(registry.liveInstances()))
            .orElse(false);
    }

    @Override
    public boolean markSessionComplete(Session session) {
        Path marker = sessionDir(session.sessionId()).resolve(COMPLETE_MARKER);
        String json = Jsons.toJson(new CompletionMarker(clock.instant(), registry.localInstanceId()));
        try {
            Files.writeString(marker, json, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debug("Session {} already complete", session.sessionId());
            return false;
        } catch (NoSuchFileException e) {
            throw new NotFoundException("Session", session.sessionId());
        } catch (IOException e) {
            throw new StoreAccessException("Failed to mark session " + session.sessionId() + " complete", e);
        }
    }

    @Override
    public void addLogs(Session session, List<LogFile> logs) {
        if (logs.isEmpty()) {
            return;
        }
        Path file = sessionDir(session.sessionId()).resolve(LOGS_DIR)
            .resolve(instanceFileName(registry.localInstanceId()) + ".json");
        List<LogFile> all = new ArrayList<>(readLogs(file));
        all.addAll(logs);
        try {
            Files.createDirectories(file.getParent());
            writeAtomically(file, Jsons.toJson(all));
        } catch (IOException e) {
            throw new StoreAccessException("Failed to write logs for session " + session.sessionId(), e);
        }
    }

    @Override
    public Session submitSession(SessionRequest request) {
        if (!submissionLock.acquire(SUBMIT_OPERATION)) {
            throw new LockContentionException(submissionLock.resource(), submissionLock.getLockMessage());
        }
        try {
            Optional<Session> active = getActiveSession();
            if (active.isPresent()) {
                throw new SessionAlreadyActiveException(active.get().sessionId());
            }

            Session session = Session.create(request, clock.instant());
            Path dir = sessionDir(session.sessionId());
            Files.createDirectories(dir);
            writeAtomically(dir.resolve(DESCRIPTOR), Jsons.toJson(session));
            log.info("Submitted session {} for tool {} on {}", session.sessionId(), session.tool(),
                session.isAllInstances() ? "all instances" : session.instances());
            return session;
        } catch (IOException e) {
            throw new StoreAccessException("Failed to write new session", e);
        } finally {
            submissionLock.releaseIfOwned();
        }
    }

    @Override
    public Optional<Session> getSession(String sessionId) {
        if (!isSafeName(sessionId)) {
            return Optional.empty();
        }
        return load(sessionDir(sessionId));
    }

    @Override
    public List<Session> listSessions() {
        return loadAll().stream()
            .sorted(Comparator.comparing(Session::startTime).reversed())
            .collect(Collectors.toList());
    }

    public Path sessionsRoot() {
        return sessionsRoot;
    }

    // ========== Reading ==========

    private List<Session> loadAll() {
        if (!Files.isDirectory(sessionsRoot)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(sessionsRoot)) {
            return dirs.filter(Files::isDirectory)
                .map(this::load)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreAccessException("Failed to list sessions under " + sessionsRoot, e);
        }
    }

    /**
     * Assemble a session from its descriptor and the per-instance files.
     * A directory without a readable descriptor is skipped.
     */
    private Optional<Session> load(Path dir) {
        Path descriptor = dir.resolve(DESCRIPTOR);
        Session base;
        try {
            base = Jsons.mapper().readValue(Files.readString(descriptor, StandardCharsets.UTF_8), Session.class);
        } catch (NoSuchFileException e) {
            log.debug("Skipping {}: no descriptor", dir);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Skipping session {}: unreadable descriptor ({})", dir.getFileName(), e.getMessage());
            return Optional.empty();
        }
        if (base == null || base.sessionId() == null || base.startTime() == null) {
            log.warn("Skipping session {}: incomplete descriptor", dir.getFileName());
            return Optional.empty();
        }

        Set<String> started = listNames(dir.resolve(STARTED_DIR));
        Set<String> completed = listNames(dir.resolve(COMPLETED_DIR));
        List<LogFile> logs = readAllLogs(dir.resolve(LOGS_DIR));

        Path completeMarker = dir.resolve(COMPLETE_MARKER);
        boolean complete = Files.exists(completeMarker);
        Instant endTime = complete ? readEndTime(completeMarker) : null;

        return Optional.of(new Session(
            base.sessionId(),
            base.tool(),
            base.toolParameters(),
            base.instances(),
            base.startTime(),
            endTime,
            started,
            completed,
            complete,
            logs
        ));
    }

    private Set<String> listNames(Path dir) {
        if (!Files.isDirectory(dir)) {
            return Set.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                .filter(name -> !name.endsWith(".tmp"))
                .collect(Collectors.toSet());
        } catch (IOException e) {
            throw new StoreAccessException("Failed to list " + dir, e);
        }
    }

    private List<LogFile> readAllLogs(Path logsDir) {
        if (!Files.isDirectory(logsDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(logsDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json"))
                .sorted()
                .flatMap(p -> readLogs(p).stream())
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StoreAccessException("Failed to list " + logsDir, e);
        }
    }

    private List<LogFile> readLogs(Path file) {
        try {
            return Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), LOG_LIST);
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            log.warn("Ignoring unreadable log list {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    private Instant readEndTime(Path marker) {
        try {
            CompletionMarker completion = Jsons.mapper()
                .readValue(Files.readString(marker, StandardCharsets.UTF_8), CompletionMarker.class);
            return completion != null ? completion.endTime() : null;
        } catch (IOException e) {
            // Marker is still being written
            return null;
        }
    }

    // ========== Writing ==========

    private void writeMarker(Path marker) {
        try {
            Files.createDirectories(marker.getParent());
            Files.writeString(marker, clock.instant().toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreAccessException("Failed to write marker " + marker, e);
        }
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path markerFile(Session session, String kind) {
        return sessionDir(session.sessionId()).resolve(kind).resolve(instanceFileName(registry.localInstanceId()));
    }

    private Path sessionDir(String sessionId) {
        return sessionsRoot.resolve(sessionId);
    }

    private static String instanceFileName(String instanceId) {
        if (!isSafeName(instanceId)) {
            throw new IllegalArgumentException("Instance id cannot be used as a file name: " + instanceId);
        }
        return instanceId;
    }

    private static boolean isSafeName(String name) {
        return name != null && !name.isBlank() && !name.startsWith(".")
            && !name.contains("/") && !name.contains("\\");
    }

    /**
     * Contents of {@code complete.json}.
     */
    public record CompletionMarker(Instant endTime, String completedBy) {
    }
}
