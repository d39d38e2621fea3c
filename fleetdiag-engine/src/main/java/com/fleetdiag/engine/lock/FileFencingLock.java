package com.fleetdiag.engine.lock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fleetdiag.core.exception.StoreAccessException;
import com.fleetdiag.core.lock.OperationLock;
import com.fleetdiag.core.model.LockRecord;
import com.fleetdiag.engine.json.Jsons;
import com.fleetdiag.engine.logging.LoggingContext;
import com.fleetdiag.engine.metrics.SessionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Fencing lock backed by a directory on storage shared by the whole fleet.
 *
 * Layout: {@code <locksRoot>/<resource>/info.lock} holds a JSON {@link LockRecord}.
 * The lock is held iff the directory exists, the record parses and has not expired.
 * Observing a missing, corrupt or expired record reclaims the directory.
 *
 * Directory creation is the atomic step of an acquire: of two acquirers racing past
 * the availability check, only one creates the directory. The record is written to a
 * temporary file and renamed into place so readers never parse a partial record.
 * A reader that still finds no parseable record waits {@code settleDelay} once
 * before reclaiming, to let a concurrent acquirer finish writing.
 *
 * Reclaiming a stale record, and releasing an owned one, first claims
 * {@code info.lock} with an atomic rename. Only the record that was judged is ever
 * removed, never a fresh lock that replaced it in the meantime.
 *
 * Release is not owner-checked; use {@link #releaseIfOwned()} when the caller may
 * not be the holder.
 */
public class FileFencingLock implements OperationLock {

    private static final Logger log = LoggerFactory.getLogger(FileFencingLock.class);

    public static final String INFO_FILE = "info.lock";
    public static final String DEFAULT_MESSAGE =
        "An operation is already in progress. Please try again when it completes.";
    public static final Duration DEFAULT_SETTLE_DELAY = Duration.ofSeconds(1);

    private final String resource;
    private final Path lockDir;
    private final Path infoFile;
    private final String workerId;
    private final Clock clock;
    private final Duration timeout;
    private final Duration settleDelay;
    private final SessionMetrics metrics;
    private volatile String message;

    public FileFencingLock(Path locksRoot, String resource, String workerId, Clock clock) {
        this(locksRoot, resource, workerId, clock, LockRecord.DEFAULT_TIMEOUT, DEFAULT_SETTLE_DELAY, new SessionMetrics());
    }

    public FileFencingLock(
            Path locksRoot,
            String resource,
            String workerId,
            Clock clock,
            Duration timeout,
            Duration settleDelay,
            SessionMetrics metrics) {
        if (resource == null || resource.isBlank() || resource.contains("/") || resource.contains("\\")
                || resource.startsWith(".")) {
            throw new IllegalArgumentException("Invalid lock resource name: " + resource);
        }
        this.resource = resource;
        this.lockDir = locksRoot.resolve(resource);
        this.infoFile = lockDir.resolve(INFO_FILE);
        this.workerId = workerId;
        this.clock = clock;
        this.timeout = timeout;
        this.settleDelay = settleDelay;
        this.metrics = metrics;
    }

    @Override
    public boolean acquire(String operationName) {
        try (var ctx = LoggingContext.forLock(resource, operationName)) {
            if (isHeld()) {
                log.info("Lock {} already held, not acquiring for {}", resource, operationName);
                metrics.lockAcquired(resource, false);
                return false;
            }

            try {
                Files.createDirectories(lockDir.getParent());
                Files.createDirectory(lockDir);
            } catch (FileAlreadyExistsException e) {
                log.info("Lock {} was taken concurrently, not acquiring for {}", resource, operationName);
                metrics.lockAcquired(resource, false);
                return false;
            } catch (IOException e) {
                throw new StoreAccessException("Failed to create lock directory " + lockDir, e);
            }

            LockRecord record = LockRecord.create(workerId, operationName, clock.instant(), timeout);
            try {
                writeRecord(record);
            } catch (FileAlreadyExistsException | NoSuchFileException e) {
                log.info("Lock {} was taken over while writing, not acquiring for {}", resource, operationName);
                metrics.lockAcquired(resource, false);
                return false;
            } catch (IOException e) {
                removeIfEmpty();
                throw new StoreAccessException("Failed to write lock record " + infoFile, e);
            }

            log.info("Acquired lock {} for {} until {}", resource, operationName, record.expiresAt());
            metrics.lockAcquired(resource, true);
            return true;
        }
    }

    /**
     * Waiting acquire is not supported by the file lock.
     */
    @Override
    public void acquireBlocking(String operationName) {
        throw new UnsupportedOperationException(
            "Blocking acquire is not implemented for file fencing locks; use acquire() and retry");
    }

    @Override
    public void release() {
        if (Files.isDirectory(lockDir)) {
            log.info("Releasing lock {}", resource);
            deleteLocation();
        } else {
            log.warn("Release requested for lock {} but no lock is held", resource);
        }
    }

    @Override
    public boolean releaseIfOwned() {
        Optional<String> raw = readRaw(infoFile);
        Optional<LockRecord> record = raw.flatMap(this::parse);
        if (record.isEmpty()) {
            log.warn("Release requested for lock {} but no readable lock is held", resource);
            return false;
        }
        if (!record.get().isOwnedBy(ProcessHandle.current().pid(), workerId)) {
            log.warn("Not releasing lock {}: held by worker {} pid {}",
                resource, record.get().ownerWorkerId(), record.get().ownerProcessId());
            return false;
        }
        if (!claimRecord(raw.get())) {
            log.warn("Lock {} changed before it could be released", resource);
            return false;
        }
        log.info("Releasing owned lock {}", resource);
        deleteLocation();
        return true;
    }

    @Override
    public boolean isHeld() {
        return readValidRecord().isPresent();
    }

    @Override
    public Optional<LockRecord> lockInfo() {
        return readValidRecord();
    }

    @Override
    public String resource() {
        return resource;
    }

    @Override
    public String getLockMessage() {
        String current = message;
        if (current == null || current.isEmpty()) {
            return DEFAULT_MESSAGE;
        }
        return current;
    }

    @Override
    public void setLockMessage(String message) {
        this.message = message;
    }

    Path lockDirectory() {
        return lockDir;
    }

    /**
     * Evaluate the lock, reclaiming the location if it is corrupt or expired.
     *
     * A stale record is only removed after this caller has claimed it, by renaming
     * {@code info.lock} aside and checking it is still the record judged stale. A caller
     * that loses the claim, or finds a different record, leaves the location alone.
     */
    private Optional<LockRecord> readValidRecord() {
        if (!Files.isDirectory(lockDir)) {
            return Optional.empty();
        }

        Optional<String> raw = readRaw(infoFile);
        Optional<LockRecord> record = raw.flatMap(this::parse);
        if (record.isEmpty()) {
            // May be mid-write by another acquirer; give it one settle period
            settle();
            if (!Files.isDirectory(lockDir)) {
                return Optional.empty();
            }
            raw = readRaw(infoFile);
            record = raw.flatMap(this::parse);
        }

        if (record.isEmpty()) {
            if (raw.isEmpty()) {
                return reclaimEmptyLocation();
            }
            if (!claimRecord(raw.get())) {
                return currentValidRecord();
            }
            log.warn("Lock {} has no valid record, reclaiming", resource);
            deleteLocation();
            metrics.lockReclaimed(resource, "corrupt");
            return Optional.empty();
        }

        if (!record.get().isValidAt(clock.instant())) {
            if (!claimRecord(raw.get())) {
                return currentValidRecord();
            }
            log.info("Lock {} held by {} for {} expired at {}, reclaiming",
                resource, record.get().ownerWorkerId(), record.get().operationName(), record.get().expiresAt());
            deleteLocation();
            metrics.lockReclaimed(resource, "expired");
            return Optional.empty();
        }

        return record;
    }

    /**
     * Re-read without reclaiming, after another caller got to a stale record first.
     */
    private Optional<LockRecord> currentValidRecord() {
        return readRecord().filter(r -> r.isValidAt(clock.instant()));
    }

    /**
     * Take {@code info.lock} out of the location if it still has the given content.
     * The rename succeeds for exactly one caller; a claimed record that turns out to
     * differ from {@code expected} is put back.
     *
     * @return true if this caller now owns the stale location
     */
    private boolean claimRecord(String expected) {
        Path claimed = lockDir.resolve(INFO_FILE + "." + UUID.randomUUID() + ".claimed");
        try {
            Files.move(infoFile, claimed, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            log.debug("Lock {} record already claimed by another caller", resource);
            return false;
        } catch (IOException e) {
            throw new StoreAccessException("Failed to claim lock record " + infoFile, e);
        }

        if (readRaw(claimed).filter(expected::equals).isPresent()) {
            return true;
        }

        log.info("Lock {} was re-acquired while being reclaimed, restoring its record", resource);
        try {
            Files.move(claimed, infoFile);
        } catch (IOException e) {
            throw new StoreAccessException("Failed to restore lock record " + infoFile, e);
        }
        return false;
    }

    /**
     * Reclaim a directory that still has no record after the settle delay. If a record
     * landed in it just before it was moved aside, the directory is put back.
     */
    private Optional<LockRecord> reclaimEmptyLocation() {
        Path tombstone = tombstone();
        try {
            Files.move(lockDir, tombstone, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreAccessException("Failed to reclaim lock location " + lockDir, e);
        }

        Optional<LockRecord> late = readRaw(tombstone.resolve(INFO_FILE))
            .flatMap(this::parse)
            .filter(r -> r.isValidAt(clock.instant()));
        if (late.isPresent()) {
            try {
                Files.move(tombstone, lockDir);
                return late;
            } catch (IOException e) {
                log.error("Lock {} written by {} could not be restored: {}",
                    resource, late.get().ownerWorkerId(), e.getMessage());
            }
        }

        log.warn("Lock {} has no record, reclaiming", resource);
        deleteRecursively(tombstone);
        metrics.lockReclaimed(resource, "corrupt");
        return Optional.empty();
    }

    private Optional<LockRecord> readRecord() {
        return readRaw(infoFile).flatMap(this::parse);
    }

    private Optional<String> readRaw(Path file) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Failed to read lock record {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parse a record. Unparseable or incomplete records read as empty.
     */
    private Optional<LockRecord> parse(String json) {
        try {
            LockRecord record = Jsons.mapper().readValue(json, LockRecord.class);
            if (record == null || record.expiresAt() == null || record.ownerWorkerId() == null) {
                log.warn("Lock record {} is incomplete", infoFile);
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (JsonProcessingException e) {
            log.warn("Lock record {} is corrupt: {}", infoFile, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Write the record next to its final name, then rename it into place. The rename
     * does not replace an existing record, so of two writers racing into the same
     * directory only the first succeeds.
     */
    private void writeRecord(LockRecord record) throws IOException {
        Path tmp = lockDir.resolve(INFO_FILE + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tmp, Jsons.toJson(record), StandardCharsets.UTF_8);
        try {
            Files.move(tmp, infoFile);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    private void removeIfEmpty() {
        try {
            Files.deleteIfExists(lockDir);
        } catch (IOException e) {
            log.debug("Leaving lock location {} for reclaim: {}", lockDir, e.getMessage());
        }
    }

    private Path tombstone() {
        return lockDir.resolveSibling("." + resource + "." + UUID.randomUUID() + ".reclaimed");
    }

    /**
     * Remove the lock directory. It is first renamed aside so it disappears from the
     * well-known location in one step, then deleted.
     */
    private void deleteLocation() {
        Path tombstone = tombstone();
        try {
            Files.move(lockDir, tombstone, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException e) {
            return;
        } catch (IOException e) {
            log.debug("Could not rename lock {} aside ({}), deleting in place", resource, e.getMessage());
            tombstone = lockDir;
        }
        deleteRecursively(tombstone);
    }

    private void deleteRecursively(Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new StoreAccessException("Failed to delete " + p, e);
                }
            });
        } catch (NoSuchFileException e) {
            // already gone
        } catch (IOException e) {
            throw new StoreAccessException("Failed to delete lock location " + root, e);
        }
    }

    private void settle() {
        if (settleDelay.isZero() || settleDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(settleDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
