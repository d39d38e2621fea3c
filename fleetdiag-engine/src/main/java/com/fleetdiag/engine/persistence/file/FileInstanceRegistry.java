package com.fleetdiag.engine.persistence.file;

import com.fleetdiag.core.exception.StoreAccessException;
import com.fleetdiag.core.store.InstanceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Fleet membership from heartbeat files on shared storage.
 * Each instance writes {@code instances/{instanceId}} with the time of its last
 * heartbeat; an instance is live while that time is within the TTL.
 */
public class FileInstanceRegistry implements InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(FileInstanceRegistry.class);

    private final Path instancesRoot;
    private final String localInstanceId;
    private final Clock clock;
    private final Duration ttl;

    public FileInstanceRegistry(Path instancesRoot, String localInstanceId, Clock clock, Duration ttl) {
        if (localInstanceId == null || localInstanceId.isBlank() || localInstanceId.contains("/")
                || localInstanceId.contains("\\") || localInstanceId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid instance id: " + localInstanceId);
        }
        this.instancesRoot = instancesRoot;
        this.localInstanceId = localInstanceId;
        this.clock = clock;
        this.ttl = ttl;
    }

    @Override
    public String localInstanceId() {
        return localInstanceId;
    }

    @Override
    public void heartbeat() {
        try {
            Files.createDirectories(instancesRoot);
            Files.writeString(instancesRoot.resolve(localInstanceId), clock.instant().toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreAccessException("Failed to write heartbeat for " + localInstanceId, e);
        }
    }

    @Override
    public Set<String> liveInstances() {
        Set<String> live = new LinkedHashSet<>();
        live.add(localInstanceId);
        if (!Files.isDirectory(instancesRoot)) {
            return live;
        }

        Instant cutoff = clock.instant().minus(ttl);
        try (Stream<Path> files = Files.list(instancesRoot)) {
            files.filter(Files::isRegularFile).forEach(file -> {
                lastSeen(file)
                    .filter(seen -> !seen.isBefore(cutoff))
                    .ifPresent(seen -> live.add(file.getFileName().toString()));
            });
        } catch (IOException e) {
            throw new StoreAccessException("Failed to list instances under " + instancesRoot, e);
        }
        return live;
    }

    private Optional<Instant> lastSeen(Path file) {
        try {
            return Optional.of(Instant.parse(Files.readString(file, StandardCharsets.UTF_8).trim()));
        } catch (DateTimeParseException e) {
            log.debug("Heartbeat {} unparseable, using modification time", file.getFileName());
            try {
                return Optional.of(Files.getLastModifiedTime(file).toInstant());
            } catch (IOException ex) {
                return Optional.empty();
            }
        } catch (IOException e) {
            // Removed between listing and reading
            return Optional.empty();
        }
    }
}
