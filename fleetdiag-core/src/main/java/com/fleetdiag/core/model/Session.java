package com.fleetdiag.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A fleet-wide diagnostic collection job.
 * Owned by the session store; instances only read it and mutate it through the store.
 *
 * Primary Key: sessionId
 *
 * Invariants:
 * - At most one session is active (not complete) at a time
 * - complete goes false -> true exactly once
 * - completedInstances is a subset of startedInstances for well-behaved instances,
 *   but readers must not rely on it (a crashed writer may leave either set partial)
 */
public record Session(
    String sessionId,

    // What to run
    ToolKind tool,
    String toolParameters,

    // Participation scope: empty means every instance
    List<String> instances,

    // Timing
    Instant startTime,
    Instant endTime,

    // Per-instance progress
    Set<String> startedInstances,
    Set<String> completedInstances,

    boolean complete,

    // Collected artifacts
    List<LogFile> logs
) {
    public Session {
        instances = instances == null ? List.of() : List.copyOf(instances);
        startedInstances = startedInstances == null ? Set.of() : Set.copyOf(startedInstances);
        completedInstances = completedInstances == null ? Set.of() : Set.copyOf(completedInstances);
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    /**
     * Create a new active session from a client request.
     */
    public static Session create(SessionRequest request, Instant now) {
        return new Session(
            UUID.randomUUID().toString(),
            request.tool(),
            request.toolParameters(),
            request.instances(),
            now,
            null,
            Set.of(),
            Set.of(),
            false,
            List.of()
        );
    }

    /**
     * Check if every instance of the fleet is in scope.
     */
    @JsonIgnore
    public boolean isAllInstances() {
        return instances.isEmpty();
    }

    /**
     * Check if the given instance is expected to collect for this session.
     */
    public boolean includes(String instanceId) {
        return isAllInstances() || instances.stream().anyMatch(i -> i.equalsIgnoreCase(instanceId));
    }

    /**
     * Instances whose completion is required before the session can complete.
     * For an all-instances session this is every live instance plus every instance
     * that has already started, so a participant cannot drop out of the set by
     * going quiet mid-collection.
     */
    public Set<String> requiredInstances(Set<String> liveInstances) {
        if (!isAllInstances()) {
            return new LinkedHashSet<>(instances);
        }
        Set<String> required = new LinkedHashSet<>(liveInstances);
        required.addAll(startedInstances);
        return required;
    }

    /**
     * Check if every required instance has reported completion.
     */
    public boolean allCollected(Set<String> liveInstances) {
        Set<String> required = requiredInstances(liveInstances);
        if (required.isEmpty()) {
            return false;
        }
        return required.stream().allMatch(this::hasCompleted);
    }

    public boolean hasStarted(String instanceId) {
        return startedInstances.stream().anyMatch(i -> i.equalsIgnoreCase(instanceId));
    }

    public boolean hasCompleted(String instanceId) {
        return completedInstances.stream().anyMatch(i -> i.equalsIgnoreCase(instanceId));
    }

    /**
     * Time elapsed since the session started.
     */
    public Duration age(Instant now) {
        return Duration.between(startTime, now);
    }

    public Session withStarted(String instanceId) {
        Set<String> started = new LinkedHashSet<>(startedInstances);
        started.add(instanceId);
        return new Session(sessionId, tool, toolParameters, instances, startTime, endTime,
            started, completedInstances, complete, logs);
    }

    public Session withCompleted(String instanceId) {
        Set<String> completed = new LinkedHashSet<>(completedInstances);
        completed.add(instanceId);
        return new Session(sessionId, tool, toolParameters, instances, startTime, endTime,
            startedInstances, completed, complete, logs);
    }

    public Session withLogs(List<LogFile> added) {
        List<LogFile> all = new ArrayList<>(logs);
        all.addAll(added);
        return new Session(sessionId, tool, toolParameters, instances, startTime, endTime,
            startedInstances, completedInstances, complete, all);
    }

    public Session withComplete(Instant completedAt) {
        return new Session(sessionId, tool, toolParameters, instances, startTime, completedAt,
            startedInstances, completedInstances, true, logs);
    }
}
