package com.fleetdiag.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Contents of a fencing lock location.
 * 
 * Invariants:
 * - Written once by the acquirer, never mutated
 * - The lock is held only while expiresAt is in the future
 */
public record LockRecord(
    // Ownership
    long ownerProcessId,
    long ownerThreadId,
    String ownerWorkerId,
    
    String operationName,
    
    // Absolute UTC expiry
    Instant expiresAt
) {
    /**
     * Default time-to-live of a lock: 20 minutes.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(20);

    /**
     * Create a record owned by the current process and thread.
     */
    public static LockRecord create(String workerId, String operationName, Instant now, Duration timeout) {
        return new LockRecord(
            ProcessHandle.current().pid(),
            Thread.currentThread().getId(),
            workerId,
            operationName,
            now.plus(timeout)
        );
    }

    /**
     * Check if the lock is still held at the given instant.
     */
    public boolean isValidAt(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }

    /**
     * Get the remaining time on this lock.
     */
    public Duration remainingTime(Instant now) {
        if (expiresAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Check if this record was written by the given process of the given worker.
     */
    public boolean isOwnedBy(long processId, String workerId) {
        return ownerProcessId == processId
            && ownerWorkerId != null
            && ownerWorkerId.equals(workerId);
    }
}
