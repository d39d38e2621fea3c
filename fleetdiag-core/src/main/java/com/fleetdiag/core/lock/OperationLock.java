package com.fleetdiag.core.lock;

import com.fleetdiag.core.model.LockRecord;

import java.util.Optional;

/**
 * Time-bounded mutual exclusion over a named shared resource.
 * Callers on different instances coordinate only through the lock's shared location.
 */
public interface OperationLock {

    /**
     * Try to take the lock without waiting.
     *
     * @param operationName What the holder is about to do, recorded for reporting
     * @return true if the lock was taken, false if it is currently held
     */
    boolean acquire(String operationName);

    /**
     * Take the lock, waiting until it becomes available.
     *
     * @throws UnsupportedOperationException if the implementation cannot wait
     */
    void acquireBlocking(String operationName);

    /**
     * Remove the lock regardless of who holds it.
     * Callers must only release locks they believe they own.
     */
    void release();

    /**
     * Remove the lock only if it was taken by this process.
     *
     * @return true if a lock owned by this process was removed
     */
    boolean releaseIfOwned();

    /**
     * Check if a valid lock is currently held.
     */
    boolean isHeld();

    /**
     * The current valid lock record, if any.
     */
    Optional<LockRecord> lockInfo();

    /**
     * Name of the protected resource.
     */
    String resource();

    /**
     * User-facing reason reported while the lock is held.
     */
    String getLockMessage();

    void setLockMessage(String message);

    /**
     * Prepare any state needed by waiting acquires.
     */
    default void initializeAsyncLocks() {
    }
}
