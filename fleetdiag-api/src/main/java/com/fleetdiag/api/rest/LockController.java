package com.fleetdiag.api.rest;

import com.fleetdiag.core.exception.LockContentionException;
import com.fleetdiag.core.exception.NotFoundException;
import com.fleetdiag.core.lock.OperationLock;
import com.fleetdiag.core.model.LockRecord;
import com.fleetdiag.engine.lock.FencingLockFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * REST API for inspecting and clearing fencing locks.
 */
@RestController
@RequestMapping("/api/v1/locks")
public class LockController {

    private static final Logger log = LoggerFactory.getLogger(LockController.class);

    private final FencingLockFactory lockFactory;
    private final Clock clock;

    public LockController(FencingLockFactory lockFactory, Clock clock) {
        this.lockFactory = lockFactory;
        this.clock = clock;
    }

    @GetMapping("/{resource}")
    public ResponseEntity<LockStatusResponse> getLock(@PathVariable String resource) {
        OperationLock lock = lockFactory.lookup(resource);
        return ResponseEntity.ok(LockStatusResponse.from(lock, clock.instant()));
    }

    /**
     * Release a lock held by this instance. With {@code force=true} the lock is
     * removed whoever holds it.
     */
    @DeleteMapping("/{resource}")
    public ResponseEntity<Map<String, Object>> releaseLock(
            @PathVariable String resource,
            @RequestParam(defaultValue = "false") boolean force) {

        OperationLock lock = lockFactory.lookup(resource);
        if (!lock.isHeld()) {
            throw new NotFoundException("Lock", resource);
        }

        if (force) {
            log.warn("Force-releasing lock {} held by {}", resource,
                lock.lockInfo().map(LockRecord::ownerWorkerId).orElse("unknown"));
            lock.release();
        } else if (!lock.releaseIfOwned()) {
            throw new LockContentionException(resource, lock.getLockMessage());
        }

        return ResponseEntity.ok(Map.of(
            "resource", resource,
            "released", true,
            "forced", force
        ));
    }

    // DTOs

    public record LockStatusResponse(
        String resource,
        boolean held,
        String ownerWorkerId,
        Long ownerProcessId,
        String operationName,
        Instant expiresAt,
        Duration remaining,
        String message
    ) {
        public static LockStatusResponse from(OperationLock lock, Instant now) {
            return lock.lockInfo()
                .map(record -> new LockStatusResponse(
                    lock.resource(),
                    true,
                    record.ownerWorkerId(),
                    record.ownerProcessId(),
                    record.operationName(),
                    record.expiresAt(),
                    record.remainingTime(now),
                    lock.getLockMessage()))
                .orElseGet(() -> new LockStatusResponse(
                    lock.resource(), false, null, null, null, null, null, null));
        }
    }
}
