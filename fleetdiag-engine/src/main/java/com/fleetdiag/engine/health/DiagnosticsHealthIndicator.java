package com.fleetdiag.engine.health;

import com.fleetdiag.core.lock.OperationLock;
import com.fleetdiag.core.model.LockRecord;
import com.fleetdiag.core.model.Session;
import com.fleetdiag.core.store.SessionStore;
import com.fleetdiag.engine.session.SessionOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Health of the diagnostics coordination on this instance.
 * Reports:
 * - Shared storage accessibility (down if not writable)
 * - Active session and local state
 * - Running local collections
 * - Submission lock state
 */
public class DiagnosticsHealthIndicator implements HealthIndicator {

    private final Path sharedRoot;
    private final SessionStore store;
    private final SessionOrchestrator orchestrator;
    private final OperationLock submissionLock;
    private final Clock clock;

    public DiagnosticsHealthIndicator(
            Path sharedRoot,
            SessionStore store,
            SessionOrchestrator orchestrator,
            OperationLock submissionLock,
            Clock clock) {
        this.sharedRoot = sharedRoot;
        this.store = store;
        this.orchestrator = orchestrator;
        this.submissionLock = submissionLock;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("instanceId", orchestrator.instanceId());

        try {
            if (!checkSharedRoot(details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            checkSessions(details);
            checkLock(details);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkSharedRoot(Map<String, Object> details) {
        boolean writable = Files.isDirectory(sharedRoot) && Files.isWritable(sharedRoot);
        details.put("sharedRoot", sharedRoot.toString());
        details.put("sharedRootWritable", writable);
        return writable;
    }

    private void checkSessions(Map<String, Object> details) {
        details.put("activeSession", store.getActiveSession().map(Session::sessionId).orElse("none"));
        details.put("localState", orchestrator.localState().name());
        details.put("runningCollections", orchestrator.runningCount());
        if (orchestrator.isStopped()) {
            details.put("orchestrator", "stopped");
        }
    }

    private void checkLock(Map<String, Object> details) {
        Optional<LockRecord> info = submissionLock.lockInfo();
        details.put("submissionLockHeld", info.isPresent());
        info.ifPresent(record -> {
            details.put("submissionLockOwner", record.ownerWorkerId());
            details.put("submissionLockRemaining", record.remainingTime(clock.instant()).toString());
        });
    }
}
