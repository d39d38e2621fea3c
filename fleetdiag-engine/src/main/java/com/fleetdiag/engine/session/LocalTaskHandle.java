package com.fleetdiag.engine.session;

import com.fleetdiag.core.tool.CancellationSignal;

import java.time.Instant;
import java.util.concurrent.Future;

/**
 * A collection task running on this instance for one session.
 * Local to the orchestrator; never persisted.
 */
public record LocalTaskHandle(
    String sessionId,
    Future<CollectionOutcome> task,
    CancellationSignal cancellation,
    Instant startedAt
) {
    /**
     * Check if the task has finished, whatever the outcome.
     */
    public boolean isTerminal() {
        return task.isDone();
    }

    /**
     * Ask the tool to stop. The task stays tracked until it actually finishes.
     */
    public void cancel() {
        cancellation.cancel();
    }
}
