package com.fleetdiag.core.model;

/**
 * An artifact produced by a diagnostic tool on one instance.
 * Tools only fill {@code fullPath}; the orchestrator stamps the rest before
 * handing the list to the session store.
 */
public record LogFile(
    String instanceId,
    String fullPath,
    String name,
    long size
) {
    public static LogFile of(String fullPath) {
        return new LogFile(null, fullPath, null, 0L);
    }

    public LogFile withDetails(String instanceId, String name, long size) {
        return new LogFile(instanceId, fullPath, name, size);
    }
}
