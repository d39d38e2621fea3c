package com.fleetdiag.engine.session;

/**
 * Terminal result of one local collection task.
 */
public enum CollectionOutcome {
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public String tag() {
        return name().toLowerCase();
    }
}
