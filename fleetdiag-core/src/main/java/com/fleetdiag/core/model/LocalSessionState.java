package com.fleetdiag.core.model;

/**
 * Where the active session stands from one instance's point of view.
 */
public enum LocalSessionState {
    NO_ACTIVE_SESSION,
    NOT_PARTICIPATING,
    NOT_STARTED,
    RUNNING,
    COMPLETED,
    GLOBALLY_COMPLETE
}
