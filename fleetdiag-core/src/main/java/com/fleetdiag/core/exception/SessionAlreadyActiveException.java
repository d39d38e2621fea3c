package com.fleetdiag.core.exception;

/**
 * Thrown when a session is submitted while another one is still active.
 */
public class SessionAlreadyActiveException extends FleetDiagException {
    
    public static final String ERROR_CODE = "SESSION_ALREADY_ACTIVE";
    
    private final String activeSessionId;
    
    public SessionAlreadyActiveException(String activeSessionId) {
        super(ERROR_CODE, String.format(
            "Session %s is still active; only one session may run at a time",
            activeSessionId
        ));
        this.activeSessionId = activeSessionId;
    }
    
    public String getActiveSessionId() {
        return activeSessionId;
    }
}
