package com.fleetdiag.core.exception;

/**
 * Thrown when an operation needs a fencing lock that is currently held elsewhere.
 * The message is the lock's user-facing message.
 */
public class LockContentionException extends FleetDiagException {
    
    public static final String ERROR_CODE = "LOCK_HELD";
    
    private final String resource;
    
    public LockContentionException(String resource, String lockMessage) {
        super(ERROR_CODE, lockMessage);
        this.resource = resource;
    }
    
    public String getResource() {
        return resource;
    }
}
