package com.fleetdiag.core.exception;

/**
 * Thrown when shared storage (session directory, lock location, heartbeat files)
 * cannot be read or written.
 */
public class StoreAccessException extends FleetDiagException {
    
    public static final String ERROR_CODE = "STORE_IO";
    
    public StoreAccessException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
