package com.fleetdiag.core.exception;

/**
 * Base exception for all fleetdiag errors.
 */
public class FleetDiagException extends RuntimeException {
    
    private final String errorCode;
    
    public FleetDiagException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public FleetDiagException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
