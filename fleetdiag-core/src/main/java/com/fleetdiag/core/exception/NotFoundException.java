package com.fleetdiag.core.exception;

/**
 * Thrown when a session or lock is not found.
 */
public class NotFoundException extends FleetDiagException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
