package com.fleetdiag.core.exception;

import com.fleetdiag.core.model.ToolKind;

/**
 * Thrown when a session names a diagnostic tool that has no implementation.
 * Fatal for that session only.
 */
public class UnsupportedToolException extends FleetDiagException {
    
    public static final String ERROR_CODE = "UNSUPPORTED_TOOL";
    
    public UnsupportedToolException(ToolKind tool) {
        super(ERROR_CODE, String.format(
            "Diagnostic tool of type %s not found",
            tool
        ));
    }
}
