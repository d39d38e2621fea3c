package com.fleetdiag.core.tool;

/**
 * Exception thrown by diagnostic tools on failure.
 */
public class DiagnosticToolException extends Exception {
    
    public static final String CANCELLED = "CANCELLED";
    public static final String TIMED_OUT = "TIMED_OUT";
    public static final String EXIT_CODE = "EXIT_CODE";
    public static final String LAUNCH_FAILED = "LAUNCH_FAILED";
    public static final String INVALID_PARAMETERS = "INVALID_PARAMETERS";
    public static final String NO_ARTIFACTS = "NO_ARTIFACTS";
    
    private final String errorCode;
    
    public DiagnosticToolException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public DiagnosticToolException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
    
    public boolean isCancellation() {
        return CANCELLED.equals(errorCode);
    }
    
    public static DiagnosticToolException cancelled(String message) {
        return new DiagnosticToolException(CANCELLED, message);
    }
}
