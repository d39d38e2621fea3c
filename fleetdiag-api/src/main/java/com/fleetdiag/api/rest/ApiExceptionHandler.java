package com.fleetdiag.api.rest;

import com.fleetdiag.core.exception.FleetDiagException;
import com.fleetdiag.core.exception.LockContentionException;
import com.fleetdiag.core.exception.NotFoundException;
import com.fleetdiag.core.exception.SessionAlreadyActiveException;
import com.fleetdiag.core.exception.UnsupportedToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps {@link FleetDiagException} error codes to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    @ExceptionHandler(FleetDiagException.class)
    public ResponseEntity<ErrorResponse> handleFleetDiag(FleetDiagException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]: {}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.debug("Request rejected [{}]: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(INVALID_REQUEST, e.getMessage()));
    }

    static HttpStatus statusFor(String errorCode) {
        return switch (errorCode) {
            case NotFoundException.ERROR_CODE -> HttpStatus.NOT_FOUND;
            case SessionAlreadyActiveException.ERROR_CODE, LockContentionException.ERROR_CODE -> HttpStatus.CONFLICT;
            case UnsupportedToolException.ERROR_CODE -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public record ErrorResponse(String errorCode, String message) {}
}
