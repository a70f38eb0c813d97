package org.terrastories.policy.interfaces.api.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.terrastories.policy.application.exceptions.CulturalAccessException;
import org.terrastories.policy.application.exceptions.DataSovereigntyViolationException;
import org.terrastories.policy.application.exceptions.ResourceNotFoundException;
import org.terrastories.policy.interfaces.api.dto.ErrorResponse;

import java.time.Clock;

/**
 * Translates policy and authentication failures into HTTP responses for the content services.
 *
 * <p>Only the exception's public message is rendered. Reason code and decision detail go to
 * the log and the audit trail. Cross-community access is rendered as a plain 404. Timestamps
 * come from the same clock as audit records.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(CulturalAccessException.class)
    public ResponseEntity<ErrorResponse> handleCulturalAccess(CulturalAccessException ex, HttpServletRequest request) {
        HttpStatus status = ex.getStatus();
        boolean hidden = ex instanceof ResourceNotFoundException;

        if (ex instanceof DataSovereigntyViolationException) {
            log.error("SOVEREIGNTY_BLOCK on {} {}", request.getMethod(), request.getRequestURI());
        } else {
            log.warn("Policy denial on {} {}: reason={} rendered={}",
                request.getMethod(), request.getRequestURI(), ex.getReasonCode(), status.value());
        }

        return respond(status, hidden ? "Not Found" : "Access Denied", ex.getMessage(), request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationException ex, HttpServletRequest request) {
        log.warn("No community session on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", "Authentication required", request);
    }

    /**
     * Unknown role, tier or resource type values.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Rejected input on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Invalid request: " + ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", request);
    }

    private ResponseEntity<ErrorResponse> respond(
            HttpStatus status, String error, String message, HttpServletRequest request) {
        return ResponseEntity.status(status).body(ErrorResponse.of(clock.instant(), status, error, message, request));
    }
}
