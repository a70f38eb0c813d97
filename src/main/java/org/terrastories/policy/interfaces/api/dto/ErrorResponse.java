package org.terrastories.policy.interfaces.api.dto;

import jakarta.servlet.http.HttpServletRequest;
import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Error body for rejected requests.
 *
 * <p>Carries the public message only. Reason codes and decision details never appear here.
 */
@Value
@Builder
public class ErrorResponse {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    /** Propagated from the caller when present, so the audit trail and the response correlate. */
    String requestId;
    Instant timestamp;
    int status;
    String error;
    String message;
    String path;

    public static ErrorResponse of(
            Instant timestamp, HttpStatus status, String error, String message, HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        return ErrorResponse.builder()
            .requestId(requestId != null && !requestId.isBlank() ? requestId : UUID.randomUUID().toString())
            .timestamp(timestamp)
            .status(status.value())
            .error(error)
            .message(message)
            .path(request.getRequestURI())
            .build();
    }
}
