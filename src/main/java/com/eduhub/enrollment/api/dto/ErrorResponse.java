package com.eduhub.enrollment.api.dto;

import com.eduhub.enrollment.domain.model.FailureReason;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every endpoint of the enrollment API.
 *
 * {@code reason} is the machine-readable {@link FailureReason}; {@code details}
 * names the student, class or fields involved. Both are omitted when empty.
 *
 * @author Enrollment Team
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    private final Instant timestamp = Instant.now();
    private final int status;
    private final String error;
    private final String message;
    private final String path;
    private String reason;
    private final Map<String, Object> details = new LinkedHashMap<>();

    private ErrorResponse(HttpStatus status, String error, String message, String path) {
        this.status = status.value();
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status, error, message, path);
    }

    public ErrorResponse withReason(FailureReason failureReason) {
        this.reason = failureReason.name();
        return this;
    }

    /**
     * Null values are skipped.
     */
    public ErrorResponse withDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }
}
