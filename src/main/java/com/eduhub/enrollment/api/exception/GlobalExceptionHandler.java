package com.eduhub.enrollment.api.exception;

import com.eduhub.enrollment.api.dto.ErrorResponse;
import com.eduhub.enrollment.domain.model.FailureReason;
import com.eduhub.enrollment.exception.EnrollmentRejectedException;
import com.eduhub.enrollment.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the enrollment API.
 * Converts failure results and exceptions into ErrorResponse bodies.
 *
 * @author Enrollment Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle EnrollmentRejectedException.
     * HTTP status follows the failure reason.
     */
    @ExceptionHandler(EnrollmentRejectedException.class)
    public ResponseEntity<ErrorResponse> handleEnrollmentRejectedException(
            EnrollmentRejectedException ex,
            HttpServletRequest request
    ) {
        FailureReason reason = ex.getReason();
        HttpStatus httpStatus = statusFor(reason);

        if (httpStatus.is5xxServerError()) {
            logger.error("Enrollment operation failed: {} - {}", reason, ex.getMessage());
        } else {
            logger.warn("Enrollment operation rejected: {} - {}", reason, ex.getMessage());
        }

        ErrorResponse error = ErrorResponse.of(httpStatus, titleFor(reason), ex.getMessage(), request.getRequestURI())
                .withReason(reason)
                .withDetail("studentId", ex.getStudentId())
                .withDetail("classId", ex.getClassId());

        return ResponseEntity.status(httpStatus).body(error);
    }

    /**
     * Handle ResourceNotFoundException.
     * Returns 404 NOT FOUND when a class or enrollment doesn't exist.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.NOT_FOUND, "Resource Not Found",
                        ex.getMessage(), request.getRequestURI())
                .withDetail("resourceType", ex.getResourceType())
                .withDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Handle IllegalArgumentException.
     * Returns 400 BAD REQUEST for invalid arguments.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Invalid Argument",
                        ex.getMessage(), request.getRequestURI())
                .withReason(FailureReason.VALIDATION_FAILED);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle unreadable request bodies (malformed JSON).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Malformed Request",
                        "Request body could not be read", request.getRequestURI())
                .withReason(FailureReason.VALIDATION_FAILED);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle validation errors from @Valid annotation.
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new HashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Validation Failed",
                        "Request validation failed. Please check the field errors.", request.getRequestURI())
                .withReason(FailureReason.VALIDATION_FAILED)
                .withDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(FailureReason reason) {
        switch (reason) {
            case VALIDATION_FAILED:
            case INVALID_CAPACITY:
                return HttpStatus.BAD_REQUEST;
            case CLASS_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case DUPLICATE_REQUEST:
            case CLASS_ALREADY_EXISTS:
            case NO_OUTSTANDING_OFFER:
            case NO_SEAT_AVAILABLE:
            case WAITLIST_FULL:
                return HttpStatus.CONFLICT;
            case OFFER_EXPIRED:
                return HttpStatus.GONE;
            case STORAGE_FAILURE:
            default:
                return HttpStatus.SERVICE_UNAVAILABLE;
        }
    }

    private static String titleFor(FailureReason reason) {
        switch (reason) {
            case DUPLICATE_REQUEST:
                return "Duplicate Request";
            case CLASS_NOT_FOUND:
                return "Class Not Found";
            case CLASS_ALREADY_EXISTS:
                return "Class Already Exists";
            case NO_OUTSTANDING_OFFER:
                return "No Outstanding Offer";
            case OFFER_EXPIRED:
                return "Offer Expired";
            case NO_SEAT_AVAILABLE:
                return "No Seat Available";
            case INVALID_CAPACITY:
                return "Invalid Capacity";
            case WAITLIST_FULL:
                return "Waitlist Full";
            case STORAGE_FAILURE:
                return "Temporarily Unavailable";
            default:
                return "Invalid Request";
        }
    }
}
