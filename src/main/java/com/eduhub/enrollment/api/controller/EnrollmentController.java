package com.eduhub.enrollment.api.controller;

import com.eduhub.enrollment.api.dto.EnrollmentRequest;
import com.eduhub.enrollment.api.dto.EnrollmentResponse;
import com.eduhub.enrollment.api.dto.EnrollmentResultResponse;
import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.exception.EnrollmentRejectedException;
import com.eduhub.enrollment.service.EnrollmentCoordinator;
import com.eduhub.enrollment.service.EnrollmentQueryService;
import com.eduhub.enrollment.service.EnrollmentResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for enrollment requests and drops.
 *
 * @author Enrollment Team
 */
@RestController
@RequestMapping("/api/v1/classes/{classId}/enrollments")
public class EnrollmentController {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentController.class);

    private final EnrollmentCoordinator coordinator;
    private final EnrollmentQueryService queryService;

    public EnrollmentController(
            EnrollmentCoordinator coordinator,
            EnrollmentQueryService queryService
    ) {
        this.coordinator = coordinator;
        this.queryService = queryService;
    }

    /**
     * Request a seat in a class.
     *
     * Returns 201 when the student took a seat directly and 202 when the
     * student was placed on the waitlist.
     *
     * @param classId Class to enroll in
     * @param request studentId and optional justification
     * @return Outcome with status and waitlist position
     */
    @PostMapping
    public ResponseEntity<EnrollmentResultResponse> requestEnrollment(
            @PathVariable String classId,
            @Valid @RequestBody EnrollmentRequest request
    ) {
        logger.info("Enrollment request - student: {}, class: {}", request.getStudentId(), classId);

        EnrollmentResult result = coordinator.requestEnrollment(
                request.getStudentId(),
                classId,
                request.getJustification()
        );
        if (!result.isSuccess()) {
            throw new EnrollmentRejectedException(
                    result.getReason(), result.getMessage(), request.getStudentId(), classId);
        }

        HttpStatus status = result.getStatus() == EnrollmentStatus.ENROLLED
                ? HttpStatus.CREATED
                : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status)
                .body(EnrollmentResultResponse.fromResult(request.getStudentId(), classId, result));
    }

    /**
     * Drop an enrollment or leave the waitlist. Dropping twice is a no-op.
     */
    @DeleteMapping("/{studentId}")
    public ResponseEntity<EnrollmentResultResponse> dropEnrollment(
            @PathVariable String classId,
            @PathVariable String studentId
    ) {
        logger.info("Drop request - student: {}, class: {}", studentId, classId);

        EnrollmentResult result = coordinator.dropEnrollment(studentId, classId);
        if (!result.isSuccess()) {
            throw new EnrollmentRejectedException(result.getReason(), result.getMessage(), studentId, classId);
        }

        return ResponseEntity.ok(EnrollmentResultResponse.fromResult(studentId, classId, result));
    }

    @GetMapping("/{studentId}")
    public ResponseEntity<EnrollmentResponse> getEnrollment(
            @PathVariable String classId,
            @PathVariable String studentId
    ) {
        logger.debug("Fetching enrollment - student: {}, class: {}", studentId, classId);

        return queryService.getEnrollment(studentId, classId)
                .map(EnrollmentResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
