package com.eduhub.enrollment.api.controller;

import com.eduhub.enrollment.api.dto.EnrollmentResultResponse;
import com.eduhub.enrollment.api.dto.WaitlistEntryResponse;
import com.eduhub.enrollment.api.dto.WaitlistInfoResponse;
import com.eduhub.enrollment.api.dto.WaitlistResponseRequest;
import com.eduhub.enrollment.exception.EnrollmentRejectedException;
import com.eduhub.enrollment.service.EnrollmentCoordinator;
import com.eduhub.enrollment.service.EnrollmentQueryService;
import com.eduhub.enrollment.service.EnrollmentResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for waitlist queries and offer responses.
 *
 * @author Enrollment Team
 */
@RestController
@RequestMapping("/api/v1/classes/{classId}/waitlist")
public class WaitlistController {

    private static final Logger logger = LoggerFactory.getLogger(WaitlistController.class);

    private final EnrollmentCoordinator coordinator;
    private final EnrollmentQueryService queryService;

    public WaitlistController(
            EnrollmentCoordinator coordinator,
            EnrollmentQueryService queryService
    ) {
        this.coordinator = coordinator;
        this.queryService = queryService;
    }

    /**
     * Full waitlist of a class, ordered by position.
     */
    @GetMapping
    public ResponseEntity<List<WaitlistEntryResponse>> getWaitlist(@PathVariable String classId) {
        List<WaitlistEntryResponse> entries = queryService.getClassWaitlist(classId)
                .stream()
                .map(WaitlistEntryResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(entries);
    }

    /**
     * Position, offer state and estimated wait for one student.
     */
    @GetMapping("/{studentId}")
    public ResponseEntity<WaitlistInfoResponse> getStudentWaitlistInfo(
            @PathVariable String classId,
            @PathVariable String studentId
    ) {
        return ResponseEntity.ok(
                WaitlistInfoResponse.fromInfo(queryService.getStudentWaitlistInfo(studentId, classId)));
    }

    /**
     * Accept or decline an outstanding seat offer.
     *
     * @param request ACCEPT or DECLINE
     * @return Outcome of the response
     */
    @PostMapping("/{studentId}/response")
    public ResponseEntity<EnrollmentResultResponse> respondToOffer(
            @PathVariable String classId,
            @PathVariable String studentId,
            @Valid @RequestBody WaitlistResponseRequest request
    ) {
        logger.info("Offer response - student: {}, class: {}, response: {}",
                studentId, classId, request.getResponse());

        EnrollmentResult result = coordinator.respondToWaitlistOffer(studentId, classId, request.isAccept());
        if (!result.isSuccess()) {
            throw new EnrollmentRejectedException(result.getReason(), result.getMessage(), studentId, classId);
        }

        return ResponseEntity.ok(EnrollmentResultResponse.fromResult(studentId, classId, result));
    }
}
