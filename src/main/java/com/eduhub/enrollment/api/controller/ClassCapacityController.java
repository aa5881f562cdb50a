package com.eduhub.enrollment.api.controller;

import com.eduhub.enrollment.api.dto.CapacityRequest;
import com.eduhub.enrollment.api.dto.CapacitySnapshotResponse;
import com.eduhub.enrollment.api.dto.ClassStatsResponse;
import com.eduhub.enrollment.api.dto.CreateClassRequest;
import com.eduhub.enrollment.domain.model.CapacitySnapshot;
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
 * REST controller for class capacity management.
 * Creating classes, reading snapshots and adjusting capacity.
 *
 * @author Enrollment Team
 */
@RestController
@RequestMapping("/api/v1/classes")
public class ClassCapacityController {

    private static final Logger logger = LoggerFactory.getLogger(ClassCapacityController.class);

    private final EnrollmentCoordinator coordinator;
    private final EnrollmentQueryService queryService;

    public ClassCapacityController(
            EnrollmentCoordinator coordinator,
            EnrollmentQueryService queryService
    ) {
        this.coordinator = coordinator;
        this.queryService = queryService;
    }

    /**
     * Register a class with its initial capacity.
     *
     * @param request classId, capacity, optional waitlistCapacity and teacherId
     * @return Snapshot of the new class
     */
    @PostMapping
    public ResponseEntity<CapacitySnapshotResponse> createClass(
            @Valid @RequestBody CreateClassRequest request
    ) {
        logger.info("Creating class {} with capacity {}", request.getClassId(), request.getCapacity());

        EnrollmentResult result = coordinator.createClass(
                request.getClassId(),
                request.getCapacity(),
                request.getWaitlistCapacity(),
                request.getTeacherId()
        );
        if (!result.isSuccess()) {
            throw new EnrollmentRejectedException(result.getReason(), result.getMessage(), null, request.getClassId());
        }

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CapacitySnapshotResponse.fromSnapshot(result.getSnapshot()));
    }

    /**
     * Current capacity, enrolled count and waitlist depth for a class.
     */
    @GetMapping("/{classId}/capacity")
    public ResponseEntity<CapacitySnapshotResponse> getCapacity(@PathVariable String classId) {
        logger.debug("Fetching capacity snapshot for class: {}", classId);

        CapacitySnapshot snapshot = queryService.getSnapshot(classId);
        return ResponseEntity.ok(CapacitySnapshotResponse.fromSnapshot(snapshot));
    }

    /**
     * Change the capacity of a class. Raising it offers freed seats to the waitlist.
     * Lowering it never removes enrolled students.
     */
    @PutMapping("/{classId}/capacity")
    public ResponseEntity<CapacitySnapshotResponse> adjustCapacity(
            @PathVariable String classId,
            @Valid @RequestBody CapacityRequest request
    ) {
        logger.info("Adjusting capacity of class {} to {}", classId, request.getCapacity());

        EnrollmentResult result = coordinator.adjustCapacity(classId, request.getCapacity());
        if (!result.isSuccess()) {
            throw new EnrollmentRejectedException(result.getReason(), result.getMessage(), null, classId);
        }

        return ResponseEntity.ok(CapacitySnapshotResponse.fromSnapshot(result.getSnapshot()));
    }

    @GetMapping("/{classId}/stats")
    public ResponseEntity<ClassStatsResponse> getStats(@PathVariable String classId) {
        CapacitySnapshot snapshot = queryService.getSnapshot(classId);
        ClassStatsResponse response = ClassStatsResponse.from(
                snapshot,
                queryService.getWaitlistStats(classId),
                queryService.getRecentActivity(classId)
        );
        return ResponseEntity.ok(response);
    }
}
