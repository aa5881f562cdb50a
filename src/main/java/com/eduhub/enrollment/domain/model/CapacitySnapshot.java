package com.eduhub.enrollment.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only view of a class's seats and queue for display.
 * May lag one in-flight operation; never used for admission decisions.
 *
 * @author Enrollment Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapacitySnapshot {

    private String classId;
    private String teacherId;
    private int capacity;
    private int enrolledCount;
    private int availableSeats;
    private long waitlistCount;
    private int waitlistCapacity;
    private long outstandingOffers;

    public static CapacitySnapshot of(ClassCapacity classCapacity, long waitlistCount, long outstandingOffers) {
        return CapacitySnapshot.builder()
                .classId(classCapacity.getClassId())
                .teacherId(classCapacity.getTeacherId())
                .capacity(classCapacity.getCapacity())
                .enrolledCount(classCapacity.getEnrolledCount())
                .availableSeats(classCapacity.getAvailableSeats())
                .waitlistCount(waitlistCount)
                .waitlistCapacity(classCapacity.getWaitlistCapacity() == null
                        ? ClassCapacity.DEFAULT_WAITLIST_CAPACITY : classCapacity.getWaitlistCapacity())
                .outstandingOffers(outstandingOffers)
                .build();
    }
}
