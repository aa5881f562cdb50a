package com.eduhub.enrollment.api.dto;

import com.eduhub.enrollment.domain.model.CapacitySnapshot;

/**
 * Response DTO for a class capacity snapshot.
 *
 * @author Enrollment Team
 */
public class CapacitySnapshotResponse {

    private String classId;
    private String teacherId;
    private int capacity;
    private int enrolledCount;
    private int availableSeats;
    private long waitlistCount;
    private int waitlistCapacity;
    private long outstandingOffers;

    public CapacitySnapshotResponse() {
    }

    public static CapacitySnapshotResponse fromSnapshot(CapacitySnapshot snapshot) {
        CapacitySnapshotResponse response = new CapacitySnapshotResponse();
        response.setClassId(snapshot.getClassId());
        response.setTeacherId(snapshot.getTeacherId());
        response.setCapacity(snapshot.getCapacity());
        response.setEnrolledCount(snapshot.getEnrolledCount());
        response.setAvailableSeats(snapshot.getAvailableSeats());
        response.setWaitlistCount(snapshot.getWaitlistCount());
        response.setWaitlistCapacity(snapshot.getWaitlistCapacity());
        response.setOutstandingOffers(snapshot.getOutstandingOffers());
        return response;
    }

    // Getters and setters
    public String getClassId() {
        return classId;
    }

    public void setClassId(String classId) {
        this.classId = classId;
    }

    public String getTeacherId() {
        return teacherId;
    }

    public void setTeacherId(String teacherId) {
        this.teacherId = teacherId;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public int getEnrolledCount() {
        return enrolledCount;
    }

    public void setEnrolledCount(int enrolledCount) {
        this.enrolledCount = enrolledCount;
    }

    public int getAvailableSeats() {
        return availableSeats;
    }

    public void setAvailableSeats(int availableSeats) {
        this.availableSeats = availableSeats;
    }

    public long getWaitlistCount() {
        return waitlistCount;
    }

    public void setWaitlistCount(long waitlistCount) {
        this.waitlistCount = waitlistCount;
    }

    public int getWaitlistCapacity() {
        return waitlistCapacity;
    }

    public void setWaitlistCapacity(int waitlistCapacity) {
        this.waitlistCapacity = waitlistCapacity;
    }

    public long getOutstandingOffers() {
        return outstandingOffers;
    }

    public void setOutstandingOffers(long outstandingOffers) {
        this.outstandingOffers = outstandingOffers;
    }
}
