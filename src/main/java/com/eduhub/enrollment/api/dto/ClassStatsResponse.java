package com.eduhub.enrollment.api.dto;

import com.eduhub.enrollment.domain.model.CapacitySnapshot;
import com.eduhub.enrollment.domain.model.EnrollmentAuditLog.AuditAction;
import com.eduhub.enrollment.domain.model.WaitlistStats;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for a class dashboard: seats, waitlist figures and the
 * last 24 hours of activity.
 *
 * @author Enrollment Team
 */
public class ClassStatsResponse {

    private CapacitySnapshotResponse capacity;
    private long totalWaitlisted;
    private double averageWaitDays;
    private long outstandingOffers;
    private Map<String, Long> recentActivity;

    public ClassStatsResponse() {
    }

    public static ClassStatsResponse from(CapacitySnapshot snapshot, WaitlistStats stats,
                                          Map<AuditAction, Long> recentActivity) {
        ClassStatsResponse response = new ClassStatsResponse();
        response.setCapacity(CapacitySnapshotResponse.fromSnapshot(snapshot));
        response.setTotalWaitlisted(stats.getTotalWaitlisted());
        response.setAverageWaitDays(stats.getAverageWaitDays());
        response.setOutstandingOffers(stats.getOutstandingOffers());

        Map<String, Long> activity = new LinkedHashMap<>();
        recentActivity.forEach((action, count) -> activity.put(action.name(), count));
        response.setRecentActivity(activity);
        return response;
    }

    // Getters and setters
    public CapacitySnapshotResponse getCapacity() {
        return capacity;
    }

    public void setCapacity(CapacitySnapshotResponse capacity) {
        this.capacity = capacity;
    }

    public long getTotalWaitlisted() {
        return totalWaitlisted;
    }

    public void setTotalWaitlisted(long totalWaitlisted) {
        this.totalWaitlisted = totalWaitlisted;
    }

    public double getAverageWaitDays() {
        return averageWaitDays;
    }

    public void setAverageWaitDays(double averageWaitDays) {
        this.averageWaitDays = averageWaitDays;
    }

    public long getOutstandingOffers() {
        return outstandingOffers;
    }

    public void setOutstandingOffers(long outstandingOffers) {
        this.outstandingOffers = outstandingOffers;
    }

    public Map<String, Long> getRecentActivity() {
        return recentActivity;
    }

    public void setRecentActivity(Map<String, Long> recentActivity) {
        this.recentActivity = recentActivity;
    }
}
