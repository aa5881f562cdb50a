package com.eduhub.enrollment.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate figures for one class waitlist.
 *
 * @author Enrollment Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WaitlistStats {

    private String classId;
    private long totalWaitlisted;

    /**
     * Mean time the current entries have been waiting, in days.
     */
    private double averageWaitDays;

    private long outstandingOffers;
}
