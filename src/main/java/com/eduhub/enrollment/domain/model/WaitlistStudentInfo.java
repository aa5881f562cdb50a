package com.eduhub.enrollment.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A student's view of their place in a class waitlist.
 *
 * @author Enrollment Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WaitlistStudentInfo {

    private String studentId;
    private String classId;
    private boolean onWaitlist;

    /**
     * 0 when not on the waitlist.
     */
    private int position;

    private OfferStatus offerStatus;
    private Instant responseDeadline;
    private String estimatedWaitTime;

    public boolean isOfferOutstanding() {
        return offerStatus == OfferStatus.OFFERED;
    }
}
