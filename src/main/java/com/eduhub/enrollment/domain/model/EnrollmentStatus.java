package com.eduhub.enrollment.domain.model;

/**
 * Enrollment lifecycle states and their legal transitions.
 *
 * @author Enrollment Team
 */
public enum EnrollmentStatus {

    /**
     * Request received, admission not decided yet.
     */
    PENDING,

    /**
     * Student holds a seat.
     */
    ENROLLED,

    /**
     * Class was full; student is queued.
     */
    WAITLISTED,

    /**
     * Student left the class or the waitlist.
     */
    DROPPED,

    /**
     * Request rejected by policy.
     */
    DENIED;

    public boolean isTerminal() {
        return this == DROPPED || this == DENIED;
    }

    public boolean canTransitionTo(EnrollmentStatus target) {
        switch (this) {
            case PENDING:
                return target == ENROLLED || target == WAITLISTED || target == DENIED;
            case ENROLLED:
                return target == DROPPED;
            case WAITLISTED:
                return target == ENROLLED || target == DROPPED;
            default:
                return false;
        }
    }
}
