package com.eduhub.enrollment.domain.model;

/**
 * State of a waitlist seat offer.
 *
 * @author Enrollment Team
 */
public enum OfferStatus {
    NONE,
    OFFERED,
    ACCEPTED,
    DECLINED,
    EXPIRED
}
