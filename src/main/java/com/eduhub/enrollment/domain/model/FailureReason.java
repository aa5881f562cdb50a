package com.eduhub.enrollment.domain.model;

/**
 * Why an enrollment operation did not succeed.
 *
 * @author Enrollment Team
 */
public enum FailureReason {

    /**
     * Malformed studentId, classId, capacity or response.
     */
    VALIDATION_FAILED,

    /**
     * The student already has an active enrollment for the class.
     */
    DUPLICATE_REQUEST,

    CLASS_NOT_FOUND,

    CLASS_ALREADY_EXISTS,

    /**
     * Offer response without an outstanding offer.
     */
    NO_OUTSTANDING_OFFER,

    /**
     * Offer accepted after its deadline; handled as an expiry.
     */
    OFFER_EXPIRED,

    /**
     * Offer accepted but the seat was gone (capacity lowered meanwhile).
     */
    NO_SEAT_AVAILABLE,

    /**
     * Class and its waitlist are both full; the request is denied.
     */
    WAITLIST_FULL,

    /**
     * Negative capacity, or capacity below the enrolled count.
     */
    INVALID_CAPACITY,

    /**
     * Persistence error; nothing was changed.
     */
    STORAGE_FAILURE
}
