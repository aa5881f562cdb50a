package com.eduhub.enrollment.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One student's place in a class waitlist.
 *
 * Positions within a class are contiguous from 1 (ascending = earlier).
 * Removing an entry shifts every later entry down by one.
 * offerStatus moves NONE -> OFFERED and the entry is removed once the
 * offer is accepted, declined or expires.
 *
 * @author Enrollment Team
 */
@Entity
@Table(name = "waitlist_entries",
       uniqueConstraints = @UniqueConstraint(name = "uk_waitlist_class_student", columnNames = {"class_id", "student_id"}),
       indexes = {
           @Index(name = "idx_waitlist_class_position", columnList = "class_id, position"),
           @Index(name = "idx_waitlist_offer_expiry", columnList = "offer_status, offer_expires_at")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WaitlistEntry {

    @Id
    @Column(name = "entry_id", nullable = false, length = 36)
    private String entryId;

    @Column(name = "class_id", nullable = false, length = 64)
    private String classId;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(name = "position", nullable = false)
    private Integer position;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "offer_status", nullable = false, length = 20)
    @Builder.Default
    private OfferStatus offerStatus = OfferStatus.NONE;

    @Column(name = "offered_at")
    private Instant offeredAt;

    /**
     * Set when a seat is offered; null otherwise.
     */
    @Column(name = "offer_expires_at")
    private Instant offerExpiresAt;

    /**
     * Set once the deadline reminder has been sent for the current offer.
     */
    @Column(name = "reminder_sent_at")
    private Instant reminderSentAt;

    @PrePersist
    protected void onCreate() {
        if (entryId == null) {
            entryId = UUID.randomUUID().toString();
        }
        if (joinedAt == null) {
            joinedAt = Instant.now();
        }
        if (offerStatus == null) {
            offerStatus = OfferStatus.NONE;
        }
    }

    public boolean hasOutstandingOffer() {
        return offerStatus == OfferStatus.OFFERED;
    }

    /**
     * @param now reference time
     * @return true if an outstanding offer has passed its deadline
     */
    public boolean isOfferExpired(Instant now) {
        return offerStatus == OfferStatus.OFFERED
                && offerExpiresAt != null
                && !now.isBefore(offerExpiresAt);
    }

    public void offer(Instant now, Duration window) {
        this.offerStatus = OfferStatus.OFFERED;
        this.offeredAt = now;
        this.offerExpiresAt = now.plus(window);
        this.reminderSentAt = null;
    }

    /**
     * Return the entry to the queue without an offer, e.g. when the seat
     * vanished before the student accepted.
     */
    public void withdrawOffer() {
        this.offerStatus = OfferStatus.NONE;
        this.offeredAt = null;
        this.offerExpiresAt = null;
        this.reminderSentAt = null;
    }
}
