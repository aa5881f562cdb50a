package com.eduhub.enrollment.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WaitlistEntry Offer Tests")
class WaitlistEntryTest {

    private final Instant now = Instant.parse("2026-03-01T10:00:00Z");

    private WaitlistEntry entry() {
        return WaitlistEntry.builder()
                .classId("c1")
                .studentId("s1")
                .position(1)
                .joinedAt(now)
                .build();
    }

    @Test
    @DisplayName("New entries start without an offer")
    void newEntry_NoOffer() {
        WaitlistEntry entry = entry();

        assertThat(entry.getOfferStatus()).isEqualTo(OfferStatus.NONE);
        assertThat(entry.hasOutstandingOffer()).isFalse();
        assertThat(entry.isOfferExpired(now.plus(Duration.ofDays(30)))).isFalse();
    }

    @Test
    @DisplayName("offer - sets the deadline one window ahead and clears any reminder")
    void offer_SetsDeadline() {
        WaitlistEntry entry = entry();
        entry.setReminderSentAt(now.minusSeconds(5));

        entry.offer(now, Duration.ofHours(24));

        assertThat(entry.hasOutstandingOffer()).isTrue();
        assertThat(entry.getOfferedAt()).isEqualTo(now);
        assertThat(entry.getOfferExpiresAt()).isEqualTo(now.plus(Duration.ofHours(24)));
        assertThat(entry.getReminderSentAt()).isNull();
    }

    @Test
    @DisplayName("isOfferExpired - true at and after the deadline")
    void isOfferExpired_AtDeadline() {
        WaitlistEntry entry = entry();
        entry.offer(now, Duration.ofHours(1));

        assertThat(entry.isOfferExpired(now.plus(Duration.ofMinutes(59)))).isFalse();
        assertThat(entry.isOfferExpired(now.plus(Duration.ofHours(1)))).isTrue();
        assertThat(entry.isOfferExpired(now.plus(Duration.ofHours(2)))).isTrue();
    }

    @Test
    @DisplayName("withdrawOffer - returns the entry to the queue")
    void withdrawOffer_ResetsOffer() {
        WaitlistEntry entry = entry();
        entry.offer(now, Duration.ofHours(1));

        entry.withdrawOffer();

        assertThat(entry.getOfferStatus()).isEqualTo(OfferStatus.NONE);
        assertThat(entry.getOfferExpiresAt()).isNull();
        assertThat(entry.getPosition()).isEqualTo(1);
    }
}
