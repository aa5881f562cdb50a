package com.eduhub.enrollment.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClassCapacity Tests")
class ClassCapacityTest {

    @Test
    @DisplayName("Open seat while enrolled count is below capacity")
    void hasOpenSeat_BelowCapacity() {
        ClassCapacity classCapacity = ClassCapacity.builder().classId("c1").capacity(3).enrolledCount(2).build();

        assertThat(classCapacity.hasOpenSeat()).isTrue();
        assertThat(classCapacity.getAvailableSeats()).isEqualTo(1);
    }

    @Test
    @DisplayName("Full class has no open seat")
    void hasOpenSeat_Full() {
        ClassCapacity classCapacity = ClassCapacity.builder().classId("c1").capacity(2).enrolledCount(2).build();

        assertThat(classCapacity.hasOpenSeat()).isFalse();
        assertThat(classCapacity.getAvailableSeats()).isZero();
    }

    @Test
    @DisplayName("Zero-capacity class never has a seat")
    void zeroCapacity() {
        ClassCapacity classCapacity = ClassCapacity.builder().classId("c1").capacity(0).enrolledCount(0).build();

        assertThat(classCapacity.hasOpenSeat()).isFalse();
        assertThat(classCapacity.getAvailableSeats()).isZero();
    }

    @Test
    @DisplayName("Snapshot reflects counts and waitlist depth")
    void snapshot_FromCapacity() {
        ClassCapacity classCapacity = ClassCapacity.builder()
                .classId("c1").teacherId("t1").capacity(5).enrolledCount(5).build();

        CapacitySnapshot snapshot = CapacitySnapshot.of(classCapacity, 3, 1);

        assertThat(snapshot.getClassId()).isEqualTo("c1");
        assertThat(snapshot.getAvailableSeats()).isZero();
        assertThat(snapshot.getWaitlistCount()).isEqualTo(3);
        assertThat(snapshot.getOutstandingOffers()).isEqualTo(1);
    }

    @Test
    @DisplayName("Waitlist room is bounded by the waitlist capacity")
    void waitlistRoom() {
        ClassCapacity classCapacity = ClassCapacity.builder()
                .classId("c1").capacity(1).enrolledCount(1).waitlistCapacity(2).build();

        assertThat(classCapacity.hasWaitlistRoom(1)).isTrue();
        assertThat(classCapacity.hasWaitlistRoom(2)).isFalse();
        assertThat(CapacitySnapshot.of(classCapacity, 2, 0).getWaitlistCapacity()).isEqualTo(2);
    }
}
