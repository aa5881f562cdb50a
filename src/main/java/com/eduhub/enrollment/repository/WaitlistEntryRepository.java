package com.eduhub.enrollment.repository;

import com.eduhub.enrollment.domain.model.OfferStatus;
import com.eduhub.enrollment.domain.model.WaitlistEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for waitlist entries.
 *
 * @author Enrollment Team
 */
@Repository
public interface WaitlistEntryRepository extends JpaRepository<WaitlistEntry, String> {

    List<WaitlistEntry> findByClassIdOrderByPositionAsc(String classId);

    Optional<WaitlistEntry> findByClassIdAndStudentId(String classId, String studentId);

    long countByClassId(String classId);

    /**
     * Highest position in use for a class, or 0 when the waitlist is empty.
     */
    @Query("SELECT COALESCE(MAX(w.position), 0) FROM WaitlistEntry w WHERE w.classId = :classId")
    int findMaxPosition(@Param("classId") String classId);

    boolean existsByClassIdAndOfferStatus(String classId, OfferStatus offerStatus);

    long countByClassIdAndOfferStatus(String classId, OfferStatus offerStatus);

    /**
     * Next promotion candidate: lowest position with no offer.
     */
    Optional<WaitlistEntry> findFirstByClassIdAndOfferStatusOrderByPositionAsc(String classId, OfferStatus offerStatus);

    /**
     * Entries that will be shifted down when the entry at the given position is removed.
     */
    @Query("SELECT w FROM WaitlistEntry w WHERE w.classId = :classId AND w.position > :position " +
           "ORDER BY w.position ASC")
    List<WaitlistEntry> findEntriesAfter(
            @Param("classId") String classId,
            @Param("position") Integer position
    );

    /**
     * Close the gap left by a removed entry.
     *
     * @return number of entries renumbered
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WaitlistEntry w SET w.position = w.position - 1 " +
           "WHERE w.classId = :classId AND w.position > :position")
    int shiftPositionsDown(
            @Param("classId") String classId,
            @Param("position") Integer position
    );

    /**
     * Outstanding offers whose deadline has passed.
     */
    @Query("SELECT w FROM WaitlistEntry w WHERE w.offerStatus = 'OFFERED' " +
           "AND w.offerExpiresAt <= :now ORDER BY w.offerExpiresAt ASC")
    List<WaitlistEntry> findExpiredOffers(@Param("now") Instant now);

    /**
     * Outstanding offers that expire before the cutoff and have not been reminded yet.
     */
    @Query("SELECT w FROM WaitlistEntry w WHERE w.offerStatus = 'OFFERED' " +
           "AND w.reminderSentAt IS NULL AND w.offerExpiresAt > :now AND w.offerExpiresAt <= :cutoff")
    List<WaitlistEntry> findOffersDueForReminder(
            @Param("now") Instant now,
            @Param("cutoff") Instant cutoff
    );
}
