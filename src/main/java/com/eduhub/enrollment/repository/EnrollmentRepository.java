package com.eduhub.enrollment.repository;

import com.eduhub.enrollment.domain.model.Enrollment;
import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Enrollment records.
 *
 * @author Enrollment Team
 */
@Repository
public interface EnrollmentRepository extends JpaRepository<Enrollment, String> {

    /**
     * Find the active (PENDING, ENROLLED or WAITLISTED) record for a pair.
     * At most one exists.
     *
     * @param studentId Student ID
     * @param classId Class ID
     * @return Optional containing the active enrollment
     */
    @Query("SELECT e FROM Enrollment e WHERE e.studentId = :studentId AND e.classId = :classId " +
           "AND e.status IN ('PENDING', 'ENROLLED', 'WAITLISTED')")
    Optional<Enrollment> findActiveEnrollment(
            @Param("studentId") String studentId,
            @Param("classId") String classId
    );

    /**
     * Most recent record for a pair regardless of status.
     */
    Optional<Enrollment> findFirstByStudentIdAndClassIdOrderByRequestedAtDesc(String studentId, String classId);

    /**
     * Check if the student has an active record for the class.
     */
    @Query("SELECT CASE WHEN COUNT(e) > 0 THEN true ELSE false END FROM Enrollment e " +
           "WHERE e.studentId = :studentId AND e.classId = :classId " +
           "AND e.status IN ('PENDING', 'ENROLLED', 'WAITLISTED')")
    boolean hasActiveEnrollment(
            @Param("studentId") String studentId,
            @Param("classId") String classId
    );

    List<Enrollment> findByClassIdAndStatus(String classId, EnrollmentStatus status);

    long countByClassIdAndStatus(String classId, EnrollmentStatus status);

    List<Enrollment> findByStudentId(String studentId);
}
