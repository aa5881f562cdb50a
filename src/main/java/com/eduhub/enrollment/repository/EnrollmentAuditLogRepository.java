package com.eduhub.enrollment.repository;

import com.eduhub.enrollment.domain.model.EnrollmentAuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for the enrollment audit trail.
 *
 * @author Enrollment Team
 */
@Repository
public interface EnrollmentAuditLogRepository extends JpaRepository<EnrollmentAuditLog, String> {

    List<EnrollmentAuditLog> findByClassIdOrderByTimestampAsc(String classId);

    List<EnrollmentAuditLog> findByStudentIdAndClassIdOrderByTimestampAsc(String studentId, String classId);

    /**
     * Action counts for a class since a point in time.
     * Each row is [AuditAction, Long].
     */
    @Query("SELECT a.action, COUNT(a) FROM EnrollmentAuditLog a " +
           "WHERE a.classId = :classId AND a.timestamp >= :since GROUP BY a.action")
    List<Object[]> countActionsSince(
            @Param("classId") String classId,
            @Param("since") Instant since
    );
}
