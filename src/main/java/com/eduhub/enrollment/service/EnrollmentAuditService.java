package com.eduhub.enrollment.service;

import com.eduhub.enrollment.domain.model.EnrollmentAuditLog;
import com.eduhub.enrollment.domain.model.EnrollmentAuditLog.AuditAction;
import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.repository.EnrollmentAuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the enrollment audit trail.
 * Called inside the coordinator's transaction, so an entry exists exactly
 * when the change it describes was committed.
 *
 * @author Enrollment Team
 */
@Service
public class EnrollmentAuditService {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentAuditService.class);

    private final EnrollmentAuditLogRepository auditLogRepository;

    public EnrollmentAuditService(EnrollmentAuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void record(String studentId, String classId, AuditAction action,
                       EnrollmentStatus previousStatus, EnrollmentStatus newStatus,
                       String reason, Instant timestamp) {
        EnrollmentAuditLog entry = EnrollmentAuditLog.builder()
                .studentId(studentId)
                .classId(classId)
                .action(action)
                .previousStatus(previousStatus == null ? null : previousStatus.name())
                .newStatus(newStatus == null ? null : newStatus.name())
                .reason(reason)
                .timestamp(timestamp)
                .build();
        auditLogRepository.save(entry);
        logger.debug("Audit {} for student {} in class {}", action, studentId, classId);
    }

    /**
     * Class-level entry without a student, e.g. a capacity change.
     */
    public void recordClassAction(String classId, AuditAction action, String reason, Instant timestamp) {
        record(null, classId, action, null, null, reason, timestamp);
    }

    /**
     * Count actions recorded for a class since a point in time.
     *
     * @return counts per action, zero-filled for actions with no entries
     */
    public Map<AuditAction, Long> countActionsSince(String classId, Instant since) {
        Map<AuditAction, Long> counts = new EnumMap<>(AuditAction.class);
        for (AuditAction action : AuditAction.values()) {
            counts.put(action, 0L);
        }
        List<Object[]> rows = auditLogRepository.countActionsSince(classId, since);
        for (Object[] row : rows) {
            counts.put((AuditAction) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }
}
