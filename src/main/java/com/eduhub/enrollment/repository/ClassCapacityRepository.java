package com.eduhub.enrollment.repository;

import com.eduhub.enrollment.domain.model.ClassCapacity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for ClassCapacity.
 * Seat reservation and release are single conditional UPDATE statements so the
 * check-and-increment is atomic at the row level.
 *
 * @author Enrollment Team
 */
@Repository
public interface ClassCapacityRepository extends JpaRepository<ClassCapacity, String> {

    /**
     * Atomically take one seat if enrolledCount < capacity.
     *
     * @param classId Class ID
     * @param now Modification time
     * @return 1 if a seat was taken, 0 if the class is full or unknown
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ClassCapacity c SET " +
           "c.enrolledCount = c.enrolledCount + 1, " +
           "c.updatedAt = :now " +
           "WHERE c.classId = :classId AND c.enrolledCount < c.capacity")
    int reserveSeat(@Param("classId") String classId, @Param("now") Instant now);

    /**
     * Atomically give back one seat, floored at zero.
     *
     * @param classId Class ID
     * @return 1 if a seat was released, 0 if the count was already zero
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ClassCapacity c SET " +
           "c.enrolledCount = c.enrolledCount - 1, " +
           "c.updatedAt = :now " +
           "WHERE c.classId = :classId AND c.enrolledCount > 0")
    int releaseSeat(@Param("classId") String classId, @Param("now") Instant now);

    /**
     * Set a new capacity unless it would drop below the current enrolled count.
     *
     * @return 1 if updated, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ClassCapacity c SET " +
           "c.capacity = :capacity, " +
           "c.updatedAt = :now " +
           "WHERE c.classId = :classId AND c.enrolledCount <= :capacity")
    int updateCapacity(@Param("classId") String classId, @Param("capacity") Integer capacity,
                       @Param("now") Instant now);

    /**
     * Classes taught by a teacher.
     */
    List<ClassCapacity> findByTeacherId(String teacherId);
}
