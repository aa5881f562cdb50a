package com.eduhub.enrollment.infrastructure.cache;

import com.eduhub.enrollment.domain.model.CapacitySnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis cache for capacity snapshots served to dashboards.
 *
 * Cache Keys:
 * - snapshot:{class_id} -> CapacitySnapshot (JSON)
 *
 * The cache is never consulted for admission. Every Redis error is logged
 * and treated as a miss so reads fall back to the database.
 *
 * @author Enrollment Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private static final String SNAPSHOT_PREFIX = "snapshot:";

    private static final Duration SNAPSHOT_TTL = Duration.ofSeconds(30);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisCacheService(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Get a cached snapshot.
     *
     * @param classId Class ID
     * @return Optional containing the snapshot if cached
     */
    public Optional<CapacitySnapshot> getSnapshot(String classId) {
        try {
            String json = redisTemplate.opsForValue().get(SNAPSHOT_PREFIX + classId);
            if (json != null) {
                logger.debug("Cache hit for snapshot: {}", classId);
                return Optional.of(objectMapper.readValue(json, CapacitySnapshot.class));
            }
            logger.debug("Cache miss for snapshot: {}", classId);
            return Optional.empty();
        } catch (Exception e) {
            logger.error("Error getting snapshot from cache for class: {}", classId, e);
            return Optional.empty();
        }
    }

    /**
     * Cache a snapshot, replacing any previous one.
     *
     * @param snapshot Snapshot to cache
     */
    public void cacheSnapshot(CapacitySnapshot snapshot) {
        String classId = snapshot.getClassId();
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            redisTemplate.opsForValue().set(SNAPSHOT_PREFIX + classId, json, SNAPSHOT_TTL);
            logger.debug("Cached snapshot for class {}: {}/{}", classId,
                    snapshot.getEnrolledCount(), snapshot.getCapacity());
        } catch (JsonProcessingException e) {
            logger.error("Error serializing snapshot for class: {}", classId, e);
        } catch (Exception e) {
            logger.error("Error caching snapshot for class: {}", classId, e);
        }
    }

    /**
     * @param classId Class ID
     */
    public void invalidateSnapshot(String classId) {
        try {
            redisTemplate.delete(SNAPSHOT_PREFIX + classId);
            logger.debug("Invalidated snapshot cache for: {}", classId);
        } catch (Exception e) {
            logger.error("Error invalidating snapshot cache for class: {}", classId, e);
        }
    }
}
