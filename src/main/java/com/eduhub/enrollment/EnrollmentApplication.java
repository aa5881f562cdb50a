package com.eduhub.enrollment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the enrollment service.
 *
 * System Overview:
 * - Capacity-limited classes with one seat per enrolled student
 * - FIFO waitlist with contiguous positions and time-boxed seat offers
 * - Per-class serialization of every state change
 * - Realtime updates over STOMP (class, student and teacher topics)
 * - Notification requests to Kafka, snapshot caching in Redis
 * - CloudWatch metrics for observability
 *
 * Architecture:
 * - API Layer: REST and STOMP controllers with validation
 * - Service Layer: coordinator, enrollment state machine, waitlist engine
 * - Data Access Layer: JPA repositories with conditional seat updates
 * - Infrastructure Layer: class locks, Redis cache, Kafka, WebSocket broadcast, CloudWatch
 *
 * @author Enrollment Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableScheduling
public class EnrollmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnrollmentApplication.class, args);
    }
}
