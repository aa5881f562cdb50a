package com.eduhub.enrollment.service;

import com.eduhub.enrollment.infrastructure.messaging.events.EnrollmentEvent;

import java.util.List;

/**
 * Receives the events of a committed operation, in emission order.
 * Implementations must not throw: delivery failures never undo committed state.
 *
 * @author Enrollment Team
 */
public interface EnrollmentEventPublisher {

    void publish(List<EnrollmentEvent> events);
}
