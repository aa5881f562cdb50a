package com.eduhub.enrollment.api.realtime;

import com.eduhub.enrollment.api.dto.EnrollmentResultResponse;
import com.eduhub.enrollment.api.dto.RealtimeEnrollmentMessage;
import com.eduhub.enrollment.domain.model.FailureReason;
import com.eduhub.enrollment.service.EnrollmentCoordinator;
import com.eduhub.enrollment.service.EnrollmentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

/**
 * STOMP entry points for clients that stay on the socket instead of REST.
 *
 * Clients send to /app/enrollment.request, /app/enrollment.drop and
 * /app/waitlist.respond. The outcome goes back to the sending session on
 * /user/queue/enrollment-results. Class-wide effects still arrive on the
 * class topic like any other change.
 *
 * @author Enrollment Team
 */
@Controller
public class EnrollmentSocketController {

    private static final Logger logger = LoggerFactory.getLogger(EnrollmentSocketController.class);

    static final String RESULT_QUEUE = "/queue/enrollment-results";

    private final EnrollmentCoordinator coordinator;

    public EnrollmentSocketController(EnrollmentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @MessageMapping("enrollment.request")
    @SendToUser(RESULT_QUEUE)
    public EnrollmentResultResponse requestEnrollment(RealtimeEnrollmentMessage message) {
        logger.debug("Socket enrollment request - student: {}, class: {}",
                message.getStudentId(), message.getClassId());

        EnrollmentResult result = coordinator.requestEnrollment(
                message.getStudentId(),
                message.getClassId(),
                message.getJustification()
        );
        return EnrollmentResultResponse.fromResult(message.getStudentId(), message.getClassId(), result);
    }

    @MessageMapping("enrollment.drop")
    @SendToUser(RESULT_QUEUE)
    public EnrollmentResultResponse dropEnrollment(RealtimeEnrollmentMessage message) {
        logger.debug("Socket drop request - student: {}, class: {}",
                message.getStudentId(), message.getClassId());

        EnrollmentResult result = coordinator.dropEnrollment(message.getStudentId(), message.getClassId());
        return EnrollmentResultResponse.fromResult(message.getStudentId(), message.getClassId(), result);
    }

    /**
     * Offer response; {@code response} must be ACCEPT or DECLINE.
     */
    @MessageMapping("waitlist.respond")
    @SendToUser(RESULT_QUEUE)
    public EnrollmentResultResponse respondToOffer(RealtimeEnrollmentMessage message) {
        String response = message.getResponse();
        EnrollmentResult result;

        if ("ACCEPT".equalsIgnoreCase(response) || "DECLINE".equalsIgnoreCase(response)) {
            result = coordinator.respondToWaitlistOffer(
                    message.getStudentId(),
                    message.getClassId(),
                    "ACCEPT".equalsIgnoreCase(response)
            );
        } else {
            logger.warn("Rejected socket offer response '{}' from student {}", response, message.getStudentId());
            result = EnrollmentResult.failure(FailureReason.VALIDATION_FAILED,
                    "Response must be ACCEPT or DECLINE");
        }
        return EnrollmentResultResponse.fromResult(message.getStudentId(), message.getClassId(), result);
    }
}
