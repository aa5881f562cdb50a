package com.eduhub.enrollment.api.controller;

import com.eduhub.enrollment.api.exception.GlobalExceptionHandler;
import com.eduhub.enrollment.domain.model.Enrollment;
import com.eduhub.enrollment.domain.model.EnrollmentStatus;
import com.eduhub.enrollment.domain.model.FailureReason;
import com.eduhub.enrollment.service.EnrollmentCoordinator;
import com.eduhub.enrollment.service.EnrollmentQueryService;
import com.eduhub.enrollment.service.EnrollmentResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for EnrollmentController using MockMvc.
 * Tests HTTP layer in isolation with mocked service dependencies.
 */
@WebMvcTest(EnrollmentController.class)
@ContextConfiguration(classes = {EnrollmentController.class, GlobalExceptionHandler.class})
@DisplayName("EnrollmentController Tests")
class EnrollmentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EnrollmentCoordinator coordinator;

    @MockBean
    private EnrollmentQueryService queryService;

    // ========================================
    // POST /api/v1/classes/{classId}/enrollments Tests
    // ========================================

    @Test
    @DisplayName("POST /enrollments - Seat taken returns 201 Created")
    void requestEnrollment_Enrolled_Returns201() throws Exception {
        // Given
        String requestBody = """
                {
                    "studentId": "s1",
                    "justification": "Needed for graduation"
                }
                """;
        when(coordinator.requestEnrollment("s1", "CS101", "Needed for graduation"))
                .thenReturn(EnrollmentResult.enrolled("Enrolled in CS101"));

        // When / Then
        mockMvc.perform(post("/api/v1/classes/CS101/enrollments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("ENROLLED"))
                .andExpect(jsonPath("$.studentId").value("s1"))
                .andExpect(jsonPath("$.classId").value("CS101"));
    }

    @Test
    @DisplayName("POST /enrollments - Full class returns 202 Accepted with position")
    void requestEnrollment_Waitlisted_Returns202() throws Exception {
        // Given
        when(coordinator.requestEnrollment("s3", "CS101", null))
                .thenReturn(EnrollmentResult.waitlisted(1, "Class is full; waitlisted at position 1"));

        // When / Then
        mockMvc.perform(post("/api/v1/classes/CS101/enrollments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\": \"s3\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("WAITLISTED"))
                .andExpect(jsonPath("$.position").value(1));
    }

    @Test
    @DisplayName("POST /enrollments - Duplicate returns 409 Conflict with reason")
    void requestEnrollment_Duplicate_Returns409() throws Exception {
        // Given
        when(coordinator.requestEnrollment("s1", "CS101", null))
                .thenReturn(EnrollmentResult.failure(FailureReason.DUPLICATE_REQUEST, "Already enrolled"));

        // When / Then
        mockMvc.perform(post("/api/v1/classes/CS101/enrollments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\": \"s1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("DUPLICATE_REQUEST"))
                .andExpect(jsonPath("$.details.studentId").value("s1"))
                .andExpect(jsonPath("$.path").value("/api/v1/classes/CS101/enrollments"));
    }

    @Test
    @DisplayName("POST /enrollments - Full waitlist returns 409 Waitlist Full")
    void requestEnrollment_WaitlistFull_Returns409() throws Exception {
        // Given
        when(coordinator.requestEnrollment("s9", "CS101", null))
                .thenReturn(EnrollmentResult.failure(FailureReason.WAITLIST_FULL, "Waitlist for CS101 is full"));

        // When / Then
        mockMvc.perform(post("/api/v1/classes/CS101/enrollments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\": \"s9\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("WAITLIST_FULL"))
                .andExpect(jsonPath("$.error").value("Waitlist Full"));
    }

    @Test
    @DisplayName("POST /enrollments - Unknown class returns 404")
    void requestEnrollment_UnknownClass_Returns404() throws Exception {
        // Given
        when(coordinator.requestEnrollment("s1", "NOPE", null))
                .thenReturn(EnrollmentResult.failure(FailureReason.CLASS_NOT_FOUND, "Class not found: NOPE"));

        // When / Then
        mockMvc.perform(post("/api/v1/classes/NOPE/enrollments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\": \"s1\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("CLASS_NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /enrollments - Malformed studentId returns 400 without calling the service")
    void requestEnrollment_InvalidStudentId_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/classes/CS101/enrollments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\": \"not valid!\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.fieldErrors.studentId").exists());

        verify(coordinator, never()).requestEnrollment(any(), any(), any());
    }

    @Test
    @DisplayName("POST /enrollments - Storage failure returns 503")
    void requestEnrollment_StorageFailure_Returns503() throws Exception {
        // Given
        when(coordinator.requestEnrollment("s1", "CS101", null))
                .thenReturn(EnrollmentResult.failure(FailureReason.STORAGE_FAILURE, "nothing was changed"));

        // When / Then
        mockMvc.perform(post("/api/v1/classes/CS101/enrollments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\": \"s1\"}"))
                .andExpect(status().isServiceUnavailable());
    }

    // ========================================
    // DELETE / GET Tests
    // ========================================

    @Test
    @DisplayName("DELETE /enrollments/{studentId} - Returns 200 OK")
    void dropEnrollment_Returns200() throws Exception {
        // Given
        when(coordinator.dropEnrollment("s1", "CS101")).thenReturn(EnrollmentResult.dropped("Dropped from CS101"));

        // When / Then
        mockMvc.perform(delete("/api/v1/classes/CS101/enrollments/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DROPPED"));
    }

    @Test
    @DisplayName("GET /enrollments/{studentId} - Returns latest record")
    void getEnrollment_Found_Returns200() throws Exception {
        // Given
        Enrollment enrollment = Enrollment.builder()
                .enrollmentId("enr-1")
                .studentId("s1")
                .classId("CS101")
                .status(EnrollmentStatus.WAITLISTED)
                .requestedAt(Instant.now())
                .build();
        when(queryService.getEnrollment("s1", "CS101")).thenReturn(Optional.of(enrollment));

        // When / Then
        mockMvc.perform(get("/api/v1/classes/CS101/enrollments/s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enrollmentId").value("enr-1"))
                .andExpect(jsonPath("$.status").value("WAITLISTED"));
    }

    @Test
    @DisplayName("GET /enrollments/{studentId} - Returns 404 when never requested")
    void getEnrollment_NotFound_Returns404() throws Exception {
        // Given
        when(queryService.getEnrollment("s9", "CS101")).thenReturn(Optional.empty());

        // When / Then
        mockMvc.perform(get("/api/v1/classes/CS101/enrollments/s9"))
                .andExpect(status().isNotFound());
    }
}
