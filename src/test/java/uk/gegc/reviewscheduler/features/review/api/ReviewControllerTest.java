package uk.gegc.reviewscheduler.features.review.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.reviewscheduler.features.review.application.DueClassifier;
import uk.gegc.reviewscheduler.features.review.application.ReviewReminderService;
import uk.gegc.reviewscheduler.features.review.application.ReviewSchedulerService;
import uk.gegc.reviewscheduler.features.review.application.dto.ReminderDto;
import uk.gegc.reviewscheduler.features.review.application.dto.ReminderPriority;
import uk.gegc.reviewscheduler.features.review.application.dto.ReviewOutcome;
import uk.gegc.reviewscheduler.features.review.application.dto.ScheduleItem;
import uk.gegc.reviewscheduler.features.review.application.exception.InvalidQualityException;
import uk.gegc.reviewscheduler.features.review.application.exception.ReviewConflictException;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewEvent;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;
import uk.gegc.reviewscheduler.features.review.infra.mapping.ReviewDtoMapper;
import uk.gegc.reviewscheduler.shared.exception.ForbiddenException;
import uk.gegc.reviewscheduler.shared.exception.ResourceNotFoundException;
import uk.gegc.reviewscheduler.shared.security.AuthenticatedUserResolver;
import uk.gegc.reviewscheduler.testsupport.FixedClockTestConfig;
import uk.gegc.reviewscheduler.testsupport.WebMvcSecurityTestConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
@Import({
        WebMvcSecurityTestConfig.class,
        FixedClockTestConfig.class,
        ReviewDtoMapper.class,
        DueClassifier.class,
        AuthenticatedUserResolver.class
})
@DisplayName("ReviewController Tests")
class ReviewControllerTest {

    private static final String USER = "10000000-0000-0000-0000-000000000001";
    private static final UUID USER_ID = UUID.fromString(USER);
    private static final UUID RECORD_ID = UUID.fromString("20000000-0000-0000-0000-000000000002");
    private static final Instant NOW = FixedClockTestConfig.NOW;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReviewSchedulerService schedulerService;

    @MockitoBean
    private ReviewReminderService reminderService;

    @Test
    @DisplayName("POST /api/v1/review/records: schedules and returns the record due now")
    @WithMockUser(username = USER)
    void schedule_returnsRecord() throws Exception {
        when(schedulerService.schedule(USER_ID, 42L, ReviewContentType.QUESTION)).thenReturn(record(NOW));

        mockMvc.perform(post("/api/v1/review/records")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentId\":42,\"contentType\":\"question\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recordId").value(RECORD_ID.toString()))
                .andExpect(jsonPath("$.contentId").value(42))
                .andExpect(jsonPath("$.contentType").value("question"))
                .andExpect(jsonPath("$.reviewCount").value(0))
                .andExpect(jsonPath("$.easeFactor").value(2.5))
                .andExpect(jsonPath("$.status").value("DUE"))
                .andExpect(jsonPath("$.priority").value("NORMAL"));
    }

    @Test
    @DisplayName("POST /api/v1/review/records: unknown content type returns 400")
    @WithMockUser(username = USER)
    void schedule_unknownContentType_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/review/records")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentId\":42,\"contentType\":\"video\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(schedulerService);
    }

    @Test
    @DisplayName("POST /api/v1/review/records: missing contentId returns 400")
    @WithMockUser(username = USER)
    void schedule_missingContentId_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/review/records")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentType\":\"knowledge_point\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /api/v1/review/records: anonymous caller gets 401")
    void schedule_anonymous_returns401() throws Exception {
        mockMvc.perform(post("/api/v1/review/records")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentId\":42,\"contentType\":\"question\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("POST /api/v1/review/records: principal that is not a user id gets 401")
    @WithMockUser(username = "alice")
    void schedule_nonUuidPrincipal_returns401() throws Exception {
        mockMvc.perform(post("/api/v1/review/records")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"contentId\":42,\"contentType\":\"question\"}"))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(schedulerService);
    }

    @Test
    @DisplayName("POST /api/v1/review/records/batch: maps every item")
    @WithMockUser(username = USER)
    void scheduleBatch_mapsItems() throws Exception {
        when(schedulerService.scheduleBatch(eq(USER_ID), anyList())).thenReturn(List.of(record(NOW)));

        mockMvc.perform(post("/api/v1/review/records/batch")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"contentId\":42,\"contentType\":\"question\"},"
                                + "{\"contentId\":7,\"contentType\":\"knowledge_point\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        verify(schedulerService).scheduleBatch(USER_ID, List.of(
                new ScheduleItem(42L, ReviewContentType.QUESTION),
                new ScheduleItem(7L, ReviewContentType.KNOWLEDGE_POINT)));
    }

    @Test
    @DisplayName("GET /api/v1/review/records/{id}: other user's record returns 403")
    @WithMockUser(username = USER)
    void getRecord_forbidden_returns403() throws Exception {
        when(schedulerService.getRecord(USER_ID, RECORD_ID)).thenThrow(new ForbiddenException("not yours"));

        mockMvc.perform(get("/api/v1/review/records/{recordId}", RECORD_ID))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("GET /api/v1/review/records/{id}: missing record returns 404 problem")
    @WithMockUser(username = USER)
    void getRecord_notFound_returns404() throws Exception {
        when(schedulerService.getRecord(USER_ID, RECORD_ID))
                .thenThrow(new ResourceNotFoundException("Review record " + RECORD_ID + " not found"));

        mockMvc.perform(get("/api/v1/review/records/{recordId}", RECORD_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Resource Not Found"));
    }

    @Test
    @DisplayName("GET /api/v1/review/records/{id}: malformed id returns 400")
    @WithMockUser(username = USER)
    void getRecord_malformedId_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/review/records/{recordId}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("DELETE /api/v1/review/records/{id}: returns 204")
    @WithMockUser(username = USER)
    void delete_returns204() throws Exception {
        mockMvc.perform(delete("/api/v1/review/records/{recordId}", RECORD_ID).with(csrf()))
                .andExpect(status().isNoContent());
        verify(schedulerService).delete(USER_ID, RECORD_ID);
    }

    @Test
    @DisplayName("GET /api/v1/review/due: default limit is 50 and overdue days are reported")
    @WithMockUser(username = USER)
    void due_defaultLimit() throws Exception {
        when(schedulerService.listDue(USER_ID, 50)).thenReturn(List.of(record(NOW.minus(Duration.ofDays(2)))));

        mockMvc.perform(get("/api/v1/review/due"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].daysOverdue").value(2))
                .andExpect(jsonPath("$[0].priority").value("HIGH"));
    }

    @Test
    @DisplayName("GET /api/v1/review/due: limit outside 1..200 returns 400")
    @WithMockUser(username = USER)
    void due_invalidLimit_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/review/due").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/review/due").param("limit", "201"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(schedulerService);
    }

    @Test
    @DisplayName("POST /api/v1/review/records/{id}/complete: returns the updated schedule")
    @WithMockUser(username = USER)
    void complete_returnsSchedule() throws Exception {
        ReviewRecord record = record(NOW.plus(Duration.ofDays(1)));
        record.setReviewCount(1);
        record.setIntervalDays(1);
        record.setEaseFactor(2.6);
        record.setLastReviewedAt(NOW);
        record.setLastQuality(5);
        UUID key = UUID.fromString("30000000-0000-0000-0000-000000000003");
        when(schedulerService.completeReview(USER_ID, RECORD_ID, 5, key)).thenReturn(new ReviewOutcome(record, false));

        mockMvc.perform(post("/api/v1/review/records/{recordId}/complete", RECORD_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quality\":5,\"idempotencyKey\":\"" + key + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recordId").value(RECORD_ID.toString()))
                .andExpect(jsonPath("$.intervalDays").value(1))
                .andExpect(jsonPath("$.reviewCount").value(1))
                .andExpect(jsonPath("$.easeFactor").value(2.6))
                .andExpect(jsonPath("$.lastQuality").value(5))
                .andExpect(jsonPath("$.replayed").value(false));
    }

    @Test
    @DisplayName("POST /api/v1/review/records/{id}/complete: out-of-range quality returns 400")
    @WithMockUser(username = USER)
    void complete_invalidQuality_returns400() throws Exception {
        when(schedulerService.completeReview(eq(USER_ID), eq(RECORD_ID), eq(6), any()))
                .thenThrow(new InvalidQualityException("Quality rating must be between 0 and 5, got 6"));

        mockMvc.perform(post("/api/v1/review/records/{recordId}/complete", RECORD_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quality\":6}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid Quality"));
    }

    @Test
    @DisplayName("POST /api/v1/review/records/{id}/complete: missing quality returns 400")
    @WithMockUser(username = USER)
    void complete_missingQuality_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/review/records/{recordId}/complete", RECORD_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(schedulerService);
    }

    @Test
    @DisplayName("POST /api/v1/review/records/{id}/complete: conflict returns 409 with record id")
    @WithMockUser(username = USER)
    void complete_conflict_returns409() throws Exception {
        when(schedulerService.completeReview(eq(USER_ID), eq(RECORD_ID), eq(3), any()))
                .thenThrow(new ReviewConflictException(RECORD_ID, "updated concurrently"));

        mockMvc.perform(post("/api/v1/review/records/{recordId}/complete", RECORD_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quality\":3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.recordId").value(RECORD_ID.toString()));
    }

    @Test
    @DisplayName("PUT /api/v1/review/records/{id}/reminder: toggles reminders")
    @WithMockUser(username = USER)
    void setReminder_toggles() throws Exception {
        ReviewRecord record = record(NOW);
        record.setReminderEnabled(false);
        when(schedulerService.setReminderEnabled(USER_ID, RECORD_ID, false)).thenReturn(record);

        mockMvc.perform(put("/api/v1/review/records/{recordId}/reminder", RECORD_ID)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recordId").value(RECORD_ID.toString()))
                .andExpect(jsonPath("$.reminderEnabled").value(false));
    }

    @Test
    @DisplayName("GET /api/v1/review/history: returns a page of events")
    @WithMockUser(username = USER)
    void history_returnsPage() throws Exception {
        ReviewEvent event = new ReviewEvent();
        event.setId(UUID.randomUUID());
        event.setRecord(record(NOW));
        event.setContentType(ReviewContentType.QUESTION);
        event.setContentId(42L);
        event.setQuality(4);
        event.setReviewedAt(NOW);
        event.setFirstReview(true);
        when(schedulerService.history(eq(USER_ID), any()))
                .thenReturn(new PageImpl<>(List.of(event), PageRequest.of(0, 20), 1));

        mockMvc.perform(get("/api/v1/review/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].recordId").value(RECORD_ID.toString()))
                .andExpect(jsonPath("$.content[0].quality").value(4))
                .andExpect(jsonPath("$.content[0].firstReview").value(true));
    }

    @Test
    @DisplayName("GET /api/v1/review/reminders: returns reminders from the service")
    @WithMockUser(username = USER)
    void reminders_returnsList() throws Exception {
        when(reminderService.reminders(USER_ID)).thenReturn(List.of(new ReminderDto(
                RECORD_ID, 42L, ReviewContentType.QUESTION, NOW.minus(Duration.ofDays(2)),
                ReminderPriority.HIGH, 2, "Review overdue by 2 days")));

        mockMvc.perform(get("/api/v1/review/reminders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].priority").value("HIGH"))
                .andExpect(jsonPath("$[0].message").value("Review overdue by 2 days"));
    }

    private static ReviewRecord record(Instant nextReviewAt) {
        ReviewRecord record = new ReviewRecord();
        record.setId(RECORD_ID);
        record.setUserId(USER_ID);
        record.setContentId(42L);
        record.setContentType(ReviewContentType.QUESTION);
        record.setNextReviewAt(nextReviewAt);
        record.setCreatedAt(NOW.minus(Duration.ofDays(10)));
        record.setUpdatedAt(NOW.minus(Duration.ofDays(10)));
        return record;
    }
}
