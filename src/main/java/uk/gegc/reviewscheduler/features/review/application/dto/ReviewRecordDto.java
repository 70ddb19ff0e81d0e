package uk.gegc.reviewscheduler.features.review.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReviewRecordDto", description = "Review schedule of one content item with its current due classification")
public record ReviewRecordDto(
        @Schema(description = "Review record ID")
        UUID recordId,
        @Schema(description = "Content item ID")
        Long contentId,
        @Schema(description = "Content type", example = "question")
        ReviewContentType contentType,
        @Schema(description = "Completed reviews so far")
        Integer reviewCount,
        @Schema(description = "Ease factor (SM-2)")
        Double easeFactor,
        @Schema(description = "Interval in days")
        Integer intervalDays,
        @Schema(description = "Last review time (UTC)")
        Instant lastReviewedAt,
        @Schema(description = "Next scheduled review time (UTC)")
        Instant nextReviewAt,
        @Schema(description = "Quality of the most recent review")
        Integer lastQuality,
        @Schema(description = "Reminder enabled for this record")
        Boolean reminderEnabled,
        @Schema(description = "DUE or UPCOMING at the time of the request")
        DueStatus status,
        @Schema(description = "Whole days past nextReviewAt, 0 when not overdue")
        long daysOverdue,
        @Schema(description = "Whole days until nextReviewAt, rounded up, 0 when due")
        long daysUntil,
        @Schema(description = "Reminder priority derived from due status")
        ReminderPriority priority,
        @Schema(description = "Creation time (UTC)")
        Instant createdAt
) {
}
