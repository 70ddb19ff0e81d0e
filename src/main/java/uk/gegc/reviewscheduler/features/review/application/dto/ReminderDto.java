package uk.gegc.reviewscheduler.features.review.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReminderDto", description = "A review reminder for one record")
public record ReminderDto(
        @Schema(description = "Review record ID")
        UUID recordId,
        @Schema(description = "Content item ID")
        Long contentId,
        @Schema(description = "Content type")
        ReviewContentType contentType,
        @Schema(description = "Scheduled review time (UTC)")
        Instant nextReviewAt,
        @Schema(description = "HIGH when overdue, NORMAL when due, LOW when due soon")
        ReminderPriority priority,
        @Schema(description = "Whole days past nextReviewAt")
        long daysOverdue,
        @Schema(description = "Human readable reminder", example = "Review overdue by 2 days")
        String message
) {
}
