package uk.gegc.reviewscheduler.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "ReminderToggleResponse", description = "Response after toggling reminders")
public record ReminderToggleResponse(
        @Schema(description = "Review record ID")
        UUID recordId,
        @Schema(description = "Current reminder enabled state")
        Boolean reminderEnabled
) {
}
