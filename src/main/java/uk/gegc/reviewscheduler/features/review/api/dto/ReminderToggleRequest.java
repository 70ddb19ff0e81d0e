package uk.gegc.reviewscheduler.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(name = "ReminderToggleRequest", description = "Payload to enable or disable reminders for a record")
public record ReminderToggleRequest(
        @Schema(description = "true to enable reminders, false to disable them", example = "true")
        @NotNull Boolean enabled
) {
}
