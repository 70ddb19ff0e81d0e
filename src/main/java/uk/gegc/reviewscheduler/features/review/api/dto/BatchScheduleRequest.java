package uk.gegc.reviewscheduler.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

@Schema(name = "BatchScheduleRequest", description = "Content items produced upstream, scheduled idempotently")
public record BatchScheduleRequest(
        @Schema(description = "Items to schedule; duplicates collapse to one record")
        @NotNull
        @Size(max = 500)
        List<@Valid @NotNull ScheduleRequest> items
) {
}
