package uk.gegc.reviewscheduler.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(name = "CompleteReviewRequest", description = "Self-assessed recall quality for one review")
public record CompleteReviewRequest(
        @Schema(description = "Quality 0 (blackout) to 5 (perfect)", example = "4", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull Integer quality,
        @Schema(description = "Optional idempotency key; resubmitting the same key replays the first result")
        UUID idempotencyKey
) {
}
