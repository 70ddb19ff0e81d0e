package uk.gegc.reviewscheduler.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "CompleteReviewResponse", description = "Updated schedule after a completed review")
public record CompleteReviewResponse(
        @Schema(description = "Review record ID")
        UUID recordId,
        @Schema(description = "Next scheduled review time (UTC)")
        Instant nextReviewAt,
        @Schema(description = "Interval in days")
        Integer intervalDays,
        @Schema(description = "Completed reviews so far")
        Integer reviewCount,
        @Schema(description = "Ease factor (SM-2)")
        Double easeFactor,
        @Schema(description = "Last review time (UTC)")
        Instant lastReviewedAt,
        @Schema(description = "Quality of the last review")
        Integer lastQuality,
        @Schema(description = "True when the request matched an already applied review and nothing changed")
        boolean replayed
) {
}
