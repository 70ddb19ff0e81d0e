package uk.gegc.reviewscheduler.features.review.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReviewHistoryDto", description = "One applied review")
public record ReviewHistoryDto(
        @Schema(description = "Review event ID")
        UUID eventId,
        @Schema(description = "Review record ID")
        UUID recordId,
        @Schema(description = "Content type")
        ReviewContentType contentType,
        @Schema(description = "Content item ID")
        Long contentId,
        @Schema(description = "Quality rating 0..5")
        Integer quality,
        @Schema(description = "Review time (UTC)")
        Instant reviewedAt,
        @Schema(description = "Interval before the review")
        Integer previousIntervalDays,
        @Schema(description = "Interval after the review")
        Integer intervalDays,
        @Schema(description = "Ease factor before the review")
        Double previousEaseFactor,
        @Schema(description = "Ease factor after the review")
        Double easeFactor,
        @Schema(description = "Review count after the review")
        Integer reviewCount,
        @Schema(description = "True for the first review of the item")
        Boolean firstReview,
        @Schema(description = "Idempotency key supplied by the client, if any")
        UUID idempotencyKey
) {
}
