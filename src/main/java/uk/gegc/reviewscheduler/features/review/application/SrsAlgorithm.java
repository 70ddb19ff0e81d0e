package uk.gegc.reviewscheduler.features.review.application;

import uk.gegc.reviewscheduler.features.review.domain.model.RecallQuality;

import java.time.Instant;

public interface SrsAlgorithm {

    SchedulingResult applyReview(
            int currentReviewCount,
            int currentIntervalDays,
            double currentEaseFactor,
            RecallQuality quality,
            Instant now
    );

    record SchedulingResult(
            int intervalDays,
            int reviewCount,
            double easeFactor,
            Instant nextReviewAt,
            Instant lastReviewedAt,
            RecallQuality quality
    ) {
    }
}
