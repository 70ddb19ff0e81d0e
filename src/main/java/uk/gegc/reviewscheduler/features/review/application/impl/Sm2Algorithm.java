package uk.gegc.reviewscheduler.features.review.application.impl;

import uk.gegc.reviewscheduler.features.review.application.SrsAlgorithm;
import uk.gegc.reviewscheduler.features.review.config.ReviewProperties;
import uk.gegc.reviewscheduler.features.review.domain.model.RecallQuality;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * SuperMemo-2 scheduling. Pure: the caller supplies {@code now}.
 */
public class Sm2Algorithm implements SrsAlgorithm {

    private final double minEaseFactor;
    private final int lapseIntervalDays;
    private final int firstSuccessIntervalDays;
    private final int secondSuccessIntervalDays;

    public Sm2Algorithm() {
        this(new ReviewProperties.Sm2());
    }

    public Sm2Algorithm(ReviewProperties.Sm2 settings) {
        this.minEaseFactor = settings.getMinEaseFactor();
        this.lapseIntervalDays = settings.getLapseIntervalDays();
        this.firstSuccessIntervalDays = settings.getFirstIntervalDays();
        this.secondSuccessIntervalDays = settings.getSecondIntervalDays();
    }

    @Override
    public SchedulingResult applyReview(
            int currentReviewCount,
            int currentIntervalDays,
            double currentEaseFactor,
            RecallQuality quality,
            Instant now
    ) {
        int q = quality.getScore();
        double updatedEase = calculateUpdatedEase(currentEaseFactor, q);

        int intervalDays = quality.isLapse()
                ? lapseIntervalDays
                : computeIntervalDays(currentReviewCount, currentIntervalDays, updatedEase);

        Instant nextReview = now.plus(intervalDays, ChronoUnit.DAYS);

        return new SchedulingResult(intervalDays, currentReviewCount + 1, updatedEase, nextReview, now, quality);
    }

    private int computeIntervalDays(int reviewCount, int currentIntervalDays, double updatedEase) {
        if (reviewCount == 0) return firstSuccessIntervalDays;
        if (reviewCount == 1) return secondSuccessIntervalDays;
        return (int) Math.max(1, Math.round(currentIntervalDays * updatedEase));
    }

    private double calculateUpdatedEase(double currentEaseFactor, int q) {
        double updatedEase = currentEaseFactor
                + (0.1 - (5 - q) * (0.08 + (5 - q) * 0.02));
        return Math.max(updatedEase, minEaseFactor);
    }
}
