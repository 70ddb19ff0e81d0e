package uk.gegc.reviewscheduler.features.review.domain.model;

import lombok.Getter;
import uk.gegc.reviewscheduler.features.review.application.exception.InvalidQualityException;

/**
 * Self-assessed recall quality on the SM-2 0..5 scale.
 */
@Getter
public enum RecallQuality {
    BLACKOUT(0),
    INCORRECT_REMEMBERED(1),
    INCORRECT_EASY_RECALL(2),
    CORRECT_DIFFICULT(3),
    CORRECT_HESITANT(4),
    PERFECT(5);

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 5;

    private final int score;

    RecallQuality(int score) {
        this.score = score;
    }

    public boolean isLapse() {
        return score < 3;
    }

    public static RecallQuality fromScore(Integer score) {
        if (score == null || score < MIN_SCORE || score > MAX_SCORE) {
            throw new InvalidQualityException("Quality rating must be between 0 and 5, got " + score);
        }
        return values()[score];
    }
}
