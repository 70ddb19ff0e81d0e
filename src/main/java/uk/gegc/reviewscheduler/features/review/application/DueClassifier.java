package uk.gegc.reviewscheduler.features.review.application;

import org.springframework.stereotype.Component;
import uk.gegc.reviewscheduler.features.review.application.dto.DueClassification;
import uk.gegc.reviewscheduler.features.review.application.dto.DueStatus;
import uk.gegc.reviewscheduler.features.review.application.dto.ReminderPriority;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Classifies a record against a point in time. Stateless; never reads a clock.
 */
@Component
public class DueClassifier {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    public DueClassification classify(ReviewRecord record, Instant now) {
        return classify(record.getNextReviewAt(), now);
    }

    public DueClassification classify(Instant nextReviewAt, Instant now) {
        if (!nextReviewAt.isAfter(now)) {
            long overdueMillis = Duration.between(nextReviewAt, now).toMillis();
            long daysOverdue = Math.max(0, Math.floorDiv(overdueMillis, MILLIS_PER_DAY));
            ReminderPriority priority = daysOverdue > 0 ? ReminderPriority.HIGH : ReminderPriority.NORMAL;
            return new DueClassification(DueStatus.DUE, daysOverdue, 0, priority);
        }

        long untilMillis = Duration.between(now, nextReviewAt).toMillis();
        long daysUntil = Math.floorDiv(untilMillis + MILLIS_PER_DAY - 1, MILLIS_PER_DAY);
        return new DueClassification(DueStatus.UPCOMING, 0, daysUntil, ReminderPriority.LOW);
    }
}
