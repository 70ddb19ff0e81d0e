package uk.gegc.reviewscheduler.features.review.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.reviewscheduler.features.review.application.DueClassifier;
import uk.gegc.reviewscheduler.features.review.application.dto.DueClassification;
import uk.gegc.reviewscheduler.features.review.application.dto.ReviewHistoryDto;
import uk.gegc.reviewscheduler.features.review.application.dto.ReviewRecordDto;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewEvent;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;

import java.time.Instant;

@Component
@RequiredArgsConstructor
public class ReviewDtoMapper {

    private final DueClassifier dueClassifier;

    public ReviewRecordDto toRecordDto(ReviewRecord record, Instant now) {
        DueClassification classification = dueClassifier.classify(record, now);
        return new ReviewRecordDto(
                record.getId(),
                record.getContentId(),
                record.getContentType(),
                record.getReviewCount(),
                record.getEaseFactor(),
                record.getIntervalDays(),
                record.getLastReviewedAt(),
                record.getNextReviewAt(),
                record.getLastQuality(),
                record.getReminderEnabled(),
                classification.status(),
                classification.daysOverdue(),
                classification.daysUntil(),
                classification.priority(),
                record.getCreatedAt()
        );
    }

    public ReviewHistoryDto toHistoryDto(ReviewEvent event) {
        return new ReviewHistoryDto(
                event.getId(),
                event.getRecord().getId(),
                event.getContentType(),
                event.getContentId(),
                event.getQuality(),
                event.getReviewedAt(),
                event.getPreviousIntervalDays(),
                event.getIntervalDays(),
                event.getPreviousEaseFactor(),
                event.getEaseFactor(),
                event.getReviewCount(),
                event.getFirstReview(),
                event.getIdempotencyKey()
        );
    }
}
