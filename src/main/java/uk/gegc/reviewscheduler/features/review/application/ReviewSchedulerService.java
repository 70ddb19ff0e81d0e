package uk.gegc.reviewscheduler.features.review.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.reviewscheduler.features.review.application.dto.ReviewOutcome;
import uk.gegc.reviewscheduler.features.review.application.dto.ScheduleItem;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewEvent;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReviewSchedulerService {

    ReviewRecord schedule(UUID userId, Long contentId, ReviewContentType contentType);

    ReviewRecord scheduleTx(UUID userId, Long contentId, ReviewContentType contentType);

    Optional<ReviewRecord> findExisting(UUID userId, Long contentId, ReviewContentType contentType);

    List<ReviewRecord> scheduleBatch(UUID userId, List<ScheduleItem> items);

    List<ReviewRecord> listDue(UUID userId, Integer limit);

    ReviewOutcome completeReview(UUID userId, UUID recordId, Integer quality, UUID idempotencyKey);

    ReviewOutcome completeReviewTx(UUID userId, UUID recordId, Integer quality, UUID idempotencyKey);

    ReviewRecord getRecord(UUID userId, UUID recordId);

    void delete(UUID userId, UUID recordId);

    Page<ReviewEvent> history(UUID userId, Pageable pageable);

    ReviewRecord setReminderEnabled(UUID userId, UUID recordId, boolean enabled);
}
