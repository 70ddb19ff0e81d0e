package uk.gegc.reviewscheduler.features.review.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewscheduler.features.review.application.DueClassifier;
import uk.gegc.reviewscheduler.features.review.application.ReviewReminderService;
import uk.gegc.reviewscheduler.features.review.application.dto.DueClassification;
import uk.gegc.reviewscheduler.features.review.application.dto.ReminderDto;
import uk.gegc.reviewscheduler.features.review.application.dto.ReminderPriority;
import uk.gegc.reviewscheduler.features.review.config.ReviewProperties;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;
import uk.gegc.reviewscheduler.features.review.domain.repository.ReviewRecordRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ReviewReminderServiceImpl implements ReviewReminderService {

    private final Clock clock;
    private final ReviewRecordRepository recordRepository;
    private final DueClassifier dueClassifier;
    private final ReviewProperties properties;

    @Override
    @Transactional(readOnly = true)
    public List<ReminderDto> reminders(UUID userId) {
        Instant now = Instant.now(clock);
        Instant horizon = now.plus(properties.getReminders().getDueSoonWindow());

        return recordRepository.findReminderCandidates(userId, horizon).stream()
                .map(record -> toReminder(record, dueClassifier.classify(record, now), now))
                .sorted(Comparator.comparing(ReminderDto::priority)
                        .thenComparing(ReminderDto::nextReviewAt)
                        .thenComparing(ReminderDto::recordId))
                .toList();
    }

    private ReminderDto toReminder(ReviewRecord record, DueClassification classification, Instant now) {
        return new ReminderDto(
                record.getId(),
                record.getContentId(),
                record.getContentType(),
                record.getNextReviewAt(),
                classification.priority(),
                classification.daysOverdue(),
                message(record, classification, now)
        );
    }

    private String message(ReviewRecord record, DueClassification classification, Instant now) {
        if (classification.priority() == ReminderPriority.HIGH) {
            long days = classification.daysOverdue();
            return "Review overdue by " + days + (days == 1 ? " day" : " days");
        }
        if (classification.isDue()) {
            return "Review due now";
        }
        long minutes = Math.max(1, Duration.between(now, record.getNextReviewAt()).toMinutes());
        return "Review due in " + minutes + (minutes == 1 ? " minute" : " minutes");
    }
}
