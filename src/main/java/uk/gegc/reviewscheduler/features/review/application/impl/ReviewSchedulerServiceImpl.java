package uk.gegc.reviewscheduler.features.review.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewscheduler.features.review.application.ReviewMetricsService;
import uk.gegc.reviewscheduler.features.review.application.ReviewSchedulerService;
import uk.gegc.reviewscheduler.features.review.application.SrsAlgorithm;
import uk.gegc.reviewscheduler.features.review.application.dto.ReviewOutcome;
import uk.gegc.reviewscheduler.features.review.application.dto.ScheduleItem;
import uk.gegc.reviewscheduler.features.review.application.exception.ReviewConflictException;
import uk.gegc.reviewscheduler.features.review.config.ReviewProperties;
import uk.gegc.reviewscheduler.features.review.domain.model.RecallQuality;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewEvent;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;
import uk.gegc.reviewscheduler.features.review.domain.repository.ReviewEventRepository;
import uk.gegc.reviewscheduler.features.review.domain.repository.ReviewRecordRepository;
import uk.gegc.reviewscheduler.shared.exception.ForbiddenException;
import uk.gegc.reviewscheduler.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewSchedulerServiceImpl implements ReviewSchedulerService {

    private final Clock clock;
    private final ReviewRecordRepository recordRepository;
    private final ReviewEventRepository eventRepository;
    private final SrsAlgorithm srsAlgorithm;
    private final ReviewProperties properties;
    private final ReviewMetricsService metricsService;

    @Lazy
    private final ReviewSchedulerService self;

    @Override
    public ReviewRecord schedule(UUID userId, Long contentId, ReviewContentType contentType) {
        requireContentRef(contentId, contentType);
        try {
            return self.scheduleTx(userId, contentId, contentType);
        } catch (DataIntegrityViolationException e) {
            // lost an insert race on the unique (user, content) key; the winner's row is the answer
            log.debug("Concurrent schedule for user {} content {}:{}, re-reading", userId, contentType, contentId);
            return self.findExisting(userId, contentId, contentType).orElseThrow(() -> e);
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReviewRecord scheduleTx(UUID userId, Long contentId, ReviewContentType contentType) {
        Optional<ReviewRecord> existing = recordRepository.findByUserIdAndContentIdAndContentType(userId, contentId, contentType);
        if (existing.isPresent()) {
            return existing.get();
        }

        Instant now = Instant.now(clock);
        ReviewRecord record = new ReviewRecord();
        record.setUserId(userId);
        record.setContentId(contentId);
        record.setContentType(contentType);
        record.setReviewCount(0);
        record.setEaseFactor(properties.getSm2().getInitialEaseFactor());
        record.setIntervalDays(0);
        record.setNextReviewAt(now);
        record.setReminderEnabled(Boolean.TRUE);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);

        ReviewRecord saved = recordRepository.saveAndFlush(record);
        metricsService.recordScheduled();
        log.info("Scheduled {} {} for user {} as record {}", contentType.getWireName(), contentId, userId, saved.getId());
        return saved;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<ReviewRecord> findExisting(UUID userId, Long contentId, ReviewContentType contentType) {
        return recordRepository.findByUserIdAndContentIdAndContentType(userId, contentId, contentType);
    }

    @Override
    public List<ReviewRecord> scheduleBatch(UUID userId, List<ScheduleItem> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        if (items.size() > properties.getMaxBatchSize()) {
            throw new IllegalArgumentException(
                    "Batch may contain at most " + properties.getMaxBatchSize() + " items, got " + items.size());
        }
        items.forEach(item -> requireContentRef(item.contentId(), item.contentType()));

        Set<ScheduleItem> distinct = new LinkedHashSet<>(items);
        List<ReviewRecord> records = new ArrayList<>(distinct.size());
        for (ScheduleItem item : distinct) {
            records.add(schedule(userId, item.contentId(), item.contentType()));
        }
        return records;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReviewRecord> listDue(UUID userId, Integer limit) {
        int effectiveLimit = limit == null ? properties.getDefaultDueLimit() : limit;
        if (effectiveLimit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        effectiveLimit = Math.min(effectiveLimit, properties.getMaxDueLimit());
        return recordRepository.findDue(userId, Instant.now(clock), PageRequest.of(0, effectiveLimit));
    }

    @Override
    public ReviewOutcome completeReview(UUID userId, UUID recordId, Integer quality, UUID idempotencyKey) {
        RecallQuality.fromScore(quality);
        try {
            ReviewOutcome outcome = self.completeReviewTx(userId, recordId, quality, idempotencyKey);
            if (outcome.replayed()) {
                metricsService.recordReplayed();
            } else {
                metricsService.recordCompleted(quality);
            }
            return outcome;
        } catch (ConcurrencyFailureException e) {
            metricsService.recordConflict();
            log.info("Lost completion race on record {} for user {}", recordId, userId);
            throw new ReviewConflictException(recordId,
                    "Review record " + recordId + " was updated concurrently. Refresh and try again.", e);
        } catch (ReviewConflictException e) {
            metricsService.recordConflict();
            throw e;
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReviewOutcome completeReviewTx(UUID userId, UUID recordId, Integer quality, UUID idempotencyKey) {
        RecallQuality recallQuality = RecallQuality.fromScore(quality);
        ReviewRecord record = loadOwned(userId, recordId);
        Instant now = Instant.now(clock);

        Optional<ReviewEvent> prior = idempotencyKey == null
                ? Optional.empty()
                : eventRepository.findByUserIdAndIdempotencyKey(userId, idempotencyKey);
        if (prior.isPresent()) {
            ReviewEvent event = prior.get();
            if (event.getRecord().getId().equals(recordId) && event.getQuality().equals(quality)) {
                log.info("Replayed completion for record {} with key {}", recordId, idempotencyKey);
                return new ReviewOutcome(record, true);
            }
            throw new ReviewConflictException(recordId,
                    "Idempotency key " + idempotencyKey + " was already used for a different review");
        }

        // unseen keys still go through the replay window
        if (isWithinReplayWindow(record, now)) {
            if (Objects.equals(record.getLastQuality(), quality)) {
                log.info("Replayed completion for record {} inside replay window", recordId);
                return new ReviewOutcome(record, true);
            }
            throw new ReviewConflictException(recordId,
                    "Record " + recordId + " was just reviewed with a different quality");
        }

        int previousCount = record.getReviewCount();
        int previousInterval = record.getIntervalDays();
        double previousEase = record.getEaseFactor();

        SrsAlgorithm.SchedulingResult result = srsAlgorithm.applyReview(
                previousCount,
                previousInterval,
                previousEase,
                recallQuality,
                now
        );

        applyResults(record, result, now);
        ReviewRecord saved = recordRepository.saveAndFlush(record);

        ReviewEvent event = buildEvent(saved, result, previousCount, previousInterval, previousEase, idempotencyKey);
        try {
            eventRepository.saveAndFlush(event);
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey != null) {
                throw new ReviewConflictException(recordId,
                        "Completion with idempotency key " + idempotencyKey + " was already processed", e);
            }
            throw e;
        }

        log.info("Completed review of record {} with quality {}: interval {}d, next review at {}",
                recordId, quality, result.intervalDays(), result.nextReviewAt());
        return new ReviewOutcome(saved, false);
    }

    @Override
    @Transactional(readOnly = true)
    public ReviewRecord getRecord(UUID userId, UUID recordId) {
        return loadOwned(userId, recordId);
    }

    @Override
    @Transactional
    public void delete(UUID userId, UUID recordId) {
        ReviewRecord record = loadOwned(userId, recordId);
        int removedEvents = eventRepository.deleteByRecordId(recordId);
        recordRepository.delete(record);
        log.info("Deleted review record {} and {} events for user {}", recordId, removedEvents, userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ReviewEvent> history(UUID userId, Pageable pageable) {
        return eventRepository.findByUserIdOrderByReviewedAtDesc(userId, pageable);
    }

    @Override
    @Transactional
    public ReviewRecord setReminderEnabled(UUID userId, UUID recordId, boolean enabled) {
        ReviewRecord record = loadOwned(userId, recordId);
        record.setReminderEnabled(enabled);
        record.setUpdatedAt(Instant.now(clock));
        return recordRepository.save(record);
    }

    private ReviewRecord loadOwned(UUID userId, UUID recordId) {
        ReviewRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Review record " + recordId + " not found"));
        if (!record.isOwnedBy(userId)) {
            throw new ForbiddenException("Review record " + recordId + " belongs to another user");
        }
        return record;
    }

    private boolean isWithinReplayWindow(ReviewRecord record, Instant now) {
        Instant lastReviewedAt = record.getLastReviewedAt();
        if (lastReviewedAt == null || lastReviewedAt.isAfter(now)) {
            return false;
        }
        Duration sinceLast = Duration.between(lastReviewedAt, now);
        return sinceLast.compareTo(properties.getReplayWindow()) < 0;
    }

    private void requireContentRef(Long contentId, ReviewContentType contentType) {
        if (contentId == null || contentType == null) {
            throw new IllegalArgumentException("contentId and contentType are required");
        }
    }

    private void applyResults(ReviewRecord record, SrsAlgorithm.SchedulingResult result, Instant now) {
        record.setIntervalDays(result.intervalDays());
        record.setReviewCount(result.reviewCount());
        record.setEaseFactor(result.easeFactor());
        record.setNextReviewAt(result.nextReviewAt());
        record.setLastReviewedAt(result.lastReviewedAt());
        record.setLastQuality(result.quality().getScore());
        record.setUpdatedAt(now);
    }

    private ReviewEvent buildEvent(ReviewRecord record,
                                   SrsAlgorithm.SchedulingResult result,
                                   int previousCount,
                                   int previousInterval,
                                   double previousEase,
                                   UUID idempotencyKey) {
        ReviewEvent event = new ReviewEvent();
        event.setUserId(record.getUserId());
        event.setRecord(record);
        event.setContentType(record.getContentType());
        event.setContentId(record.getContentId());
        event.setQuality(result.quality().getScore());
        event.setReviewedAt(result.lastReviewedAt());
        event.setPreviousIntervalDays(previousInterval);
        event.setIntervalDays(result.intervalDays());
        event.setPreviousEaseFactor(previousEase);
        event.setEaseFactor(result.easeFactor());
        event.setReviewCount(result.reviewCount());
        event.setFirstReview(previousCount == 0);
        event.setIdempotencyKey(idempotencyKey);
        return event;
    }
}
