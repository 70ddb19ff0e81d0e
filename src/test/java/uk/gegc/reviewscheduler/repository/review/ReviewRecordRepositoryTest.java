package uk.gegc.reviewscheduler.repository.review;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewEvent;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;
import uk.gegc.reviewscheduler.features.review.domain.repository.ReviewEventRepository;
import uk.gegc.reviewscheduler.features.review.domain.repository.ReviewRecordRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ReviewRecordRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-10T12:00:00Z");
    private static final UUID USER_ID = UUID.fromString("10000000-0000-0000-0000-000000000001");
    private static final UUID OTHER_USER_ID = UUID.fromString("10000000-0000-0000-0000-000000000002");

    @Autowired
    private ReviewRecordRepository recordRepository;

    @Autowired
    private ReviewEventRepository eventRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("findDue returns only due records of the user, most overdue first, capped by limit")
    void findDue_orderAndLimit() {
        ReviewRecord oneHour = persist(USER_ID, 1L, NOW.minus(Duration.ofHours(1)));
        ReviewRecord threeDays = persist(USER_ID, 2L, NOW.minus(Duration.ofDays(3)));
        ReviewRecord exactlyNow = persist(USER_ID, 3L, NOW);
        persist(USER_ID, 4L, NOW.plus(Duration.ofMinutes(1)));
        persist(OTHER_USER_ID, 5L, NOW.minus(Duration.ofDays(10)));
        entityManager.flush();

        List<ReviewRecord> due = recordRepository.findDue(USER_ID, NOW, PageRequest.of(0, 10));
        assertThat(due).extracting(ReviewRecord::getId)
                .containsExactly(threeDays.getId(), oneHour.getId(), exactlyNow.getId());

        assertThat(recordRepository.findDue(USER_ID, NOW, PageRequest.of(0, 2))).hasSize(2);
    }

    @Test
    @DisplayName("a user cannot hold two records for the same content item")
    void uniqueUserContent() {
        persist(USER_ID, 42L, NOW);
        entityManager.flush();

        ReviewRecord duplicate = newRecord(USER_ID, 42L, NOW);
        assertThatThrownBy(() -> recordRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("same content id under another type or user is a distinct record")
    void uniqueKeyIncludesTypeAndUser() {
        persist(USER_ID, 42L, NOW);
        ReviewRecord other = newRecord(USER_ID, 42L, NOW);
        other.setContentType(ReviewContentType.KNOWLEDGE_POINT);
        recordRepository.saveAndFlush(other);
        recordRepository.saveAndFlush(newRecord(OTHER_USER_ID, 42L, NOW));

        assertThat(recordRepository.countByUserId(USER_ID)).isEqualTo(2);
        assertThat(recordRepository.findByUserIdAndContentIdAndContentType(USER_ID, 42L, ReviewContentType.KNOWLEDGE_POINT))
                .isPresent();
    }

    @Test
    @DisplayName("reminder candidates skip records with reminders disabled")
    void findReminderCandidates_skipsDisabled() {
        ReviewRecord enabled = persist(USER_ID, 1L, NOW.minus(Duration.ofHours(1)));
        ReviewRecord disabled = persist(USER_ID, 2L, NOW.minus(Duration.ofHours(1)));
        disabled.setReminderEnabled(false);
        persist(USER_ID, 3L, NOW.plus(Duration.ofHours(5)));
        entityManager.flush();

        assertThat(recordRepository.findReminderCandidates(USER_ID, NOW.plus(Duration.ofHours(2))))
                .extracting(ReviewRecord::getId)
                .containsExactly(enabled.getId());
    }

    @Test
    @DisplayName("statistics counts and average ease factor")
    void countsAndAverage() {
        ReviewRecord overdue = persist(USER_ID, 1L, NOW.minus(Duration.ofDays(2)));
        overdue.setEaseFactor(2.0);
        persist(USER_ID, 2L, NOW.minus(Duration.ofHours(2)));
        persist(USER_ID, 3L, NOW.plus(Duration.ofDays(5)));
        entityManager.flush();

        assertThat(recordRepository.countByUserIdAndNextReviewAtLessThanEqual(USER_ID, NOW)).isEqualTo(2);
        assertThat(recordRepository.countByUserIdAndNextReviewAtLessThanEqual(USER_ID, NOW.minus(Duration.ofDays(1))))
                .isEqualTo(1);
        assertThat(recordRepository.countByUserIdAndNextReviewAtBefore(USER_ID, NOW.plus(Duration.ofDays(7))))
                .isEqualTo(3);
        assertThat(recordRepository.averageEaseFactor(USER_ID)).isEqualTo(7.0 / 3, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(recordRepository.averageEaseFactor(OTHER_USER_ID)).isNull();
    }

    @Test
    @DisplayName("deleteByRecordId removes only that record's events")
    void deleteEventsByRecord() {
        ReviewRecord a = persist(USER_ID, 1L, NOW);
        ReviewRecord b = persist(USER_ID, 2L, NOW);
        persistEvent(a, NOW.minus(Duration.ofDays(1)));
        persistEvent(a, NOW);
        persistEvent(b, NOW);
        entityManager.flush();

        assertThat(eventRepository.deleteByRecordId(a.getId())).isEqualTo(2);
        assertThat(eventRepository.count()).isEqualTo(1);
        assertThat(eventRepository.findReviewTimestampsSince(USER_ID, NOW.minus(Duration.ofDays(30)))).containsExactly(NOW);
    }

    @Test
    @DisplayName("idempotency keys are unique per user, not globally")
    void idempotencyKeyScopedToUser() {
        UUID key = UUID.randomUUID();
        ReviewRecord mine = persist(USER_ID, 1L, NOW);
        ReviewRecord theirs = persist(OTHER_USER_ID, 1L, NOW);
        ReviewEvent theirEvent = newEvent(theirs, NOW);
        theirEvent.setIdempotencyKey(key);
        eventRepository.saveAndFlush(theirEvent);

        ReviewEvent myEvent = newEvent(mine, NOW);
        myEvent.setIdempotencyKey(key);
        eventRepository.saveAndFlush(myEvent);

        assertThat(eventRepository.findByUserIdAndIdempotencyKey(USER_ID, key))
                .map(ReviewEvent::getId)
                .contains(myEvent.getId());
        assertThat(eventRepository.findByUserIdAndIdempotencyKey(OTHER_USER_ID, key))
                .map(ReviewEvent::getId)
                .contains(theirEvent.getId());

        ReviewEvent reused = newEvent(mine, NOW.plus(Duration.ofDays(1)));
        reused.setIdempotencyKey(key);
        assertThatThrownBy(() -> eventRepository.saveAndFlush(reused))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("persisting without clock-supplied timestamps fails fast")
    void missingTimestampsRejected() {
        ReviewRecord record = newRecord(USER_ID, 1L, NOW);
        record.setCreatedAt(null);
        assertThatThrownBy(() -> entityManager.persist(record))
                .hasMessageContaining("createdAt");

        ReviewRecord saved = persist(USER_ID, 2L, NOW);
        ReviewEvent event = newEvent(saved, NOW);
        event.setReviewedAt(null);
        assertThatThrownBy(() -> entityManager.persist(event))
                .hasMessageContaining("reviewedAt");
    }

    private ReviewRecord persist(UUID userId, Long contentId, Instant nextReviewAt) {
        return entityManager.persist(newRecord(userId, contentId, nextReviewAt));
    }

    private static ReviewRecord newRecord(UUID userId, Long contentId, Instant nextReviewAt) {
        ReviewRecord record = new ReviewRecord();
        record.setUserId(userId);
        record.setContentId(contentId);
        record.setContentType(ReviewContentType.QUESTION);
        record.setNextReviewAt(nextReviewAt);
        record.setCreatedAt(NOW.minus(Duration.ofDays(30)));
        record.setUpdatedAt(NOW.minus(Duration.ofDays(30)));
        return record;
    }

    private void persistEvent(ReviewRecord record, Instant reviewedAt) {
        entityManager.persist(newEvent(record, reviewedAt));
    }

    private static ReviewEvent newEvent(ReviewRecord record, Instant reviewedAt) {
        ReviewEvent event = new ReviewEvent();
        event.setUserId(record.getUserId());
        event.setRecord(record);
        event.setContentType(record.getContentType());
        event.setContentId(record.getContentId());
        event.setQuality(4);
        event.setReviewedAt(reviewedAt);
        event.setPreviousIntervalDays(0);
        event.setIntervalDays(1);
        event.setPreviousEaseFactor(2.5);
        event.setEaseFactor(2.5);
        event.setReviewCount(1);
        event.setFirstReview(Boolean.FALSE);
        return event;
    }
}
