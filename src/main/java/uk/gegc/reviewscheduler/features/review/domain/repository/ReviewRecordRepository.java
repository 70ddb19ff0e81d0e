package uk.gegc.reviewscheduler.features.review.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReviewRecordRepository extends JpaRepository<ReviewRecord, UUID> {

    Optional<ReviewRecord> findByUserIdAndContentIdAndContentType(UUID userId, Long contentId, ReviewContentType contentType);

    /**
     * Due records, most overdue first. Ordering by nextReviewAt ascending is the same as ordering by
     * days overdue descending; the id tie-break keeps paging stable.
     */
    @Query("""
            select r from ReviewRecord r
            where r.userId = :userId
              and r.nextReviewAt <= :now
            order by r.nextReviewAt asc, r.id asc
            """)
    List<ReviewRecord> findDue(@Param("userId") UUID userId, @Param("now") Instant now, Pageable pageable);

    @Query("""
            select r from ReviewRecord r
            where r.userId = :userId
              and r.nextReviewAt > :from
              and r.nextReviewAt <= :to
            order by r.nextReviewAt asc, r.id asc
            """)
    List<ReviewRecord> findUpcoming(@Param("userId") UUID userId, @Param("from") Instant from, @Param("to") Instant to);

    @Query("""
            select r from ReviewRecord r
            where r.userId = :userId
              and r.reminderEnabled = true
              and r.nextReviewAt <= :horizon
            order by r.nextReviewAt asc, r.id asc
            """)
    List<ReviewRecord> findReminderCandidates(@Param("userId") UUID userId, @Param("horizon") Instant horizon);

    long countByUserId(UUID userId);

    long countByUserIdAndNextReviewAtLessThanEqual(UUID userId, Instant instant);

    long countByUserIdAndNextReviewAtBefore(UUID userId, Instant instant);

    long countByUserIdAndNextReviewAtGreaterThanEqualAndNextReviewAtBefore(UUID userId, Instant from, Instant to);

    long countByUserIdAndLastReviewedAtGreaterThanEqualAndLastReviewedAtBefore(UUID userId, Instant from, Instant to);

    @Query("select avg(r.easeFactor) from ReviewRecord r where r.userId = :userId")
    Double averageEaseFactor(@Param("userId") UUID userId);
}
