package uk.gegc.reviewscheduler.features.review.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReviewEventRepository extends JpaRepository<ReviewEvent, UUID> {

    Optional<ReviewEvent> findByUserIdAndIdempotencyKey(UUID userId, UUID idempotencyKey);

    Page<ReviewEvent> findByUserIdOrderByReviewedAtDesc(UUID userId, Pageable pageable);

    List<ReviewEvent> findByUserIdAndReviewedAtGreaterThanEqualAndReviewedAtBeforeOrderByReviewedAtAsc(
            UUID userId, Instant from, Instant to);

    @Query("select e.reviewedAt from ReviewEvent e where e.userId = :userId and e.reviewedAt >= :since")
    List<Instant> findReviewTimestampsSince(@Param("userId") UUID userId, @Param("since") Instant since);

    @Modifying
    @Query("delete from ReviewEvent e where e.record.id = :recordId")
    int deleteByRecordId(@Param("recordId") UUID recordId);
}
