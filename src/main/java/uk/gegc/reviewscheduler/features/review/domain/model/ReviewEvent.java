package uk.gegc.reviewscheduler.features.review.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only log row written for every applied review completion.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "review_event",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_review_event_user_idempotency_key",
                columnNames = {"user_id", "idempotency_key"}
        ),
        indexes = {
                @Index(name = "idx_review_event_user_reviewed_at", columnList = "user_id, reviewed_at"),
                @Index(name = "idx_review_event_record", columnList = "record_id")
        }
)
public class ReviewEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "record_id", referencedColumnName = "id", nullable = false, updatable = false)
    private ReviewRecord record;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, updatable = false, length = 20)
    private ReviewContentType contentType;

    @Column(name = "content_id", nullable = false, updatable = false)
    private Long contentId;

    @Column(name = "quality", nullable = false, updatable = false)
    private Integer quality;

    @Column(name = "reviewed_at", nullable = false, updatable = false)
    private Instant reviewedAt;

    @Column(name = "previous_interval_days", nullable = false, updatable = false)
    private Integer previousIntervalDays;

    @Column(name = "interval_days", nullable = false, updatable = false)
    private Integer intervalDays;

    @Column(name = "previous_ease_factor", nullable = false, updatable = false)
    private Double previousEaseFactor;

    @Column(name = "ease_factor", nullable = false, updatable = false)
    private Double easeFactor;

    @Column(name = "review_count", nullable = false, updatable = false)
    private Integer reviewCount;

    @Column(name = "first_review", nullable = false, updatable = false)
    private Boolean firstReview;

    @Column(name = "idempotency_key", updatable = false)
    private UUID idempotencyKey;

    @PrePersist
    private void requireReviewedAt() {
        if (reviewedAt == null) {
            throw new IllegalStateException("Review event reviewedAt must be set from the clock before persisting");
        }
    }
}
