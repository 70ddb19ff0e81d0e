package uk.gegc.reviewscheduler.features.review.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(
        name = "review_record",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_review_record_user_content",
                        columnNames = {"user_id", "content_id", "content_type"}
                )
        },
        indexes = {
                @Index(name = "idx_review_record_user_next_review", columnList = "user_id, next_review_at")
        }
)
public class ReviewRecord {

    public static final double INITIAL_EASE_FACTOR = 2.5;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "content_id", nullable = false, updatable = false)
    private Long contentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, updatable = false, length = 20)
    private ReviewContentType contentType;

    @Column(name = "review_count", nullable = false)
    private Integer reviewCount = 0;

    @Column(name = "ease_factor", nullable = false)
    private Double easeFactor = INITIAL_EASE_FACTOR;

    @Column(name = "interval_days", nullable = false)
    private Integer intervalDays = 0;

    @Column(name = "last_reviewed_at")
    private Instant lastReviewedAt;

    @Column(name = "next_review_at", nullable = false)
    private Instant nextReviewAt;

    @Column(name = "last_quality")
    private Integer lastQuality;

    @Column(name = "reminder_enabled", nullable = false)
    private Boolean reminderEnabled = Boolean.TRUE;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    private void requireTimestamps() {
        if (createdAt == null || updatedAt == null || nextReviewAt == null) {
            throw new IllegalStateException(
                    "Review record timestamps (createdAt, updatedAt, nextReviewAt) must be set from the clock before persisting");
        }
    }

    public boolean isOwnedBy(UUID candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }
}
