package uk.gegc.reviewscheduler.features.review.application.dto;

import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;

/**
 * Result of a completion. {@code replayed} is true when the call matched an already applied completion
 * and left the record untouched.
 */
public record ReviewOutcome(ReviewRecord record, boolean replayed) {
}
