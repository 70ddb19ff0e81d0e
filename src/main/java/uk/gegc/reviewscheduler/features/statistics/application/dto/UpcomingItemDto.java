package uk.gegc.reviewscheduler.features.statistics.application.dto;

import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;

import java.time.Instant;
import java.util.UUID;

public record UpcomingItemDto(
        UUID recordId,
        Long contentId,
        ReviewContentType contentType,
        Instant nextReviewAt,
        Integer intervalDays
) {
}
