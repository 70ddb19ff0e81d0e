package uk.gegc.reviewscheduler.features.review.application.dto;

import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;

public record ScheduleItem(Long contentId, ReviewContentType contentType) {
}
