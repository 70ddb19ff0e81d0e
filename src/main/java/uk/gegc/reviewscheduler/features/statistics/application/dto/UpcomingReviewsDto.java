package uk.gegc.reviewscheduler.features.statistics.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "UpcomingReviewsDto", description = "Reviews scheduled in the next days, grouped by review day")
public record UpcomingReviewsDto(
        @Schema(description = "Look-ahead in days")
        int days,
        @Schema(description = "Number of upcoming reviews")
        int totalCount,
        @Schema(description = "Review days in ascending order; days without reviews are omitted")
        List<UpcomingDayDto> byDate
) {
}
