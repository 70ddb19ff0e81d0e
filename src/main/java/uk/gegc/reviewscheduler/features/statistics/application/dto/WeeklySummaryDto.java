package uk.gegc.reviewscheduler.features.statistics.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;
import java.util.List;

@Schema(name = "WeeklySummaryDto", description = "Review activity of one Monday-based week")
public record WeeklySummaryDto(
        @Schema(description = "Monday of the week")
        LocalDate weekStart,
        @Schema(description = "Sunday of the week")
        LocalDate weekEnd,
        @Schema(description = "Seven daily summaries, Monday first")
        List<DailySummaryDto> dailySummaries,
        @Schema(description = "Reviews completed during the week")
        long totalCompleted,
        @Schema(description = "Days with at least one review")
        int daysActive,
        @Schema(description = "totalCompleted / 7")
        double averageDailyReviews,
        @Schema(description = "Mean quality over the week's reviews, null when none")
        Double averageQuality
) {
}
