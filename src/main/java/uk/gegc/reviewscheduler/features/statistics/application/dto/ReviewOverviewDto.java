package uk.gegc.reviewscheduler.features.statistics.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;

@Schema(name = "ReviewOverviewDto", description = "Review statistics for the current review day")
public record ReviewOverviewDto(
        @Schema(description = "Current review day in the requested zone")
        LocalDate today,
        @Schema(description = "Records due now, overdue included")
        long dueToday,
        @Schema(description = "Records at least one whole day past their review time")
        long overdue,
        @Schema(description = "Records last reviewed during the current review day")
        long completedToday,
        @Schema(description = "Records due before the start of the day one week from today, overdue included")
        long dueThisWeek,
        @Schema(description = "Mean ease factor over all records, 0 when there are none")
        double averageEaseFactor,
        @Schema(description = "Consecutive review days with at least one review")
        int learningStreak,
        @Schema(description = "Total scheduled records")
        long totalItems
) {
}
