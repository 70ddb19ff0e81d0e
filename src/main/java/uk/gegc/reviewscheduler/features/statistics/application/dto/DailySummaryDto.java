package uk.gegc.reviewscheduler.features.statistics.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDate;

@Schema(name = "DailySummaryDto", description = "Review activity of one review day")
public record DailySummaryDto(
        @Schema(description = "Review day")
        LocalDate date,
        @Schema(description = "Reviews completed that day")
        long reviewsCompleted,
        @Schema(description = "Records due before the end of that day")
        long reviewsDue,
        @Schema(description = "Mean quality of that day's reviews, null when none")
        Double averageQuality,
        @Schema(description = "First-time reviews that day")
        long newItemsLearned,
        @Schema(description = "Records that become due during the following day")
        long dueNextDay,
        @Schema(description = "completed / max(1, completed + due) * 100")
        double completionRate
) {
}
