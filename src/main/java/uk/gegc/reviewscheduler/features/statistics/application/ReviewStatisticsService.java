package uk.gegc.reviewscheduler.features.statistics.application;

import uk.gegc.reviewscheduler.features.statistics.application.dto.DailySummaryDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.ReviewOverviewDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.UpcomingReviewsDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.WeeklySummaryDto;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Read-only aggregates over review records and review events. {@code timeZone} and {@code dayCutoffMinutes}
 * override the configured review-day boundary; null keeps the default.
 */
public interface ReviewStatisticsService {

    ReviewOverviewDto overview(UUID userId, String timeZone, Integer dayCutoffMinutes);

    int learningStreak(UUID userId, String timeZone, Integer dayCutoffMinutes);

    UpcomingReviewsDto upcoming(UUID userId, Integer days, String timeZone, Integer dayCutoffMinutes);

    /**
     * @param date review day to summarise; null means the current review day
     */
    DailySummaryDto dailySummary(UUID userId, LocalDate date, String timeZone, Integer dayCutoffMinutes);

    /**
     * @param week any date inside the week to summarise; null means the current week
     */
    WeeklySummaryDto weeklySummary(UUID userId, LocalDate week, String timeZone, Integer dayCutoffMinutes);
}
