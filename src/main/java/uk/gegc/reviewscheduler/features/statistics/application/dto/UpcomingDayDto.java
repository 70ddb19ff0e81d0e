package uk.gegc.reviewscheduler.features.statistics.application.dto;

import java.time.LocalDate;
import java.util.List;

public record UpcomingDayDto(
        LocalDate date,
        int count,
        List<UpcomingItemDto> items
) {
}
