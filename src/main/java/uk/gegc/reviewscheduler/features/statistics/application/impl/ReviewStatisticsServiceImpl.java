package uk.gegc.reviewscheduler.features.statistics.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reviewscheduler.features.review.config.ReviewProperties;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewEvent;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;
import uk.gegc.reviewscheduler.features.review.domain.repository.ReviewEventRepository;
import uk.gegc.reviewscheduler.features.review.domain.repository.ReviewRecordRepository;
import uk.gegc.reviewscheduler.features.statistics.application.ReviewCalendar;
import uk.gegc.reviewscheduler.features.statistics.application.ReviewStatisticsService;
import uk.gegc.reviewscheduler.features.statistics.application.dto.DailySummaryDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.ReviewOverviewDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.UpcomingDayDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.UpcomingItemDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.UpcomingReviewsDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.WeeklySummaryDto;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReviewStatisticsServiceImpl implements ReviewStatisticsService {

    static final int MAX_STREAK_DAYS = 366;
    static final int DEFAULT_UPCOMING_DAYS = 7;
    static final int MAX_UPCOMING_DAYS = 30;
    private static final int DAYS_PER_WEEK = 7;

    private final Clock clock;
    private final ReviewRecordRepository recordRepository;
    private final ReviewEventRepository eventRepository;
    private final ReviewProperties properties;

    @Override
    public ReviewOverviewDto overview(UUID userId, String timeZone, Integer dayCutoffMinutes) {
        ReviewCalendar calendar = calendar(timeZone, dayCutoffMinutes);
        Instant now = Instant.now(clock);
        LocalDate today = calendar.reviewDayDate(now);

        long dueToday = recordRepository.countByUserIdAndNextReviewAtLessThanEqual(userId, now);
        long overdue = recordRepository.countByUserIdAndNextReviewAtLessThanEqual(userId, now.minus(Duration.ofDays(1)));
        long completedToday = recordRepository.countByUserIdAndLastReviewedAtGreaterThanEqualAndLastReviewedAtBefore(
                userId, calendar.dayStart(today), calendar.dayEnd(today));
        long dueThisWeek = recordRepository.countByUserIdAndNextReviewAtBefore(
                userId, calendar.dayStart(today.plusDays(DAYS_PER_WEEK)));
        Double averageEase = recordRepository.averageEaseFactor(userId);
        long totalItems = recordRepository.countByUserId(userId);

        return new ReviewOverviewDto(
                today,
                dueToday,
                overdue,
                completedToday,
                dueThisWeek,
                averageEase == null ? 0.0 : round2(averageEase),
                streak(userId, calendar, now),
                totalItems
        );
    }

    @Override
    public int learningStreak(UUID userId, String timeZone, Integer dayCutoffMinutes) {
        return streak(userId, calendar(timeZone, dayCutoffMinutes), Instant.now(clock));
    }

    @Override
    public UpcomingReviewsDto upcoming(UUID userId, Integer days, String timeZone, Integer dayCutoffMinutes) {
        int lookAhead = days == null ? DEFAULT_UPCOMING_DAYS : days;
        if (lookAhead < 1 || lookAhead > MAX_UPCOMING_DAYS) {
            throw new IllegalArgumentException("Days must be between 1 and " + MAX_UPCOMING_DAYS);
        }
        ReviewCalendar calendar = calendar(timeZone, dayCutoffMinutes);
        Instant now = Instant.now(clock);

        List<ReviewRecord> records = recordRepository.findUpcoming(userId, now, now.plus(lookAhead, ChronoUnit.DAYS));

        Map<LocalDate, List<UpcomingItemDto>> byDate = new TreeMap<>();
        for (ReviewRecord record : records) {
            LocalDate date = calendar.reviewDayDate(record.getNextReviewAt());
            byDate.computeIfAbsent(date, d -> new ArrayList<>()).add(new UpcomingItemDto(
                    record.getId(),
                    record.getContentId(),
                    record.getContentType(),
                    record.getNextReviewAt(),
                    record.getIntervalDays()
            ));
        }

        List<UpcomingDayDto> groups = byDate.entrySet().stream()
                .map(entry -> new UpcomingDayDto(entry.getKey(), entry.getValue().size(), List.copyOf(entry.getValue())))
                .toList();
        return new UpcomingReviewsDto(lookAhead, records.size(), groups);
    }

    @Override
    public DailySummaryDto dailySummary(UUID userId, LocalDate date, String timeZone, Integer dayCutoffMinutes) {
        ReviewCalendar calendar = calendar(timeZone, dayCutoffMinutes);
        LocalDate day = date != null ? date : calendar.reviewDayDate(Instant.now(clock));
        List<ReviewEvent> events = eventsBetween(userId, calendar.dayStart(day), calendar.dayEnd(day));
        return summarise(userId, day, events, calendar);
    }

    @Override
    public WeeklySummaryDto weeklySummary(UUID userId, LocalDate week, String timeZone, Integer dayCutoffMinutes) {
        ReviewCalendar calendar = calendar(timeZone, dayCutoffMinutes);
        LocalDate anchor = week != null ? week : calendar.reviewDayDate(Instant.now(clock));
        LocalDate monday = anchor.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate sunday = monday.plusDays(DAYS_PER_WEEK - 1L);

        List<ReviewEvent> weekEvents = eventsBetween(userId, calendar.dayStart(monday), calendar.dayEnd(sunday));

        List<DailySummaryDto> dailies = new ArrayList<>(DAYS_PER_WEEK);
        for (int i = 0; i < DAYS_PER_WEEK; i++) {
            LocalDate day = monday.plusDays(i);
            Instant start = calendar.dayStart(day);
            Instant end = calendar.dayEnd(day);
            List<ReviewEvent> dayEvents = weekEvents.stream()
                    .filter(e -> !e.getReviewedAt().isBefore(start) && e.getReviewedAt().isBefore(end))
                    .toList();
            dailies.add(summarise(userId, day, dayEvents, calendar));
        }

        long totalCompleted = weekEvents.size();
        int daysActive = (int) dailies.stream().filter(d -> d.reviewsCompleted() > 0).count();

        return new WeeklySummaryDto(
                monday,
                sunday,
                dailies,
                totalCompleted,
                daysActive,
                round2((double) totalCompleted / DAYS_PER_WEEK),
                averageQuality(weekEvents)
        );
    }

    private DailySummaryDto summarise(UUID userId, LocalDate day, List<ReviewEvent> events, ReviewCalendar calendar) {
        Instant end = calendar.dayEnd(day);
        long completed = events.size();
        long due = recordRepository.countByUserIdAndNextReviewAtBefore(userId, end);
        long dueNextDay = recordRepository.countByUserIdAndNextReviewAtGreaterThanEqualAndNextReviewAtBefore(
                userId, end, calendar.dayEnd(day.plusDays(1)));
        long newItems = events.stream().filter(e -> Boolean.TRUE.equals(e.getFirstReview())).count();
        double completionRate = round2(completed * 100.0 / Math.max(1, completed + due));

        return new DailySummaryDto(day, completed, due, averageQuality(events), newItems, dueNextDay, completionRate);
    }

    private int streak(UUID userId, ReviewCalendar calendar, Instant now) {
        LocalDate today = calendar.reviewDayDate(now);
        Instant since = calendar.dayStart(today.minusDays(MAX_STREAK_DAYS - 1L));

        Set<LocalDate> activeDays = new HashSet<>();
        for (Instant reviewedAt : eventRepository.findReviewTimestampsSince(userId, since)) {
            activeDays.add(calendar.reviewDayDate(reviewedAt));
        }

        // an empty today does not break the streak until the day is over
        LocalDate cursor = activeDays.contains(today) ? today : today.minusDays(1);
        int streak = 0;
        while (streak < MAX_STREAK_DAYS && activeDays.contains(cursor)) {
            streak++;
            cursor = cursor.minusDays(1);
        }
        log.debug("Learning streak for user {} is {} days", userId, streak);
        return streak;
    }

    private List<ReviewEvent> eventsBetween(UUID userId, Instant from, Instant to) {
        return eventRepository.findByUserIdAndReviewedAtGreaterThanEqualAndReviewedAtBeforeOrderByReviewedAtAsc(
                userId, from, to);
    }

    private ReviewCalendar calendar(String timeZone, Integer dayCutoffMinutes) {
        return ReviewCalendar.resolve(timeZone, dayCutoffMinutes, properties.getCalendar());
    }

    private static Double averageQuality(List<ReviewEvent> events) {
        if (events.isEmpty()) {
            return null;
        }
        double sum = events.stream().mapToInt(ReviewEvent::getQuality).sum();
        return round2(sum / events.size());
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
