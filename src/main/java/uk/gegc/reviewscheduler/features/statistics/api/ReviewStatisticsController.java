package uk.gegc.reviewscheduler.features.statistics.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.reviewscheduler.features.statistics.application.ReviewStatisticsService;
import uk.gegc.reviewscheduler.features.statistics.application.dto.DailySummaryDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.ReviewOverviewDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.UpcomingReviewsDto;
import uk.gegc.reviewscheduler.features.statistics.application.dto.WeeklySummaryDto;
import uk.gegc.reviewscheduler.shared.security.AuthenticatedUserResolver;

import java.time.LocalDate;
import java.util.UUID;

@Tag(name = "Review Statistics", description = "Review overview, streak, upcoming reviews and summaries")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1/review")
@RequiredArgsConstructor
@Validated
public class ReviewStatisticsController {

    private final ReviewStatisticsService statisticsService;
    private final AuthenticatedUserResolver userResolver;

    @GetMapping("/statistics")
    @Operation(summary = "Get review overview",
            description = "Due, overdue, completed-today and due-this-week counts, average ease factor and learning streak.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Overview",
                    content = @Content(schema = @Schema(implementation = ReviewOverviewDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid time zone or day cutoff",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReviewOverviewDto> getStatistics(
            @Parameter(description = "IANA time zone, e.g. Europe/London") @RequestParam(required = false) String timeZone,
            @Parameter(description = "Minutes past midnight at which a review day starts") @RequestParam(required = false) Integer dayCutoffMinutes,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        return ResponseEntity.ok(statisticsService.overview(userId, timeZone, dayCutoffMinutes));
    }

    @GetMapping("/upcoming")
    @Operation(summary = "Get upcoming reviews", description = "Reviews due in the next 1 to 30 days, grouped by review day.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Upcoming reviews",
                    content = @Content(schema = @Schema(implementation = UpcomingReviewsDto.class))),
            @ApiResponse(responseCode = "400", description = "Days outside 1..30",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<UpcomingReviewsDto> getUpcoming(
            @Parameter(description = "Look-ahead in days", example = "7") @RequestParam(defaultValue = "7") Integer days,
            @RequestParam(required = false) String timeZone,
            @RequestParam(required = false) Integer dayCutoffMinutes,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        return ResponseEntity.ok(statisticsService.upcoming(userId, days, timeZone, dayCutoffMinutes));
    }

    @GetMapping("/summary/daily")
    @Operation(summary = "Get daily summary", description = "Defaults to the current review day.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Daily summary",
                    content = @Content(schema = @Schema(implementation = DailySummaryDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid date, time zone or day cutoff",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<DailySummaryDto> getDailySummary(
            @Parameter(description = "Review day (ISO date)", example = "2025-01-15")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String timeZone,
            @RequestParam(required = false) Integer dayCutoffMinutes,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        return ResponseEntity.ok(statisticsService.dailySummary(userId, date, timeZone, dayCutoffMinutes));
    }

    @GetMapping("/summary/weekly")
    @Operation(summary = "Get weekly summary", description = "Monday-based week containing the given date; defaults to the current week.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Weekly summary",
                    content = @Content(schema = @Schema(implementation = WeeklySummaryDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid date, time zone or day cutoff",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<WeeklySummaryDto> getWeeklySummary(
            @Parameter(description = "Any date inside the week (ISO date)", example = "2025-01-15")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate week,
            @RequestParam(required = false) String timeZone,
            @RequestParam(required = false) Integer dayCutoffMinutes,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        return ResponseEntity.ok(statisticsService.weeklySummary(userId, week, timeZone, dayCutoffMinutes));
    }
}
