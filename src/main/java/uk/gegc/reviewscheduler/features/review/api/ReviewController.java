package uk.gegc.reviewscheduler.features.review.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.reviewscheduler.features.review.api.dto.BatchScheduleRequest;
import uk.gegc.reviewscheduler.features.review.api.dto.CompleteReviewRequest;
import uk.gegc.reviewscheduler.features.review.api.dto.CompleteReviewResponse;
import uk.gegc.reviewscheduler.features.review.api.dto.ReminderToggleRequest;
import uk.gegc.reviewscheduler.features.review.api.dto.ReminderToggleResponse;
import uk.gegc.reviewscheduler.features.review.api.dto.ScheduleRequest;
import uk.gegc.reviewscheduler.features.review.application.ReviewReminderService;
import uk.gegc.reviewscheduler.features.review.application.ReviewSchedulerService;
import uk.gegc.reviewscheduler.features.review.application.dto.ReminderDto;
import uk.gegc.reviewscheduler.features.review.application.dto.ReviewHistoryDto;
import uk.gegc.reviewscheduler.features.review.application.dto.ReviewOutcome;
import uk.gegc.reviewscheduler.features.review.application.dto.ReviewRecordDto;
import uk.gegc.reviewscheduler.features.review.application.dto.ScheduleItem;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewRecord;
import uk.gegc.reviewscheduler.features.review.infra.mapping.ReviewDtoMapper;
import uk.gegc.reviewscheduler.shared.security.AuthenticatedUserResolver;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Tag(name = "Review", description = "Spaced repetition scheduling, due list, completions and reminders")
@SecurityRequirement(name = "bearerAuth")
@RestController
@RequestMapping("/api/v1/review")
@RequiredArgsConstructor
@Validated
public class ReviewController {

    private final ReviewSchedulerService schedulerService;
    private final ReviewReminderService reminderService;
    private final ReviewDtoMapper mapper;
    private final AuthenticatedUserResolver userResolver;
    private final Clock clock;

    @PostMapping("/records")
    @Operation(
            summary = "Schedule a content item",
            description = "Creates the review record for the item, due immediately. Returns the existing record unchanged when already scheduled."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scheduled record",
                    content = @Content(schema = @Schema(implementation = ReviewRecordDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReviewRecordDto> schedule(
            @RequestBody @Valid ScheduleRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        ReviewRecord record = schedulerService.schedule(userId, request.contentId(), request.contentType());
        return ResponseEntity.ok(mapper.toRecordDto(record, Instant.now(clock)));
    }

    @PostMapping("/records/batch")
    @Operation(
            summary = "Schedule content items in bulk",
            description = "Used by the content pipeline right after it produces questions or knowledge points. At most 500 items."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Scheduled records, one per distinct item",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = ReviewRecordDto.class)))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<ReviewRecordDto>> scheduleBatch(
            @RequestBody @Valid BatchScheduleRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        List<ScheduleItem> items = request.items().stream()
                .map(item -> new ScheduleItem(item.contentId(), item.contentType()))
                .toList();
        Instant now = Instant.now(clock);
        List<ReviewRecordDto> records = schedulerService.scheduleBatch(userId, items).stream()
                .map(record -> mapper.toRecordDto(record, now))
                .toList();
        return ResponseEntity.ok(records);
    }

    @GetMapping("/records/{recordId}")
    @Operation(summary = "Get a review record with its current due status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review record",
                    content = @Content(schema = @Schema(implementation = ReviewRecordDto.class))),
            @ApiResponse(responseCode = "403", description = "Record belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Record not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReviewRecordDto> getRecord(
            @Parameter(description = "Review record ID", required = true)
            @PathVariable UUID recordId,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        ReviewRecord record = schedulerService.getRecord(userId, recordId);
        return ResponseEntity.ok(mapper.toRecordDto(record, Instant.now(clock)));
    }

    @DeleteMapping("/records/{recordId}")
    @Operation(summary = "Stop reviewing an item", description = "Deletes the record and its review history.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted"),
            @ApiResponse(responseCode = "403", description = "Record belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Record not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Void> delete(
            @Parameter(description = "Review record ID", required = true)
            @PathVariable UUID recordId,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        schedulerService.delete(userId, recordId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/due")
    @Operation(
            summary = "Get due review records",
            description = "Records with nextReviewAt at or before now, most overdue first, ties by nextReviewAt then id."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Due records",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = ReviewRecordDto.class)))),
            @ApiResponse(responseCode = "400", description = "Invalid limit",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<ReviewRecordDto>> getDue(
            @Parameter(description = "Maximum number of records", example = "50")
            @RequestParam(defaultValue = "50") @Min(1) @Max(200) int limit,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        Instant now = Instant.now(clock);
        List<ReviewRecordDto> due = schedulerService.listDue(userId, limit).stream()
                .map(record -> mapper.toRecordDto(record, now))
                .toList();
        return ResponseEntity.ok(due);
    }

    @PostMapping("/records/{recordId}/complete")
    @Operation(
            summary = "Complete a review",
            description = "Applies SM-2 to the record. A resubmission with the same idempotency key, or with the same quality within the replay window, returns the current state with replayed=true."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Review applied or replayed",
                    content = @Content(schema = @Schema(implementation = CompleteReviewResponse.class))),
            @ApiResponse(responseCode = "400", description = "Quality outside 0..5",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Record belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Record not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Concurrent or ambiguous completion",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CompleteReviewResponse> complete(
            @Parameter(description = "Review record ID", required = true)
            @PathVariable UUID recordId,
            @RequestBody @Valid CompleteReviewRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        ReviewOutcome outcome = schedulerService.completeReview(
                userId,
                recordId,
                request.quality(),
                request.idempotencyKey()
        );
        ReviewRecord record = outcome.record();
        return ResponseEntity.ok(new CompleteReviewResponse(
                record.getId(),
                record.getNextReviewAt(),
                record.getIntervalDays(),
                record.getReviewCount(),
                record.getEaseFactor(),
                record.getLastReviewedAt(),
                record.getLastQuality(),
                outcome.replayed()
        ));
    }

    @PutMapping("/records/{recordId}/reminder")
    @Operation(summary = "Enable or disable reminders for a record", description = "Does not affect the due list.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reminder state updated",
                    content = @Content(schema = @Schema(implementation = ReminderToggleResponse.class))),
            @ApiResponse(responseCode = "403", description = "Record belongs to another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Record not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReminderToggleResponse> setReminder(
            @Parameter(description = "Review record ID", required = true)
            @PathVariable UUID recordId,
            @RequestBody @Valid ReminderToggleRequest request,
            Authentication authentication
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        ReviewRecord record = schedulerService.setReminderEnabled(userId, recordId, request.enabled());
        return ResponseEntity.ok(new ReminderToggleResponse(record.getId(), record.getReminderEnabled()));
    }

    @GetMapping("/history")
    @Operation(summary = "Get review history", description = "Applied reviews ordered by reviewedAt DESC.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page of review history",
                    content = @Content(schema = @Schema(implementation = ReviewHistoryDto.class))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<Page<ReviewHistoryDto>> getHistory(
            Authentication authentication,
            @ParameterObject @PageableDefault(page = 0, size = 20) Pageable pageable
    ) {
        UUID userId = userResolver.resolveUserId(authentication);
        return ResponseEntity.ok(schedulerService.history(userId, pageable).map(mapper::toHistoryDto));
    }

    @GetMapping("/reminders")
    @Operation(
            summary = "Get review reminders",
            description = "Overdue (HIGH), due (NORMAL) and due-soon (LOW) records with reminders enabled."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Reminders",
                    content = @Content(array = @ArraySchema(schema = @Schema(implementation = ReminderDto.class)))),
            @ApiResponse(responseCode = "401", description = "Unauthorized",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<List<ReminderDto>> getReminders(Authentication authentication) {
        UUID userId = userResolver.resolveUserId(authentication);
        return ResponseEntity.ok(reminderService.reminders(userId));
    }
}
