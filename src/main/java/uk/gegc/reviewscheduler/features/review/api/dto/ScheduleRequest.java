package uk.gegc.reviewscheduler.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.reviewscheduler.features.review.domain.model.ReviewContentType;

@Schema(name = "ScheduleRequest", description = "Content item to put under review")
public record ScheduleRequest(
        @Schema(description = "Content item ID", example = "42", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull Long contentId,
        @Schema(description = "question or knowledge_point", example = "question", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull ReviewContentType contentType
) {
}
