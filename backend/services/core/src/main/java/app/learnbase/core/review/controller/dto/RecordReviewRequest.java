package app.learnbase.core.review.controller.dto;

import jakarta.validation.constraints.NotNull;

public record RecordReviewRequest(
        @NotNull Integer rating
) {}
