package app.learnbase.core.review.controller.dto;

import app.learnbase.core.note.domain.ReviewMode;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record PreviewRequest(
        @NotNull Integer rating,
        @NotNull @PositiveOrZero Integer intervalDays,
        @NotNull Double easeFactor,
        ReviewMode reviewMode,
        @PositiveOrZero Integer reviewCount,
        String schedulePattern
) {}
