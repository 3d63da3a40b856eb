package app.learnbase.core.review.controller.dto;

import app.learnbase.core.note.domain.ReviewMode;

import java.time.Instant;

public record DueNoteResponse(
        String filename,
        String title,
        Long daysSinceLastReview,
        int intervalDays,
        double easeFactor,
        ReviewMode reviewMode,
        Instant nextReview,
        int reviewCount
) {
}
