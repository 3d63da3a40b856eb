package app.learnbase.core.review.controller.dto;

import java.time.Instant;

public record ReviewOutcomeResponse(
        String filename,
        int rating,
        Instant nextReview,
        int newIntervalDays,
        double newEaseFactor,
        int reviewCount
) {
}
