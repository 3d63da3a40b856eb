package app.learnbase.core.review.controller.dto;

import app.learnbase.core.review.algorithm.ReviewScheduler.ScheduleResult;

import java.time.Instant;

public record NextReviewResponse(
        Instant nextReview,
        int newIntervalDays,
        double newEaseFactor
) {
    public static NextReviewResponse from(ScheduleResult result) {
        return new NextReviewResponse(result.nextReview(), result.intervalDays(), result.easeFactor());
    }
}
