package app.learnbase.core.review.algorithm.impl;

import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.review.algorithm.ReviewScheduler;
import app.learnbase.core.review.algorithm.SchedulePattern;
import app.learnbase.core.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * {@code scheduled} notes advance through their pattern one entry per completed
 * review. Rating and ease factor have no influence.
 */
@Component
public class FixedCadenceScheduler implements ReviewScheduler {

    @Override
    public ReviewMode mode() {
        return ReviewMode.SCHEDULED;
    }

    @Override
    public ScheduleResult apply(ScheduleInput input, Rating rating, Instant now) {
        SchedulePattern pattern = SchedulePattern.parse(input.schedulePattern());
        int days = pattern.intervalFor(input.reviewCount());
        return new ScheduleResult(now.plus(days, ChronoUnit.DAYS), days, input.easeFactor());
    }
}
