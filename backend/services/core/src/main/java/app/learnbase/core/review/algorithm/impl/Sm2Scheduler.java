package app.learnbase.core.review.algorithm.impl;

import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.review.algorithm.ReviewScheduler;
import app.learnbase.core.review.domain.Rating;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Simplified SM-2 used by {@code spaced} notes.
 * <p>
 * An excellent rating grows the interval by a flat 2.5x regardless of ease;
 * only the good rating compounds through the ease factor.
 */
@Component
public class Sm2Scheduler implements ReviewScheduler {

    public static final double EASE_FACTOR_MIN = 1.3;
    public static final double EASE_FACTOR_MAX = 3.0;

    static final double EASE_DECREASE_POOR = 0.2;
    static final double EASE_DECREASE_FAIR = 0.15;
    static final double EASE_INCREASE_EXCELLENT = 0.15;

    static final int INTERVAL_RESET_POOR = 1;
    static final double INTERVAL_REDUCE_FAIR = 0.5;
    static final double INTERVAL_EXCELLENT_MULTIPLIER = 2.5;
    static final int MIN_INTERVAL_DAYS = 1;

    @Override
    public ReviewMode mode() {
        return ReviewMode.SPACED;
    }

    @Override
    public ScheduleResult apply(ScheduleInput input, Rating rating, Instant now) {
        double ef = input.easeFactor();
        int interval = Math.max(0, input.intervalDays());

        double newEase = switch (rating) {
            case POOR -> ef - EASE_DECREASE_POOR;
            case FAIR -> ef - EASE_DECREASE_FAIR;
            case GOOD -> ef;
            case EXCELLENT -> ef + EASE_INCREASE_EXCELLENT;
        };
        newEase = clamp(newEase, EASE_FACTOR_MIN, EASE_FACTOR_MAX);

        long newInterval = switch (rating) {
            case POOR -> INTERVAL_RESET_POOR;
            case FAIR -> Math.round(interval * INTERVAL_REDUCE_FAIR);
            case GOOD -> Math.round(interval * ef);
            case EXCELLENT -> Math.round(interval * INTERVAL_EXCELLENT_MULTIPLIER);
        };
        int days = (int) Math.min(Integer.MAX_VALUE, Math.max(MIN_INTERVAL_DAYS, newInterval));

        return new ScheduleResult(now.plus(days, ChronoUnit.DAYS), days, newEase);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
