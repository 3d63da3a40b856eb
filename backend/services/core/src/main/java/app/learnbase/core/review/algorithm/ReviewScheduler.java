package app.learnbase.core.review.algorithm;

import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.review.domain.Rating;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Computes the next review of a note from a rating. Implementations are pure:
 * the current time is passed in and nothing is read or written.
 */
public interface ReviewScheduler {

    ReviewMode mode();

    ScheduleResult apply(ScheduleInput input, Rating rating, Instant now);

    default Map<Rating, ScheduleResult> preview(ScheduleInput input, Instant now) {
        Map<Rating, ScheduleResult> out = new EnumMap<>(Rating.class);
        for (Rating r : Rating.values()) {
            out.put(r, apply(input, r, now));
        }
        return out;
    }

    record ScheduleInput(
            int intervalDays,
            double easeFactor,
            int reviewCount,
            String schedulePattern
    ) {
    }

    record ScheduleResult(
            Instant nextReview,
            int intervalDays,
            double easeFactor
    ) {
    }
}
