package app.learnbase.core.note.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frontmatter block of a note. Required fields are boxed so that a missing key
 * surfaces as a validation failure instead of a silent default.
 */
@JsonPropertyOrder({
        "title", "created", "review_mode", "schedule_pattern", "next_review", "last_reviewed",
        "interval_days", "ease_factor", "review_count", "question_performance", "priority_requests",
        "learned_content_count", "last_session_id"
})
public record NoteHeader(
        @NotBlank @Size(max = 200)
        @JsonProperty("title") String title,

        @NotNull
        @JsonProperty("created") Instant created,

        @NotNull
        @JsonProperty("review_mode") ReviewMode reviewMode,

        @JsonProperty("schedule_pattern") String schedulePattern,

        @NotNull
        @JsonProperty("next_review") Instant nextReview,

        @JsonProperty("last_reviewed") Instant lastReviewed,

        @NotNull @PositiveOrZero
        @JsonProperty("interval_days") Integer intervalDays,

        @NotNull
        @JsonProperty("ease_factor") Double easeFactor,

        @NotNull @PositiveOrZero
        @JsonProperty("review_count") Integer reviewCount,

        @JsonProperty("question_performance")
        Map<String, @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double> questionPerformance,

        @JsonProperty("priority_requests") List<@Valid PriorityRequest> priorityRequests,

        @PositiveOrZero
        @JsonProperty("learned_content_count") int learnedContentCount,

        @JsonProperty("last_session_id") String lastSessionId
) {

    public static final int INITIAL_INTERVAL_DAYS = 1;
    public static final double INITIAL_EASE_FACTOR = 2.5;

    public NoteHeader {
        questionPerformance = questionPerformance == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(questionPerformance));
        priorityRequests = priorityRequests == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(priorityRequests));
    }

    public static NoteHeader initial(String title, ReviewMode mode, String schedulePattern, Instant now) {
        return new NoteHeader(
                title,
                now,
                mode,
                schedulePattern,
                now,
                null,
                INITIAL_INTERVAL_DAYS,
                INITIAL_EASE_FACTOR,
                0,
                Map.of(),
                List.of(),
                0,
                null
        );
    }

    @JsonIgnore
    @AssertTrue(message = "schedule_pattern is required for scheduled notes")
    public boolean isSchedulePatternPresentWhenScheduled() {
        return reviewMode != ReviewMode.SCHEDULED || (schedulePattern != null && !schedulePattern.isBlank());
    }

    public NoteHeader withSchedule(Instant nextReview,
                                   int intervalDays,
                                   double easeFactor,
                                   Instant lastReviewed,
                                   int reviewCount) {
        return new NoteHeader(title, created, reviewMode, schedulePattern, nextReview, lastReviewed,
                intervalDays, easeFactor, reviewCount, questionPerformance, priorityRequests,
                learnedContentCount, lastSessionId);
    }

    public NoteHeader withSessionMerged(Map<String, Double> performance,
                                        List<PriorityRequest> priorities,
                                        String sessionId) {
        return new NoteHeader(title, created, reviewMode, schedulePattern, nextReview, lastReviewed,
                intervalDays, easeFactor, reviewCount, performance, priorities,
                learnedContentCount, sessionId);
    }

    public NoteHeader withLearnedContentCount(int count) {
        return new NoteHeader(title, created, reviewMode, schedulePattern, nextReview, lastReviewed,
                intervalDays, easeFactor, reviewCount, questionPerformance, priorityRequests,
                count, lastSessionId);
    }
}
