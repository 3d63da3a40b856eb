package app.learnbase.core.session.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.time.Instant;
import java.util.List;

/**
 * Everything that happened in one review session, submitted once at session end.
 * A missing {@code overall_rating} marks an interrupted session.
 */
@JsonPropertyOrder({
        "session_id", "note_filename", "start_time", "end_time", "questions",
        "overall_rating", "average_score", "priorities_requested", "priorities_addressed"
})
public record SessionRecord(
        @NotBlank @Pattern(regexp = "[A-Za-z0-9_-]+")
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("note_filename") String noteFilename,
        @NotNull
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("questions") List<@Valid SessionQuestion> questions,
        @Min(1) @Max(4)
        @JsonProperty("overall_rating") Integer overallRating,
        @JsonProperty("average_score") Double averageScore,
        @JsonProperty("priorities_requested") List<@Valid TopicRequest> prioritiesRequested,
        @JsonProperty("priorities_addressed") List<String> prioritiesAddressed
) {

    public SessionRecord {
        questions = questions == null ? List.of() : List.copyOf(questions);
        prioritiesRequested = prioritiesRequested == null ? List.of() : List.copyOf(prioritiesRequested);
        prioritiesAddressed = prioritiesAddressed == null ? List.of() : List.copyOf(prioritiesAddressed);
        if (averageScore == null) {
            averageScore = questions.isEmpty()
                    ? 0.0
                    : questions.stream().mapToDouble(SessionQuestion::score).average().orElse(0.0);
        }
    }

    @JsonIgnore
    public boolean isComplete() {
        return overallRating != null;
    }

    public SessionRecord forNote(String filename) {
        return new SessionRecord(sessionId, filename, startTime, endTime, questions, overallRating,
                averageScore, prioritiesRequested, prioritiesAddressed);
    }
}
