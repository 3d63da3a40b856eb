package app.learnbase.core.note.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.Locale;

/**
 * A user-declared focus topic. Stays active until it has been addressed in
 * {@link #ADDRESSED_THRESHOLD} sessions, then is kept as history.
 */
@JsonPropertyOrder({"topic", "reason", "requested_at", "session_id", "times_addressed", "active"})
public record PriorityRequest(
        @NotBlank
        @JsonProperty("topic") String topic,
        @JsonProperty("reason") String reason,
        @JsonProperty("requested_at") Instant requestedAt,
        @JsonProperty("session_id") String sessionId,
        @PositiveOrZero @Max(2)
        @JsonProperty("times_addressed") int timesAddressed,
        @JsonProperty("active") boolean active
) {

    public static final int ADDRESSED_THRESHOLD = 2;

    public static PriorityRequest open(String topic, String reason, String sessionId, Instant now) {
        return new PriorityRequest(topic.trim(), reason, now, sessionId, 0, true);
    }

    public boolean matches(String otherTopic) {
        return otherTopic != null && normalize(topic).equals(normalize(otherTopic));
    }

    public PriorityRequest refreshed(String newReason, String newSessionId, Instant now) {
        return new PriorityRequest(topic, newReason, now, newSessionId, timesAddressed, active);
    }

    public PriorityRequest addressed() {
        int count = timesAddressed + 1;
        return new PriorityRequest(topic, reason, requestedAt, sessionId, count, count < ADDRESSED_THRESHOLD);
    }

    public static String normalize(String topic) {
        return topic == null ? "" : topic.trim().toLowerCase(Locale.ROOT);
    }
}
