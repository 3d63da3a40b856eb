package app.learnbase.core.session.domain;

import app.learnbase.core.session.performance.QuestionHasher;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * One question asked during a session with the evaluated score in {@code [0, 1]}.
 */
@JsonPropertyOrder({
        "question_hash", "question_text", "user_answer", "evaluation_kind",
        "score", "follow_up_count", "user_had_questions"
})
public record SessionQuestion(
        @JsonProperty("question_hash") String questionHash,
        @JsonProperty("question_text") String questionText,
        @JsonProperty("user_answer") String userAnswer,
        @JsonProperty("evaluation_kind") String evaluationKind,
        @DecimalMin("0.0") @DecimalMax("1.0")
        @JsonProperty("score") double score,
        @PositiveOrZero
        @JsonProperty("follow_up_count") int followUpCount,
        @JsonProperty("user_had_questions") boolean userHadQuestions
) {

    public String resolvedHash() {
        if (questionHash != null && !questionHash.isBlank()) {
            return questionHash;
        }
        if (questionText == null || questionText.isBlank()) {
            throw new IllegalArgumentException("Question needs a question_hash or question_text");
        }
        return QuestionHasher.hash(questionText);
    }
}
