package app.learnbase.core.session.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record TopicRequest(
        @NotBlank @JsonProperty("topic") String topic,
        @JsonProperty("reason") String reason
) {}
