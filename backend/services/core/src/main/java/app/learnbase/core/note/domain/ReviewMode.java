package app.learnbase.core.note.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReviewMode {
    SPACED("spaced"), SCHEDULED("scheduled");

    private final String code;
    ReviewMode(String code) { this.code = code; }

    @JsonValue
    public String code() { return code; }

    @JsonCreator
    public static ReviewMode fromString(String v) {
        if (v == null) {
            throw new IllegalArgumentException("Review mode is required");
        }
        String normalized = v.trim().toLowerCase(Locale.ROOT);
        for (ReviewMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid review mode: '" + v + "'. Must be 'spaced' or 'scheduled'");
    }
}
