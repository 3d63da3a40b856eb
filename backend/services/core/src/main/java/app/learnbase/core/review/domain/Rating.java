package app.learnbase.core.review.domain;

import app.learnbase.core.error.InvalidRatingException;

public enum Rating {
    POOR(1), FAIR(2), GOOD(3), EXCELLENT(4);

    private final int code;
    Rating(int code) { this.code = code; }
    public int code() { return code; }

    public static Rating fromCode(int code) {
        for (Rating r : values()) {
            if (r.code == code) return r;
        }
        throw new InvalidRatingException(code);
    }
}
