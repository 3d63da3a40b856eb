package app.learnbase.core.error;

public class InvalidRatingException extends IllegalArgumentException {

    private final int rating;

    public InvalidRatingException(int rating) {
        super("Rating must be between 1 and 4, got " + rating);
        this.rating = rating;
    }

    public int getRating() {
        return rating;
    }
}
