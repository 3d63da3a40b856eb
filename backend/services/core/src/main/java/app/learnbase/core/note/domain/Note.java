package app.learnbase.core.note.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One learning note: an immutable filename, its frontmatter header and the free-text body.
 * <p>
 * {@code source} is the header exactly as it was read from disk (absent for notes that
 * were never persisted); the store writes its raw text back when the header is unchanged.
 */
public record Note(
        String filename,
        NoteHeader header,
        String body,
        SourceHeader source
) {

    public Note {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(header, "header");
        body = body == null ? "" : body;
    }

    public static Note draft(String filename, NoteHeader header, String body) {
        return new Note(filename, header, body, null);
    }

    public String title() {
        return header.title();
    }

    public ReviewMode reviewMode() {
        return header.reviewMode();
    }

    public Instant nextReview() {
        return header.nextReview();
    }

    public boolean isDue(Instant now) {
        return !header.nextReview().isAfter(now);
    }

    public Note withHeader(UnaryOperator<NoteHeader> change) {
        return new Note(filename, change.apply(header), body, source);
    }

    public Note withBody(String newBody) {
        return new Note(filename, header, newBody, source);
    }

    public Note withFilename(String newFilename) {
        return new Note(newFilename, header, body, source);
    }

    public record SourceHeader(NoteHeader header, String raw) {
    }
}
