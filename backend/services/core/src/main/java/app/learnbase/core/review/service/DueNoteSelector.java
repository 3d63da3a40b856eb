package app.learnbase.core.review.service;

import app.learnbase.core.note.domain.Note;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.stream.Stream;

@Component
public class DueNoteSelector {

    private static final Comparator<Note> MOST_OVERDUE_FIRST =
            Comparator.comparing(Note::nextReview).thenComparing(Note::filename);

    /**
     * Notes whose next review is at or before {@code now}, most overdue first.
     * The stream is evaluated lazily; call again for a fresh pass.
     */
    public Stream<Note> listDue(Collection<Note> notes, Instant now) {
        return notes.stream()
                .filter(n -> n.isDue(now))
                .sorted(MOST_OVERDUE_FIRST);
    }
}
