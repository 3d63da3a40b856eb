package app.learnbase.core.note.controller.dto;

import app.learnbase.core.note.domain.Note;
import app.learnbase.core.note.domain.NoteHeader;
import app.learnbase.core.note.domain.ReviewMode;

import java.time.Instant;

public record NoteSummaryResponse(
        String filename,
        String title,
        ReviewMode reviewMode,
        Instant created,
        Instant lastReviewed,
        Instant nextReview,
        int intervalDays,
        double easeFactor,
        int reviewCount,
        int learnedContentCount
) {
    public static NoteSummaryResponse from(Note note) {
        NoteHeader h = note.header();
        return new NoteSummaryResponse(
                note.filename(),
                h.title(),
                h.reviewMode(),
                h.created(),
                h.lastReviewed(),
                h.nextReview(),
                h.intervalDays(),
                h.easeFactor(),
                h.reviewCount(),
                h.learnedContentCount()
        );
    }
}
