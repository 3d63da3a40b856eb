package app.learnbase.core.review.controller.dto;

import app.learnbase.core.note.domain.NoteHeader;

public record NoteViewResponse(
        String filename,
        NoteHeader header,
        String body
) {
}
