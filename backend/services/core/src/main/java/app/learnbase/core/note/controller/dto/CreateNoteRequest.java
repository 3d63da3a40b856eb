package app.learnbase.core.note.controller.dto;

import app.learnbase.core.note.domain.ReviewMode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateNoteRequest(
        @NotBlank @Size(max = 200) String title,
        String body,
        ReviewMode reviewMode,
        String schedulePattern
) {}
