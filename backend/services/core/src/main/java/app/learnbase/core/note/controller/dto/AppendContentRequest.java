package app.learnbase.core.note.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record AppendContentRequest(
        @NotBlank String content
) {}
