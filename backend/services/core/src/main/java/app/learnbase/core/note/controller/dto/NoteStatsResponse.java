package app.learnbase.core.note.controller.dto;

public record NoteStatsResponse(
        int totalNotes,
        int reviewedToday,
        int dueToday,
        int dueThisWeek,
        double averageEaseFactor,
        int spacedNotes,
        int scheduledNotes
) {}
