package app.learnbase.core.session.controller.dto;

import app.learnbase.core.note.domain.PriorityRequest;

import java.util.List;
import java.util.Map;

public record SessionSaveResponse(
        String sessionId,
        String filename,
        String historyFile,
        boolean performanceMerged,
        Map<String, Double> questionPerformance,
        List<PriorityRequest> activePriorities
) {}
