package app.learnbase.core.session.controller.dto;

public record SessionIdResponse(String sessionId) {}
