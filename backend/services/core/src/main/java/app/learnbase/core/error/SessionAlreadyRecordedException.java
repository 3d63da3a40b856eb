package app.learnbase.core.error;

public class SessionAlreadyRecordedException extends RuntimeException {

    private final String filename;
    private final String sessionId;

    public SessionAlreadyRecordedException(String filename, String sessionId) {
        super("Session " + sessionId + " is already recorded for " + filename);
        this.filename = filename;
        this.sessionId = sessionId;
    }

    public String getFilename() {
        return filename;
    }

    public String getSessionId() {
        return sessionId;
    }
}
