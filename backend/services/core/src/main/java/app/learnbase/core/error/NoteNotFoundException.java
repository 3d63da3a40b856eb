package app.learnbase.core.error;

public class NoteNotFoundException extends RuntimeException {

    private final String filename;

    public NoteNotFoundException(String filename) {
        super("Note not found: " + filename);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
