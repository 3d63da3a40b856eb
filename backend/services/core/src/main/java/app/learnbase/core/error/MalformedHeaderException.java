package app.learnbase.core.error;

import java.util.List;

/**
 * The frontmatter header of a note could not be parsed or failed schema validation.
 * The note is left untouched on disk.
 */
public class MalformedHeaderException extends RuntimeException {

    private final String filename;
    private final List<String> fields;

    public MalformedHeaderException(String filename, List<String> fields, String detail) {
        this(filename, fields, detail, null);
    }

    public MalformedHeaderException(String filename, List<String> fields, String detail, Throwable cause) {
        super("Malformed header in " + filename + ": " + detail, cause);
        this.filename = filename;
        this.fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public String getFilename() {
        return filename;
    }

    public List<String> getFields() {
        return fields;
    }
}
