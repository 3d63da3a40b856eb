package app.learnbase.core.note.store;

import java.util.Locale;

public final class NoteFilenames {

    public static final String EXTENSION = ".md";
    private static final int MAX_SLUG_LENGTH = 50;

    private NoteFilenames() {
    }

    public static void validate(String filename) {
        if (filename == null || filename.isEmpty()) {
            throw new IllegalArgumentException("Filename cannot be empty");
        }
        if (filename.contains("/") || filename.contains("\\")) {
            throw new IllegalArgumentException("Filename must not contain directory separators: '" + filename + "'");
        }
        if (filename.startsWith(".")) {
            throw new IllegalArgumentException("Filename must not start with dot: '" + filename + "'");
        }
        if (!filename.endsWith(EXTENSION)) {
            throw new IllegalArgumentException("Filename must have .md extension: '" + filename + "'");
        }
        String base = baseName(filename);
        if (base.isEmpty()) {
            throw new IllegalArgumentException("Filename cannot be empty");
        }
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '-' && c != '_') {
                throw new IllegalArgumentException("Filename contains invalid characters: '" + filename
                        + "'. Only alphanumeric, hyphens, and underscores allowed.");
            }
        }
    }

    public static String baseName(String filename) {
        return filename.endsWith(EXTENSION)
                ? filename.substring(0, filename.length() - EXTENSION.length())
                : filename;
    }

    /**
     * "Python GIL: basics!" becomes "python-gil-basics.md".
     */
    public static String fromTitle(String title) {
        StringBuilder safe = new StringBuilder();
        for (char c : title.toCharArray()) {
            if (Character.isLetterOrDigit(c) || Character.isWhitespace(c)) {
                safe.append(c);
            }
        }
        String slug = String.join("-", safe.toString().toLowerCase(Locale.ROOT).trim().split("\\s+"));
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
        }
        if (slug.isEmpty()) {
            slug = "note";
        }
        return slug + EXTENSION;
    }

    public static String withCounter(String filename, int counter) {
        return baseName(filename) + "-" + counter + EXTENSION;
    }
}
