package app.learnbase.core.session.performance;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

public final class QuestionHasher {

    private static final int HASH_LENGTH = 16;

    private QuestionHasher() {
    }

    /**
     * Stable key for a question: the first 16 hex chars of SHA-256 over the
     * trimmed, lower-cased text.
     */
    public static String hash(String questionText) {
        String normalized = questionText.trim().toLowerCase(Locale.ROOT);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
