package app.learnbase.core.session.history;

import app.learnbase.core.config.LearnbaseProps;
import app.learnbase.core.error.SessionAlreadyRecordedException;
import app.learnbase.core.error.StorageException;
import app.learnbase.core.note.store.NoteFilenames;
import app.learnbase.core.session.domain.SessionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Append-only session archive: one JSON document per session, never rewritten.
 */
@Component
public class SessionHistoryLog {

    private static final Logger log = LoggerFactory.getLogger(SessionHistoryLog.class);
    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final String SEPARATOR = "__";
    private static final String EXTENSION = ".json";
    // <note-base>__<yyyyMMdd'T'HHmmss'Z'>__<session-id>.json
    private static final Pattern DOCUMENT_NAME =
            Pattern.compile("(.+?)__(\\d{8}T\\d{6}Z)__([A-Za-z0-9_-]+)\\.json");

    private final Path historyDir;
    private final ObjectMapper objectMapper;

    public SessionHistoryLog(LearnbaseProps props, ObjectMapper objectMapper) {
        if (props == null || props.historyDir() == null) {
            throw new IllegalStateException("app.learnbase.history-dir is required");
        }
        this.historyDir = props.historyDir();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(historyDir);
        } catch (IOException ex) {
            throw new StorageException("Failed to create history directory " + historyDir, ex);
        }
    }

    public Path append(SessionRecord record) {
        Path target = pathOf(record);
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException ex) {
            throw new StorageException("Failed to serialize session " + record.sessionId(), ex);
        }

        if (Files.exists(target)) {
            throw new SessionAlreadyRecordedException(record.noteFilename(), record.sessionId());
        }
        Path tmp = null;
        try {
            tmp = Files.createTempFile(historyDir, "." + record.sessionId() + ".", ".tmp");
            Files.write(tmp, json);
            publish(tmp, target);
        } catch (FileAlreadyExistsException ex) {
            throw new SessionAlreadyRecordedException(record.noteFilename(), record.sessionId());
        } catch (IOException ex) {
            log.error("Failed to write session history {}: {}", target.getFileName(), ex.toString());
            throw new StorageException("Failed to write session history " + target.getFileName(), ex);
        } finally {
            deleteQuietly(tmp);
        }
        log.info("Saved session history {}", target.getFileName());
        return target;
    }

    public boolean contains(SessionRecord record) {
        return Files.exists(pathOf(record));
    }

    /**
     * All sessions recorded for a note, oldest first.
     */
    public List<SessionRecord> list(String noteFilename) {
        String base = NoteFilenames.baseName(noteFilename);
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(historyDir, base + SEPARATOR + "*" + EXTENSION)) {
            for (Path file : stream) {
                Matcher m = DOCUMENT_NAME.matcher(file.getFileName().toString());
                if (m.matches() && m.group(1).equals(base)) {
                    files.add(file);
                }
            }
        } catch (IOException ex) {
            throw new StorageException("Failed to list session history for " + noteFilename, ex);
        }
        files.sort(null);

        List<SessionRecord> records = new ArrayList<>(files.size());
        for (Path file : files) {
            SessionRecord record;
            try {
                record = objectMapper.readValue(Files.readString(file, StandardCharsets.UTF_8), SessionRecord.class);
            } catch (IOException ex) {
                throw new StorageException("Failed to read session history " + file.getFileName(), ex);
            }
            if (noteFilename.equals(record.noteFilename())) {
                records.add(record);
            }
        }
        return records;
    }

    Path pathOf(SessionRecord record) {
        String sessionId = record.sessionId();
        if (sessionId == null || !SESSION_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        if (record.startTime() == null) {
            throw new IllegalArgumentException("Session start_time is required");
        }
        String base = NoteFilenames.baseName(record.noteFilename());
        return historyDir.resolve(base + SEPARATOR + STAMP.format(record.startTime()) + SEPARATOR + sessionId + EXTENSION);
    }

    /**
     * Makes the fully written temp file visible under {@code target}, failing with
     * {@link FileAlreadyExistsException} if a document is already there. The hard
     * link is created atomically; file systems without links fall back to a
     * rename that checks for the target first.
     */
    private static void publish(Path tmp, Path target) throws IOException {
        try {
            Files.createLink(target, tmp);
        } catch (UnsupportedOperationException ex) {
            Files.move(tmp, target);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ex) {
            log.warn("Failed to delete temp file {}: {}", tmp.getFileName(), ex.toString());
        }
    }
}
