package app.learnbase.core.note.store;

import app.learnbase.core.config.LearnbaseProps;
import app.learnbase.core.error.MalformedHeaderException;
import app.learnbase.core.error.NoteNotFoundException;
import app.learnbase.core.error.StorageException;
import app.learnbase.core.note.domain.Note;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * File-backed note storage, one Markdown file per note.
 * <p>
 * Every write goes to a temp file in the notes directory and is renamed over the
 * target, so readers never observe a partially written note. Writers of the same
 * filename are serialized; different notes do not contend.
 */
@Component
public class NoteStore {

    private static final Logger log = LoggerFactory.getLogger(NoteStore.class);
    private static final int MAX_FILENAME_ATTEMPTS = 1000;

    private final Path notesDir;
    private final FrontmatterCodec codec;
    // one lock per filename ever touched; bounded by the number of notes
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public NoteStore(LearnbaseProps props, FrontmatterCodec codec) {
        if (props == null || props.notesDir() == null) {
            throw new IllegalStateException("app.learnbase.notes-dir is required");
        }
        this.notesDir = props.notesDir();
        this.codec = codec;
        try {
            Files.createDirectories(notesDir);
        } catch (IOException ex) {
            throw new StorageException("Failed to create notes directory " + notesDir, ex);
        }
    }

    public Path directory() {
        return notesDir;
    }

    public boolean exists(String filename) {
        NoteFilenames.validate(filename);
        return Files.isRegularFile(notesDir.resolve(filename));
    }

    public Note load(String filename) {
        NoteFilenames.validate(filename);
        Path path = notesDir.resolve(filename);
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException ex) {
            log.warn("Note file not found: {}", filename);
            throw new NoteNotFoundException(filename);
        } catch (IOException ex) {
            log.error("I/O error loading note {}: {}", filename, ex.toString());
            throw new StorageException("Failed to read note " + filename, ex);
        }
        Note note = codec.decode(filename, text);
        log.debug("Loaded note: {}", filename);
        return note;
    }

    /**
     * Loads every parseable note, ordered by next review. Notes whose header is
     * malformed are skipped and left as they are on disk.
     */
    public List<Note> loadAll() {
        List<Note> notes = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(notesDir, "*" + NoteFilenames.EXTENSION)) {
            for (Path file : files) {
                String filename = file.getFileName().toString();
                try {
                    NoteFilenames.validate(filename);
                    notes.add(load(filename));
                } catch (MalformedHeaderException ex) {
                    if (isReservation(file)) {
                        log.debug("Skipping note {} still being created", filename);
                    } else {
                        log.error("Quarantined note {}: {}", filename, ex.getMessage());
                    }
                } catch (IllegalArgumentException ex) {
                    log.debug("Skipping non-note file {}: {}", filename, ex.getMessage());
                } catch (NoteNotFoundException ex) {
                    log.debug("Note {} disappeared while listing", filename);
                }
            }
        } catch (IOException ex) {
            throw new StorageException("Failed to list notes in " + notesDir, ex);
        }
        notes.sort(Comparator.comparing(Note::nextReview).thenComparing(Note::filename));
        return notes;
    }

    public void save(Note note) {
        NoteFilenames.validate(note.filename());
        String content = codec.encode(note);
        ReentrantLock lock = lockFor(note.filename());
        lock.lock();
        try {
            write(note.filename(), content);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reserves a free filename derived from the draft's filename ({@code slug.md},
     * {@code slug-1.md}, ...) and writes the note there.
     */
    public Note create(Note draft) {
        NoteFilenames.validate(draft.filename());
        String content = codec.encode(draft);
        String filename = reserveFilename(draft.filename());
        Note created = draft.withFilename(filename);
        ReentrantLock lock = lockFor(filename);
        lock.lock();
        try {
            write(filename, content);
        } finally {
            lock.unlock();
        }
        log.debug("Created note file {}", filename);
        return created;
    }

    /**
     * Load-modify-save under the filename's lock. Nothing is written when the
     * change returns an equal note.
     */
    public Note update(String filename, UnaryOperator<Note> change) {
        NoteFilenames.validate(filename);
        ReentrantLock lock = lockFor(filename);
        lock.lock();
        try {
            Note current = load(filename);
            Note updated = change.apply(current);
            if (!updated.filename().equals(filename)) {
                throw new IllegalArgumentException("Note filename is immutable: " + filename);
            }
            if (updated.equals(current)) {
                return current;
            }
            write(filename, codec.encode(updated));
            return updated;
        } finally {
            lock.unlock();
        }
    }

    private String reserveFilename(String preferred) {
        String candidate = preferred;
        for (int counter = 1; counter <= MAX_FILENAME_ATTEMPTS; counter++) {
            try {
                Files.createFile(notesDir.resolve(candidate));
                return candidate;
            } catch (FileAlreadyExistsException ex) {
                candidate = NoteFilenames.withCounter(preferred, counter);
            } catch (IOException ex) {
                throw new StorageException("Failed to reserve note file " + candidate, ex);
            }
        }
        throw new StorageException("Failed to create unique filename for " + preferred
                + " after " + MAX_FILENAME_ATTEMPTS + " attempts", null);
    }

    // create() reserves a name with an empty file before the content lands
    private static boolean isReservation(Path file) {
        try {
            return Files.size(file) == 0;
        } catch (IOException ex) {
            log.debug("Cannot stat {}: {}", file.getFileName(), ex.toString());
            return false;
        }
    }

    private void write(String filename, String content) {
        Path target = notesDir.resolve(filename);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(notesDir, "." + filename + ".", ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
            log.debug("Saved note to {}", filename);
        } catch (IOException ex) {
            log.error("Failed to save note {}: {}", filename, ex.toString());
            throw new StorageException("Failed to save note " + filename, ex);
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ex) {
            log.warn("Failed to remove temp file {}: {}", tmp, ex.toString());
        }
    }

    private ReentrantLock lockFor(String filename) {
        return locks.computeIfAbsent(filename, k -> new ReentrantLock());
    }
}
