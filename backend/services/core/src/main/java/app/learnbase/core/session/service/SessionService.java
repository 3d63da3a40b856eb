package app.learnbase.core.session.service;

import app.learnbase.core.error.NoteNotFoundException;
import app.learnbase.core.error.SessionAlreadyRecordedException;
import app.learnbase.core.note.domain.Note;
import app.learnbase.core.note.domain.NoteHeader;
import app.learnbase.core.note.domain.PriorityRequest;
import app.learnbase.core.note.store.NoteFilenames;
import app.learnbase.core.note.store.NoteStore;
import app.learnbase.core.session.SessionIds;
import app.learnbase.core.session.controller.dto.SessionSaveResponse;
import app.learnbase.core.session.domain.SessionRecord;
import app.learnbase.core.session.history.SessionHistoryLog;
import app.learnbase.core.session.performance.PerformanceTracker;
import app.learnbase.core.session.priority.PriorityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final NoteStore noteStore;
    private final SessionHistoryLog historyLog;
    private final PerformanceTracker performanceTracker;
    private final PriorityRegistry priorityRegistry;
    private final Clock clock;

    public SessionService(NoteStore noteStore,
                          SessionHistoryLog historyLog,
                          PerformanceTracker performanceTracker,
                          PriorityRegistry priorityRegistry,
                          Clock clock) {
        this.noteStore = noteStore;
        this.historyLog = historyLog;
        this.performanceTracker = performanceTracker;
        this.priorityRegistry = priorityRegistry;
        this.clock = clock;
    }

    public String newSessionId() {
        return SessionIds.next(clock);
    }

    /**
     * Merges the session into the note (question performance, priorities and
     * {@code last_session_id} in one write), then appends the session document.
     * <p>
     * A session already present in the history fails with
     * {@link SessionAlreadyRecordedException}. A note that already carries the
     * session id without a history document is only missing the append, so the
     * merge is skipped.
     */
    public SessionSaveResponse saveSessionHistory(String filename, SessionRecord submitted) {
        NoteFilenames.validate(filename);
        if (submitted == null) {
            throw new IllegalArgumentException("Session record is required");
        }
        if (submitted.noteFilename() != null && !submitted.noteFilename().equals(filename)) {
            throw new IllegalArgumentException("Session belongs to " + submitted.noteFilename() + ", not " + filename);
        }
        SessionRecord record = submitted.forNote(filename);
        if (historyLog.contains(record)) {
            throw new SessionAlreadyRecordedException(filename, record.sessionId());
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        AtomicBoolean merged = new AtomicBoolean(false);
        Note updated = noteStore.update(filename, note -> {
            NoteHeader h = note.header();
            if (record.sessionId().equals(h.lastSessionId())) {
                log.warn("Session {} already merged into {}, writing history only", record.sessionId(), filename);
                return note;
            }
            Map<String, Double> performance = performanceTracker.merge(h.questionPerformance(), record.questions());
            List<PriorityRequest> priorities = priorityRegistry.apply(
                    h.priorityRequests(),
                    record.prioritiesRequested(),
                    record.prioritiesAddressed(),
                    record.questions(),
                    record.sessionId(),
                    now
            );
            merged.set(true);
            return note.withHeader(header -> header.withSessionMerged(performance, priorities, record.sessionId()));
        });

        Path file = historyLog.append(record);
        log.info("Saved session {} for {} ({} questions, complete={})",
                record.sessionId(), filename, record.questions().size(), record.isComplete());
        return new SessionSaveResponse(
                record.sessionId(),
                filename,
                file.getFileName().toString(),
                merged.get(),
                updated.header().questionPerformance(),
                priorityRegistry.active(updated.header().priorityRequests())
        );
    }

    public List<SessionRecord> history(String filename) {
        if (!noteStore.exists(filename)) {
            throw new NoteNotFoundException(filename);
        }
        return historyLog.list(filename);
    }
}
