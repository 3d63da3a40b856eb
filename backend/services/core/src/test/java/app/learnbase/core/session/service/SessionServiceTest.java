package app.learnbase.core.session.service;

import app.learnbase.core.error.NoteNotFoundException;
import app.learnbase.core.error.SessionAlreadyRecordedException;
import app.learnbase.core.note.domain.Note;
import app.learnbase.core.note.domain.PriorityRequest;
import app.learnbase.core.note.store.NoteStore;
import app.learnbase.core.session.controller.dto.SessionSaveResponse;
import app.learnbase.core.session.domain.SessionRecord;
import app.learnbase.core.session.domain.TopicRequest;
import app.learnbase.core.session.history.SessionHistoryLog;
import app.learnbase.core.session.performance.PerformanceTracker;
import app.learnbase.core.session.performance.QuestionHasher;
import app.learnbase.core.session.priority.PriorityRegistry;
import app.learnbase.core.support.TestNotes;
import app.learnbase.core.support.TestSessions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SessionServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");
    private static final String QUESTION = "What does the GIL protect?";

    @TempDir
    Path root;

    NoteStore noteStore;
    SessionHistoryLog historyLog;
    SessionService service;

    @BeforeEach
    void setUp() {
        noteStore = TestNotes.store(root);
        historyLog = new SessionHistoryLog(TestNotes.props(root), TestSessions.objectMapper());
        service = new SessionService(noteStore, historyLog, new PerformanceTracker(), new PriorityRegistry(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        noteStore.create(TestNotes.spaced("gil.md", "GIL", NOW.minusSeconds(3600)));
    }

    private static SessionRecord session(String id, Integer rating, double score) {
        return TestSessions.session(id, NOW.minusSeconds(900), rating,
                List.of(TestSessions.question(QUESTION, score)),
                List.of(new TopicRequest("gil", "keeps coming up")),
                List.of());
    }

    @Test
    void saveSessionHistory_mergesPerformanceAndPriorities() {
        SessionSaveResponse out = service.saveSessionHistory("gil.md", session("s-1", 3, 0.5));

        Note note = noteStore.load("gil.md");
        String hash = QuestionHasher.hash(QUESTION);
        assertThat(note.header().questionPerformance()).containsEntry(hash, 0.5);
        assertThat(note.header().lastSessionId()).isEqualTo("s-1");
        assertThat(note.header().priorityRequests()).singleElement()
                .satisfies(p -> {
                    assertThat(p.topic()).isEqualTo("gil");
                    assertThat(p.timesAddressed()).isEqualTo(1);
                    assertThat(p.requestedAt()).isEqualTo(NOW);
                });
        assertThat(out.performanceMerged()).isTrue();
        assertThat(out.historyFile()).startsWith("gil__").endsWith("__s-1.json");
        assertThat(historyLog.list("gil.md")).hasSize(1);
    }

    @Test
    void saveSessionHistory_secondSessionBlendsScoresAndExpiresPriority() {
        service.saveSessionHistory("gil.md", session("s-1", 3, 0.9));
        SessionSaveResponse out = service.saveSessionHistory("gil.md", session("s-2", 3, 0.5));

        Note note = noteStore.load("gil.md");
        assertThat(note.header().questionPerformance().get(QuestionHasher.hash(QUESTION)))
                .isCloseTo(0.62, within(1e-9));
        PriorityRequest gil = note.header().priorityRequests().get(0);
        assertThat(gil.timesAddressed()).isEqualTo(2);
        assertThat(gil.active()).isFalse();
        assertThat(out.activePriorities()).isEmpty();
    }

    @Test
    void saveSessionHistory_incompleteSessionLeavesScheduleAlone() {
        Note before = noteStore.load("gil.md");

        service.saveSessionHistory("gil.md", session("s-1", null, 0.4));

        Note after = noteStore.load("gil.md");
        assertThat(after.header().nextReview()).isEqualTo(before.header().nextReview());
        assertThat(after.header().intervalDays()).isEqualTo(before.header().intervalDays());
        assertThat(after.header().reviewCount()).isEqualTo(before.header().reviewCount());
        assertThat(after.header().questionPerformance()).hasSize(1);
        assertThat(after.body()).isEqualTo(before.body());
    }

    @Test
    void saveSessionHistory_rejectsDoubleSubmission() {
        SessionRecord record = session("s-1", 3, 0.5);
        service.saveSessionHistory("gil.md", record);

        assertThatThrownBy(() -> service.saveSessionHistory("gil.md", record))
                .isInstanceOf(SessionAlreadyRecordedException.class);
        assertThat(noteStore.load("gil.md").header().questionPerformance().get(QuestionHasher.hash(QUESTION)))
                .isEqualTo(0.5);
    }

    @Test
    void saveSessionHistory_resumeAfterLostHistoryWritesHistoryOnly() throws Exception {
        SessionRecord record = session("s-1", 3, 0.5);
        service.saveSessionHistory("gil.md", record);
        try (Stream<Path> files = Files.list(root.resolve("history"))) {
            for (Path f : files.toList()) {
                Files.delete(f);
            }
        }

        SessionSaveResponse out = service.saveSessionHistory("gil.md", record);

        assertThat(out.performanceMerged()).isFalse();
        Map<String, Double> performance = noteStore.load("gil.md").header().questionPerformance();
        assertThat(performance.get(QuestionHasher.hash(QUESTION))).isEqualTo(0.5);
        assertThat(noteStore.load("gil.md").header().priorityRequests().get(0).timesAddressed()).isEqualTo(1);
        assertThat(historyLog.list("gil.md")).hasSize(1);
    }

    @Test
    void saveSessionHistory_invalidScoreWritesNothing() {
        assertThatThrownBy(() -> service.saveSessionHistory("gil.md", session("s-1", 3, 1.5)))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(noteStore.load("gil.md").header().lastSessionId()).isNull();
        assertThat(historyLog.list("gil.md")).isEmpty();
    }

    @Test
    void saveSessionHistory_missingNoteThrowsNotFound() {
        assertThatThrownBy(() -> service.saveSessionHistory("nope.md", session("s-1", 3, 0.5)))
                .isInstanceOf(NoteNotFoundException.class);
        assertThat(historyLog.list("nope.md")).isEmpty();
    }

    @Test
    void saveSessionHistory_rejectsRecordForAnotherNote() {
        SessionRecord other = session("s-1", 3, 0.5).forNote("other.md");

        assertThatThrownBy(() -> service.saveSessionHistory("gil.md", other))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void newSessionId_usesTimestampAndRandomSuffix() {
        assertThat(service.newSessionId()).matches("20240601-090000-[0-9a-f]{6}");
    }

    @Test
    void history_unknownNoteThrowsNotFound() {
        assertThatThrownBy(() -> service.history("nope.md")).isInstanceOf(NoteNotFoundException.class);
    }
}
