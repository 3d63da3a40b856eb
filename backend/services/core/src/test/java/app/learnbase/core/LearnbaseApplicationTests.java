package app.learnbase.core;

import app.learnbase.core.note.controller.dto.NoteSummaryResponse;
import app.learnbase.core.note.service.NoteService;
import app.learnbase.core.review.controller.dto.DueNoteResponse;
import app.learnbase.core.review.controller.dto.ReviewOutcomeResponse;
import app.learnbase.core.review.service.ReviewService;
import app.learnbase.core.session.controller.dto.SessionSaveResponse;
import app.learnbase.core.session.domain.SessionRecord;
import app.learnbase.core.session.service.SessionService;
import app.learnbase.core.support.TestSessions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class LearnbaseApplicationTests {

    @TempDir
    static Path root;

    @DynamicPropertySource
    static void storageDirs(DynamicPropertyRegistry registry) {
        registry.add("app.learnbase.notes-dir", () -> root.resolve("notes").toString());
        registry.add("app.learnbase.history-dir", () -> root.resolve("history").toString());
    }

    @Autowired
    NoteService noteService;

    @Autowired
    ReviewService reviewService;

    @Autowired
    SessionService sessionService;

    @Test
    void contextLoads_andReviewLoopRunsEndToEnd() {
        NoteSummaryResponse created = noteService.createNote("Python GIL", "# Python GIL\n", null, null);

        List<DueNoteResponse> due = reviewService.getDueNotes(null, null);
        assertThat(due).extracting(DueNoteResponse::filename).contains(created.filename());

        String sessionId = sessionService.newSessionId();
        SessionRecord record = TestSessions.session(sessionId, Instant.now().minusSeconds(300), 3,
                List.of(TestSessions.question("What does the GIL protect?", 0.8)), List.of(), List.of());
        SessionSaveResponse saved = sessionService.saveSessionHistory(created.filename(), record);
        ReviewOutcomeResponse outcome = reviewService.recordReview(created.filename(), 3);

        assertThat(saved.questionPerformance()).hasSize(1);
        assertThat(outcome.reviewCount()).isEqualTo(1);
        assertThat(reviewService.getDueNotes(null, null))
                .extracting(DueNoteResponse::filename)
                .doesNotContain(created.filename());
        assertThat(sessionService.history(created.filename())).hasSize(1);
    }
}
