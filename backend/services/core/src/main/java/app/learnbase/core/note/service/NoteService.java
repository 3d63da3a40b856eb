package app.learnbase.core.note.service;

import app.learnbase.core.config.LearnbaseProps;
import app.learnbase.core.note.controller.dto.NoteStatsResponse;
import app.learnbase.core.note.controller.dto.NoteSummaryResponse;
import app.learnbase.core.note.domain.Note;
import app.learnbase.core.note.domain.NoteHeader;
import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.note.store.NoteFilenames;
import app.learnbase.core.note.store.NoteStore;
import app.learnbase.core.review.algorithm.SchedulePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
public class NoteService {

    private static final Logger log = LoggerFactory.getLogger(NoteService.class);
    private static final int MAX_TITLE_LENGTH = 200;
    private static final String DEFAULT_SCHEDULE = "moderate";

    private final NoteStore noteStore;
    private final LearnbaseProps props;
    private final Clock clock;

    public NoteService(NoteStore noteStore, LearnbaseProps props, Clock clock) {
        this.noteStore = noteStore;
        this.props = props;
        this.clock = clock;
    }

    public NoteSummaryResponse createNote(String title, String body, ReviewMode mode, String schedulePattern) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title cannot be empty");
        }
        String trimmedTitle = title.trim();
        if (trimmedTitle.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException("Title too long (max " + MAX_TITLE_LENGTH + " characters)");
        }
        ReviewMode reviewMode = mode == null ? ReviewMode.SPACED : mode;
        String pattern = null;
        if (reviewMode == ReviewMode.SCHEDULED) {
            pattern = schedulePattern == null || schedulePattern.isBlank() ? defaultSchedule() : schedulePattern.trim();
            SchedulePattern.parse(pattern);
        }

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        NoteHeader header = NoteHeader.initial(trimmedTitle, reviewMode, pattern, now);
        String content = body == null ? "" : body;
        Note created = noteStore.create(Note.draft(NoteFilenames.fromTitle(trimmedTitle), header, content));
        log.info("Created note {} ({}, mode={})", created.filename(), trimmedTitle, reviewMode.code());
        return NoteSummaryResponse.from(created);
    }

    /**
     * Appends a learned section to the note body, separated by a blank line.
     */
    public NoteSummaryResponse appendContent(String filename, String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Content cannot be empty");
        }
        Note updated = noteStore.update(filename, note -> {
            String body = note.body();
            String joined = body.isEmpty() ? content : stripTrailingNewlines(body) + "\n\n" + content;
            if (!joined.endsWith("\n")) {
                joined = joined + "\n";
            }
            int count = note.header().learnedContentCount() + 1;
            return note.withBody(joined).withHeader(h -> h.withLearnedContentCount(count));
        });
        log.info("Appended content to {} (learned_content_count={})",
                filename, updated.header().learnedContentCount());
        return NoteSummaryResponse.from(updated);
    }

    public List<NoteSummaryResponse> listNotes() {
        return noteStore.loadAll().stream()
                .map(NoteSummaryResponse::from)
                .toList();
    }

    public NoteStatsResponse stats() {
        List<Note> notes = noteStore.loadAll();
        ZoneId zone = clock.getZone();
        LocalDate today = LocalDate.now(clock);
        Instant endOfToday = today.plusDays(1).atStartOfDay(zone).toInstant();
        Instant endOfWeek = today.plusDays(8).atStartOfDay(zone).toInstant();

        int reviewedToday = 0;
        int dueToday = 0;
        int dueThisWeek = 0;
        int spaced = 0;
        int scheduled = 0;
        double easeSum = 0.0;
        int reviewed = 0;

        for (Note note : notes) {
            NoteHeader h = note.header();
            if (h.lastReviewed() != null && LocalDate.ofInstant(h.lastReviewed(), zone).equals(today)) {
                reviewedToday++;
            }
            if (h.nextReview().isBefore(endOfToday)) {
                dueToday++;
            } else if (h.nextReview().isBefore(endOfWeek)) {
                dueThisWeek++;
            }
            if (h.reviewMode() == ReviewMode.SCHEDULED) {
                scheduled++;
            } else {
                spaced++;
            }
            if (h.reviewCount() > 0) {
                easeSum += h.easeFactor();
                reviewed++;
            }
        }

        double averageEase = reviewed == 0
                ? NoteHeader.INITIAL_EASE_FACTOR
                : Math.round(easeSum / reviewed * 100.0) / 100.0;
        return new NoteStatsResponse(notes.size(), reviewedToday, dueToday, dueThisWeek,
                averageEase, spaced, scheduled);
    }

    private String defaultSchedule() {
        String configured = props.defaultSchedule();
        return configured == null || configured.isBlank() ? DEFAULT_SCHEDULE : configured;
    }

    private static String stripTrailingNewlines(String s) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '\n') {
            end--;
        }
        return s.substring(0, end);
    }
}
