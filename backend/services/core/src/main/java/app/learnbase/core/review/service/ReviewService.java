package app.learnbase.core.review.service;

import app.learnbase.core.note.domain.Note;
import app.learnbase.core.note.domain.NoteHeader;
import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.note.store.NoteStore;
import app.learnbase.core.review.algorithm.ReviewScheduler;
import app.learnbase.core.review.algorithm.ReviewScheduler.ScheduleInput;
import app.learnbase.core.review.algorithm.ReviewScheduler.ScheduleResult;
import app.learnbase.core.review.algorithm.SchedulerRegistry;
import app.learnbase.core.review.controller.dto.DueNoteResponse;
import app.learnbase.core.review.controller.dto.NextReviewResponse;
import app.learnbase.core.review.controller.dto.NoteViewResponse;
import app.learnbase.core.review.controller.dto.ReviewOutcomeResponse;
import app.learnbase.core.review.domain.Rating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final NoteStore noteStore;
    private final SchedulerRegistry registry;
    private final DueNoteSelector dueNoteSelector;
    private final Clock clock;

    public ReviewService(NoteStore noteStore,
                         SchedulerRegistry registry,
                         DueNoteSelector dueNoteSelector,
                         Clock clock) {
        this.noteStore = noteStore;
        this.registry = registry;
        this.dueNoteSelector = dueNoteSelector;
        this.clock = clock;
    }

    public List<DueNoteResponse> getDueNotes(Integer limit, ReviewMode reviewMode) {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        Instant now = clock.instant();
        Stream<Note> due = dueNoteSelector.listDue(noteStore.loadAll(), now);
        if (reviewMode != null) {
            due = due.filter(n -> n.reviewMode() == reviewMode);
        }
        if (limit != null) {
            due = due.limit(limit);
        }
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        return due.map(n -> toDueResponse(n, today)).toList();
    }

    public NoteViewResponse reviewNote(String filename) {
        Note note = noteStore.load(filename);
        return new NoteViewResponse(note.filename(), note.header(), note.body());
    }

    public ReviewOutcomeResponse recordReview(String filename, int ratingCode) {
        Rating rating = Rating.fromCode(ratingCode);
        Instant now = now();
        log.debug("Updating review: {}, rating={}", filename, rating.code());

        AtomicReference<ScheduleResult> result = new AtomicReference<>();
        Note updated = noteStore.update(filename, note -> {
            NoteHeader h = note.header();
            ScheduleResult r = registry.require(h.reviewMode()).apply(inputOf(h), rating, now);
            result.set(r);
            return note.withHeader(header -> header.withSchedule(
                    r.nextReview(),
                    r.intervalDays(),
                    r.easeFactor(),
                    now,
                    header.reviewCount() + 1
            ));
        });

        ScheduleResult r = result.get();
        log.info("Updated review for {}: rating={}, next_review={}", filename, rating.code(), r.nextReview());
        return new ReviewOutcomeResponse(
                filename,
                rating.code(),
                r.nextReview(),
                r.intervalDays(),
                r.easeFactor(),
                updated.header().reviewCount()
        );
    }

    /**
     * Preview of {@link #recordReview} for a spaced note; nothing is persisted.
     */
    public NextReviewResponse calculateNextReview(int ratingCode, int intervalDays, double easeFactor) {
        return calculateNextReview(ReviewMode.SPACED, ratingCode, intervalDays, easeFactor, 0, null);
    }

    public NextReviewResponse calculateNextReview(ReviewMode mode,
                                                  int ratingCode,
                                                  int intervalDays,
                                                  double easeFactor,
                                                  int reviewCount,
                                                  String schedulePattern) {
        Rating rating = Rating.fromCode(ratingCode);
        if (intervalDays < 0) {
            throw new IllegalArgumentException("interval_days must be non-negative, got " + intervalDays);
        }
        ReviewMode effectiveMode = mode == null ? ReviewMode.SPACED : mode;
        if (effectiveMode == ReviewMode.SCHEDULED && (schedulePattern == null || schedulePattern.isBlank())) {
            throw new IllegalArgumentException("schedule_pattern required for scheduled mode");
        }
        ScheduleInput input = new ScheduleInput(intervalDays, easeFactor, reviewCount, schedulePattern);
        ScheduleResult r = registry.require(effectiveMode).apply(input, rating, now());
        return NextReviewResponse.from(r);
    }

    public Map<Rating, NextReviewResponse> previewNote(String filename) {
        Note note = noteStore.load(filename);
        ReviewScheduler scheduler = registry.require(note.reviewMode());
        Map<Rating, NextReviewResponse> out = new EnumMap<>(Rating.class);
        scheduler.preview(inputOf(note.header()), now())
                .forEach((rating, r) -> out.put(rating, NextReviewResponse.from(r)));
        return out;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static ScheduleInput inputOf(NoteHeader h) {
        return new ScheduleInput(h.intervalDays(), h.easeFactor(), h.reviewCount(), h.schedulePattern());
    }

    private DueNoteResponse toDueResponse(Note note, LocalDate today) {
        NoteHeader h = note.header();
        Long daysSince = null;
        if (h.lastReviewed() != null) {
            LocalDate reviewedOn = LocalDate.ofInstant(h.lastReviewed(), clock.getZone());
            daysSince = ChronoUnit.DAYS.between(reviewedOn, today);
        }
        return new DueNoteResponse(
                note.filename(),
                note.title(),
                daysSince,
                h.intervalDays(),
                h.easeFactor(),
                h.reviewMode(),
                h.nextReview(),
                h.reviewCount()
        );
    }
}
