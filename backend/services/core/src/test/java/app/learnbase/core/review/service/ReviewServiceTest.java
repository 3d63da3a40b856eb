package app.learnbase.core.review.service;

import app.learnbase.core.error.InvalidRatingException;
import app.learnbase.core.error.NoteNotFoundException;
import app.learnbase.core.note.domain.Note;
import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.note.store.NoteStore;
import app.learnbase.core.review.algorithm.SchedulerRegistry;
import app.learnbase.core.review.algorithm.impl.FixedCadenceScheduler;
import app.learnbase.core.review.algorithm.impl.Sm2Scheduler;
import app.learnbase.core.review.controller.dto.DueNoteResponse;
import app.learnbase.core.review.controller.dto.NextReviewResponse;
import app.learnbase.core.review.controller.dto.ReviewOutcomeResponse;
import app.learnbase.core.review.domain.Rating;
import app.learnbase.core.support.TestNotes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00.750Z");
    private static final Instant NOW_SECONDS = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    NoteStore noteStore;

    ReviewService service;

    @BeforeEach
    void setUp() {
        SchedulerRegistry registry = new SchedulerRegistry(List.of(new Sm2Scheduler(), new FixedCadenceScheduler()));
        service = new ReviewService(noteStore, registry, new DueNoteSelector(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void stubUpdate(Note current) {
        when(noteStore.update(eq(current.filename()), any())).thenAnswer(inv -> {
            UnaryOperator<Note> change = inv.getArgument(1);
            return change.apply(current);
        });
    }

    @Test
    void recordReview_updatesScheduleAndCounters() {
        Note note = TestNotes.spaced("gil.md", "GIL", NOW.minusSeconds(60))
                .withHeader(h -> h.withSchedule(h.nextReview(), 6, 2.5, null, 3));
        stubUpdate(note);

        ReviewOutcomeResponse out = service.recordReview("gil.md", 3);

        assertThat(out.newIntervalDays()).isEqualTo(15);
        assertThat(out.newEaseFactor()).isEqualTo(2.5);
        assertThat(out.nextReview()).isEqualTo(NOW_SECONDS.plus(Duration.ofDays(15)));
        assertThat(out.reviewCount()).isEqualTo(4);
    }

    @Test
    @SuppressWarnings("unchecked")
    void recordReview_writesLastReviewedAndCount() {
        Note note = TestNotes.spaced("gil.md", "GIL", NOW.minusSeconds(60))
                .withHeader(h -> h.withSchedule(h.nextReview(), 10, 1.4, null, 0));
        stubUpdate(note);
        ArgumentCaptor<UnaryOperator<Note>> change = ArgumentCaptor.forClass(UnaryOperator.class);

        service.recordReview("gil.md", 1);

        verify(noteStore).update(eq("gil.md"), change.capture());
        Note updated = change.getValue().apply(note);
        assertThat(updated.header().intervalDays()).isEqualTo(1);
        assertThat(updated.header().easeFactor()).isEqualTo(1.3);
        assertThat(updated.header().lastReviewed()).isEqualTo(NOW_SECONDS);
        assertThat(updated.header().reviewCount()).isEqualTo(1);
        assertThat(updated.body()).isEqualTo(note.body());
    }

    @Test
    void recordReview_invalidRatingFailsBeforeTouchingStore() {
        assertThatThrownBy(() -> service.recordReview("missing.md", 7))
                .isInstanceOf(InvalidRatingException.class);

        verifyNoInteractions(noteStore);
    }

    @Test
    void recordReview_missingNotePropagatesNotFound() {
        when(noteStore.update(eq("missing.md"), any())).thenThrow(new NoteNotFoundException("missing.md"));

        assertThatThrownBy(() -> service.recordReview("missing.md", 3))
                .isInstanceOf(NoteNotFoundException.class);
    }

    @Test
    void recordReview_scheduledNoteFollowsPatternAndKeepsEase() {
        Note note = TestNotes.scheduled("monthly.md", "Monthly", "1d,1w,1m", NOW.minusSeconds(60))
                .withHeader(h -> h.withSchedule(h.nextReview(), 1, 2.1, null, 1));
        stubUpdate(note);

        ReviewOutcomeResponse out = service.recordReview("monthly.md", 1);

        assertThat(out.newIntervalDays()).isEqualTo(7);
        assertThat(out.newEaseFactor()).isEqualTo(2.1);
        assertThat(out.reviewCount()).isEqualTo(2);
    }

    @Test
    void getDueNotes_filtersAppliesLimitAndComputesDaysSince() {
        Note reviewed = TestNotes.spaced("reviewed.md", "Reviewed", NOW.minus(Duration.ofDays(2)))
                .withHeader(h -> h.withSchedule(h.nextReview(), 3, 2.5, NOW.minus(Duration.ofDays(5)), 2));
        Note fresh = TestNotes.spaced("fresh.md", "Fresh", NOW.minus(Duration.ofHours(1)));
        Note scheduled = TestNotes.scheduled("cadence.md", "Cadence", "1w", NOW.minus(Duration.ofDays(1)));
        Note future = TestNotes.spaced("future.md", "Future", NOW.plus(Duration.ofDays(1)));
        when(noteStore.loadAll()).thenReturn(List.of(reviewed, fresh, scheduled, future));

        List<DueNoteResponse> all = service.getDueNotes(null, null);
        List<DueNoteResponse> spacedOnly = service.getDueNotes(1, ReviewMode.SPACED);

        assertThat(all).extracting(DueNoteResponse::filename)
                .containsExactly("reviewed.md", "cadence.md", "fresh.md");
        assertThat(all.get(0).daysSinceLastReview()).isEqualTo(5L);
        assertThat(all.get(2).daysSinceLastReview()).isNull();
        assertThat(spacedOnly).extracting(DueNoteResponse::filename).containsExactly("reviewed.md");
    }

    @Test
    void getDueNotes_rejectsNonPositiveLimit() {
        assertThatThrownBy(() -> service.getDueNotes(0, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calculateNextReview_isPureAndDoesNotPersist() {
        NextReviewResponse out = service.calculateNextReview(4, 4, 2.5);

        assertThat(out.newIntervalDays()).isEqualTo(10);
        assertThat(out.newEaseFactor()).isCloseTo(2.65, within(1e-9));
        assertThat(out.nextReview()).isEqualTo(NOW_SECONDS.plus(Duration.ofDays(10)));
        verifyNoInteractions(noteStore);
    }

    @Test
    void calculateNextReview_scheduledRequiresPattern() {
        assertThatThrownBy(() -> service.calculateNextReview(ReviewMode.SCHEDULED, 3, 1, 2.5, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
        verify(noteStore, never()).loadAll();
    }

    @Test
    void previewNote_returnsOutcomeForEveryRating() {
        Note note = TestNotes.spaced("gil.md", "GIL", NOW)
                .withHeader(h -> h.withSchedule(h.nextReview(), 6, 2.5, null, 1));
        when(noteStore.load("gil.md")).thenReturn(note);

        Map<Rating, NextReviewResponse> preview = service.previewNote("gil.md");

        assertThat(preview).containsOnlyKeys(Rating.values());
        assertThat(preview.get(Rating.GOOD).newIntervalDays()).isEqualTo(15);
    }
}
