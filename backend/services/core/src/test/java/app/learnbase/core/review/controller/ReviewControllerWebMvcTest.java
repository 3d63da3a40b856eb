package app.learnbase.core.review.controller;

import app.learnbase.core.error.InvalidRatingException;
import app.learnbase.core.error.MalformedHeaderException;
import app.learnbase.core.error.NoteNotFoundException;
import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.review.controller.dto.DueNoteResponse;
import app.learnbase.core.review.controller.dto.NextReviewResponse;
import app.learnbase.core.review.controller.dto.ReviewOutcomeResponse;
import app.learnbase.core.review.service.ReviewService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
class ReviewControllerWebMvcTest {

    private static final Instant NEXT = Instant.parse("2024-05-16T12:00:00Z");

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    ReviewService reviewService;

    @Test
    void due_returnsSnakeCaseList() throws Exception {
        DueNoteResponse dto = new DueNoteResponse("gil.md", "GIL", 3L, 6, 2.5, ReviewMode.SPACED, NEXT, 2);
        when(reviewService.getDueNotes(eq(5), eq(ReviewMode.SPACED))).thenReturn(List.of(dto));

        mockMvc.perform(get("/review/due").param("limit", "5").param("mode", "spaced"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].filename").value("gil.md"))
                .andExpect(jsonPath("$[0].days_since_last_review").value(3))
                .andExpect(jsonPath("$[0].review_mode").value("spaced"))
                .andExpect(jsonPath("$[0].ease_factor").value(2.5));
    }

    @Test
    void due_unknownModeIsBadRequest() throws Exception {
        mockMvc.perform(get("/review/due").param("mode", "sometimes"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void rate_returnsOutcome() throws Exception {
        when(reviewService.recordReview("gil.md", 3))
                .thenReturn(new ReviewOutcomeResponse("gil.md", 3, NEXT, 15, 2.5, 4));

        mockMvc.perform(post("/review/notes/gil.md/rating")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.new_interval_days").value(15))
                .andExpect(jsonPath("$.next_review").value("2024-05-16T12:00:00Z"))
                .andExpect(jsonPath("$.review_count").value(4));
    }

    @Test
    void rate_invalidRatingIsBadRequest() throws Exception {
        when(reviewService.recordReview(anyString(), anyInt())).thenThrow(new InvalidRatingException(9));

        mockMvc.perform(post("/review/notes/gil.md/rating")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid Rating"))
                .andExpect(jsonPath("$.rating").value(9));
    }

    @Test
    void rate_missingRatingFailsValidation() throws Exception {
        mockMvc.perform(post("/review/notes/gil.md/rating")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void note_missingIsNotFound() throws Exception {
        when(reviewService.reviewNote("nope.md")).thenThrow(new NoteNotFoundException("nope.md"));

        mockMvc.perform(get("/review/notes/nope.md"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.filename").value("nope.md"));
    }

    @Test
    void note_malformedHeaderIsUnprocessable() throws Exception {
        when(reviewService.reviewNote("bad.md"))
                .thenThrow(new MalformedHeaderException("bad.md", List.of("ease_factor"), "ease_factor must not be null"));

        mockMvc.perform(get("/review/notes/bad.md"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.fields[0]").value("ease_factor"));
    }

    @Test
    void preview_delegatesWithDefaults() throws Exception {
        when(reviewService.calculateNextReview(isNull(), eq(4), eq(4), eq(2.5), eq(0), isNull()))
                .thenReturn(new NextReviewResponse(NEXT, 10, 2.65));

        mockMvc.perform(post("/review/preview")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":4,\"interval_days\":4,\"ease_factor\":2.5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.new_interval_days").value(10))
                .andExpect(jsonPath("$.new_ease_factor").value(2.65));

        verify(reviewService).calculateNextReview(isNull(), eq(4), eq(4), eq(2.5), eq(0), isNull());
    }
}
