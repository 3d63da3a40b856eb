package app.learnbase.core.review.controller;

import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.review.controller.dto.DueNoteResponse;
import app.learnbase.core.review.controller.dto.NextReviewResponse;
import app.learnbase.core.review.controller.dto.NoteViewResponse;
import app.learnbase.core.review.controller.dto.PreviewRequest;
import app.learnbase.core.review.controller.dto.RecordReviewRequest;
import app.learnbase.core.review.controller.dto.ReviewOutcomeResponse;
import app.learnbase.core.review.domain.Rating;
import app.learnbase.core.review.service.ReviewService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/review")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    // GET /review/due?limit=10&mode=spaced
    @GetMapping("/due")
    public List<DueNoteResponse> due(@RequestParam(required = false) Integer limit,
                                     @RequestParam(required = false) String mode) {
        ReviewMode reviewMode = mode == null ? null : ReviewMode.fromString(mode);
        return reviewService.getDueNotes(limit, reviewMode);
    }

    // GET /review/notes/{filename}
    @GetMapping("/notes/{filename}")
    public NoteViewResponse note(@PathVariable String filename) {
        return reviewService.reviewNote(filename);
    }

    // GET /review/notes/{filename}/preview
    @GetMapping("/notes/{filename}/preview")
    public Map<Rating, NextReviewResponse> previewNote(@PathVariable String filename) {
        return reviewService.previewNote(filename);
    }

    // POST /review/notes/{filename}/rating
    @PostMapping("/notes/{filename}/rating")
    public ReviewOutcomeResponse rate(@PathVariable String filename,
                                      @Valid @RequestBody RecordReviewRequest req) {
        return reviewService.recordReview(filename, req.rating());
    }

    // POST /review/preview
    @PostMapping("/preview")
    public NextReviewResponse preview(@Valid @RequestBody PreviewRequest req) {
        return reviewService.calculateNextReview(
                req.reviewMode(),
                req.rating(),
                req.intervalDays(),
                req.easeFactor(),
                req.reviewCount() == null ? 0 : req.reviewCount(),
                req.schedulePattern()
        );
    }
}
