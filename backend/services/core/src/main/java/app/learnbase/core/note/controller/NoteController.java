package app.learnbase.core.note.controller;

import app.learnbase.core.note.controller.dto.AppendContentRequest;
import app.learnbase.core.note.controller.dto.CreateNoteRequest;
import app.learnbase.core.note.controller.dto.NoteStatsResponse;
import app.learnbase.core.note.controller.dto.NoteSummaryResponse;
import app.learnbase.core.note.service.NoteService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/notes")
public class NoteController {

    private final NoteService noteService;

    public NoteController(NoteService noteService) {
        this.noteService = noteService;
    }

    // GET /notes
    @GetMapping
    public List<NoteSummaryResponse> list() {
        return noteService.listNotes();
    }

    // GET /notes/stats
    @GetMapping("/stats")
    public NoteStatsResponse stats() {
        return noteService.stats();
    }

    // POST /notes
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public NoteSummaryResponse create(@Valid @RequestBody CreateNoteRequest req) {
        return noteService.createNote(req.title(), req.body(), req.reviewMode(), req.schedulePattern());
    }

    // POST /notes/{filename}/content
    @PostMapping("/{filename}/content")
    public NoteSummaryResponse append(@PathVariable String filename,
                                      @Valid @RequestBody AppendContentRequest req) {
        return noteService.appendContent(filename, req.content());
    }
}
