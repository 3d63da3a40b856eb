package app.learnbase.core.session.controller;

import app.learnbase.core.session.controller.dto.SessionIdResponse;
import app.learnbase.core.session.controller.dto.SessionSaveResponse;
import app.learnbase.core.session.domain.SessionRecord;
import app.learnbase.core.session.service.SessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    // POST /sessions/ids
    @PostMapping("/ids")
    public SessionIdResponse newSessionId() {
        return new SessionIdResponse(sessionService.newSessionId());
    }

    // POST /sessions/notes/{filename}
    @PostMapping("/notes/{filename}")
    @ResponseStatus(HttpStatus.CREATED)
    public SessionSaveResponse save(@PathVariable String filename,
                                    @Valid @RequestBody SessionRecord record) {
        return sessionService.saveSessionHistory(filename, record);
    }

    // GET /sessions/notes/{filename}
    @GetMapping("/notes/{filename}")
    public List<SessionRecord> history(@PathVariable String filename) {
        return sessionService.history(filename);
    }
}
