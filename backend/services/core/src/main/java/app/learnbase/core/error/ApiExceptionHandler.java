package app.learnbase.core.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * Renders domain failures as RFC 7807 problem details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoteNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(NoteNotFoundException ex) {
        log.warn("Note not found: {}", ex.getFilename());
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, "Note Not Found", ex.getMessage());
        problem.setProperty("filename", ex.getFilename());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(InvalidRatingException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRating(InvalidRatingException ex) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid Rating", ex.getMessage());
        problem.setProperty("rating", ex.getRating());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MalformedHeaderException.class)
    public ResponseEntity<ProblemDetail> handleMalformedHeader(MalformedHeaderException ex) {
        log.error("Malformed note header in {}: {}", ex.getFilename(), ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed Note Header", ex.getMessage());
        problem.setProperty("filename", ex.getFilename());
        problem.setProperty("fields", ex.getFields());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(SessionAlreadyRecordedException.class)
    public ResponseEntity<ProblemDetail> handleAlreadyRecorded(SessionAlreadyRecordedException ex) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Session Already Recorded", ex.getMessage());
        problem.setProperty("filename", ex.getFilename());
        problem.setProperty("sessionId", ex.getSessionId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorage(StorageException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        ProblemDetail problem = problem(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Failure", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleInvalidBody(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed");
        problem.setProperty("errors", errors);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleUnreadable(Exception ex) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be read");
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage());
        return ResponseEntity.badRequest().body(problem);
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
