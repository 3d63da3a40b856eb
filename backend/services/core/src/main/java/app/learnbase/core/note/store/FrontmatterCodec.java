package app.learnbase.core.note.store;

import app.learnbase.core.error.MalformedHeaderException;
import app.learnbase.core.note.domain.Note;
import app.learnbase.core.note.domain.NoteHeader;
import app.learnbase.core.note.domain.ReviewMode;
import app.learnbase.core.review.algorithm.SchedulePattern;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads and writes the on-disk note format:
 * <pre>
 * ---
 * title: ...
 * ---
 * body text
 * </pre>
 */
@Component
public class FrontmatterCodec {

    static final String DELIMITER = "---\n";
    private static final String TRAILING_DELIMITER = "\n---";
    private static final String SCHEDULE_PATTERN_KEY = "schedule_pattern";
    private static final String SCHEDULE_PATTERN_CHECK = "schedulePatternPresentWhenScheduled";

    private final ObjectMapper yaml;
    private final Validator validator;

    public FrontmatterCodec(Validator validator) {
        this.validator = validator;
        YAMLFactory factory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .disable(YAMLGenerator.Feature.SPLIT_LINES)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build();
        this.yaml = new ObjectMapper(factory)
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public Note decode(String filename, String text) {
        if (text == null || !text.startsWith(DELIMITER)) {
            throw new MalformedHeaderException(filename, List.of(), "missing opening '---' delimiter");
        }

        String raw;
        String body;
        int close = text.indexOf("\n" + DELIMITER, DELIMITER.length() - 1);
        if (close >= 0) {
            raw = text.substring(DELIMITER.length(), close + 1);
            body = text.substring(close + 1 + DELIMITER.length());
        } else if (text.endsWith(TRAILING_DELIMITER) && text.length() >= DELIMITER.length() + 3) {
            raw = text.substring(DELIMITER.length(), text.length() - 3);
            body = "";
        } else {
            throw new MalformedHeaderException(filename, List.of(), "missing closing '---' delimiter");
        }

        NoteHeader header = parseHeader(filename, raw);
        validate(filename, header);
        return new Note(filename, header, body, new Note.SourceHeader(header, raw));
    }

    public String encode(Note note) {
        validate(note.filename(), note.header());
        Note.SourceHeader source = note.source();
        String raw = (source != null && source.header().equals(note.header()))
                ? source.raw()
                : writeHeader(note.header());
        return DELIMITER + raw + DELIMITER + note.body();
    }

    public void validate(String filename, NoteHeader header) {
        Set<ConstraintViolation<NoteHeader>> violations = validator.validate(header);
        Set<String> fields = new TreeSet<>();
        List<String> messages = new ArrayList<>();
        for (ConstraintViolation<NoteHeader> v : violations) {
            String field = toHeaderKey(v.getPropertyPath().toString());
            fields.add(field);
            messages.add(field + " " + v.getMessage());
        }
        if (header.reviewMode() == ReviewMode.SCHEDULED && !fields.contains(SCHEDULE_PATTERN_KEY)) {
            try {
                SchedulePattern.parse(header.schedulePattern());
            } catch (IllegalArgumentException ex) {
                fields.add(SCHEDULE_PATTERN_KEY);
                messages.add(SCHEDULE_PATTERN_KEY + " " + ex.getMessage());
            }
        }
        if (fields.isEmpty()) {
            return;
        }
        messages.sort(null);
        throw new MalformedHeaderException(filename, List.copyOf(fields), String.join("; ", messages));
    }

    private NoteHeader parseHeader(String filename, String raw) {
        try {
            NoteHeader header = yaml.readValue(raw, NoteHeader.class);
            if (header == null) {
                throw new MalformedHeaderException(filename, List.of(), "empty header");
            }
            return header;
        } catch (JsonMappingException ex) {
            List<String> fields = ex.getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .filter(name -> name != null)
                    .toList();
            throw new MalformedHeaderException(filename, fields, ex.getOriginalMessage(), ex);
        } catch (JsonProcessingException ex) {
            throw new MalformedHeaderException(filename, List.of(), ex.getOriginalMessage(), ex);
        }
    }

    private String writeHeader(NoteHeader header) {
        try {
            return yaml.writeValueAsString(header);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize note header", ex);
        }
    }

    // questionPerformance[abc].<map value> -> question_performance[abc].<map value>
    private static String toHeaderKey(String propertyPath) {
        if (propertyPath.equals(SCHEDULE_PATTERN_CHECK)) {
            return SCHEDULE_PATTERN_KEY;
        }
        StringBuilder out = new StringBuilder(propertyPath.length() + 8);
        boolean inIndex = false;
        for (char c : propertyPath.toCharArray()) {
            if (c == '[') inIndex = true;
            if (c == ']') inIndex = false;
            if (!inIndex && Character.isUpperCase(c)) {
                out.append('_').append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
