package app.learnbase.core.session.priority;

import app.learnbase.core.note.domain.PriorityRequest;
import app.learnbase.core.session.domain.SessionQuestion;
import app.learnbase.core.session.domain.TopicRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Focus topics requested by the user. An entry stays active until it has been
 * covered in {@link PriorityRequest#ADDRESSED_THRESHOLD} separate sessions.
 */
@Component
public class PriorityRegistry {

    private static final Logger log = LoggerFactory.getLogger(PriorityRegistry.class);

    public List<PriorityRequest> register(List<PriorityRequest> existing,
                                          String topic,
                                          String reason,
                                          String sessionId,
                                          Instant now) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Priority topic cannot be empty");
        }
        List<PriorityRequest> out = new ArrayList<>(existing);
        for (int i = 0; i < out.size(); i++) {
            PriorityRequest r = out.get(i);
            if (r.active() && r.matches(topic)) {
                out.set(i, r.refreshed(reason, sessionId, now));
                return out;
            }
        }
        out.add(PriorityRequest.open(topic, reason, sessionId, now));
        log.debug("Registered priority request '{}'", topic.trim());
        return out;
    }

    /**
     * Credits every active entry at most once: either its topic is one of
     * {@code topicsAddressed} or it occurs in one of the question texts.
     */
    public List<PriorityRequest> markAddressed(List<PriorityRequest> existing,
                                               Collection<String> topicsAddressed,
                                               Collection<String> questionTexts) {
        Set<String> addressed = topicsAddressed.stream()
                .map(PriorityRequest::normalize)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toSet());
        List<String> texts = questionTexts.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .toList();

        List<PriorityRequest> out = new ArrayList<>(existing.size());
        for (PriorityRequest r : existing) {
            if (!r.active()) {
                out.add(r);
                continue;
            }
            String topic = PriorityRequest.normalize(r.topic());
            boolean covered = addressed.contains(topic) || texts.stream().anyMatch(t -> t.contains(topic));
            if (!covered) {
                out.add(r);
                continue;
            }
            PriorityRequest credited = r.addressed();
            if (!credited.active()) {
                log.info("Priority '{}' addressed {} times, deactivated", r.topic(), credited.timesAddressed());
            }
            out.add(credited);
        }
        return out;
    }

    /**
     * Registers the session's new requests, then credits the addressed ones.
     */
    public List<PriorityRequest> apply(List<PriorityRequest> existing,
                                       List<TopicRequest> requested,
                                       List<String> topicsAddressed,
                                       List<SessionQuestion> questions,
                                       String sessionId,
                                       Instant now) {
        List<PriorityRequest> current = existing;
        for (TopicRequest req : requested) {
            current = register(current, req.topic(), req.reason(), sessionId, now);
        }
        List<String> texts = questions.stream().map(SessionQuestion::questionText).toList();
        return markAddressed(current, topicsAddressed, texts);
    }

    public List<PriorityRequest> active(List<PriorityRequest> all) {
        return all.stream().filter(PriorityRequest::active).toList();
    }
}
