package app.learnbase.core.session.performance;

import app.learnbase.core.session.domain.SessionQuestion;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-question exponential moving average. Recent sessions weigh
 * {@value #NEW_WEIGHT}, history {@value #OLD_WEIGHT}.
 */
@Component
public class PerformanceTracker {

    public static final double NEW_WEIGHT = 0.7;
    public static final double OLD_WEIGHT = 0.3;

    public Map<String, Double> merge(Map<String, Double> existing, List<SessionQuestion> questions) {
        Map<String, Double> merged = new LinkedHashMap<>(existing == null ? Map.of() : existing);
        for (SessionQuestion q : questions) {
            double score = q.score();
            if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
            }
            merged.merge(q.resolvedHash(), score, (old, s) -> NEW_WEIGHT * s + OLD_WEIGHT * old);
        }
        return merged;
    }
}
