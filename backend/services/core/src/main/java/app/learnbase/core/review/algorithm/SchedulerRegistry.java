package app.learnbase.core.review.algorithm;

import app.learnbase.core.note.domain.ReviewMode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class SchedulerRegistry {

    private final Map<ReviewMode, ReviewScheduler> schedulers;

    public SchedulerRegistry(List<ReviewScheduler> list) {
        Map<ReviewMode, ReviewScheduler> map = new EnumMap<>(ReviewMode.class);
        for (var s : list) map.put(s.mode(), s);
        this.schedulers = map;
    }

    public ReviewScheduler require(ReviewMode mode) {
        var s = schedulers.get(mode);
        if (s == null) throw new IllegalArgumentException("Unsupported review mode: " + mode);
        return s;
    }
}
