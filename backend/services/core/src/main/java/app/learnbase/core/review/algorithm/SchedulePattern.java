package app.learnbase.core.review.algorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed review cadence such as {@code 1d,1w,2w,1m,3m,6m}, or one of the named presets.
 */
public record SchedulePattern(String source, List<Integer> intervalsDays) {

    public static final Map<String, String> PRESETS = Map.of(
            "aggressive", "1d,3d,1w,2w,1m,3m",
            "moderate", "1d,1w,2w,1m,3m,6m",
            "relaxed", "1w,2w,1m,2m,6m,1y"
    );

    private static final Pattern PART = Pattern.compile("(\\d+)([dwmy])");

    public SchedulePattern {
        intervalsDays = List.copyOf(intervalsDays);
    }

    public static SchedulePattern parse(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Schedule pattern is required");
        }
        String expanded = PRESETS.getOrDefault(pattern.trim().toLowerCase(Locale.ROOT), pattern);

        List<Integer> intervals = new ArrayList<>();
        for (String part : expanded.split(",")) {
            String p = part.trim().toLowerCase(Locale.ROOT);
            if (p.isEmpty()) {
                continue;
            }
            Matcher m = PART.matcher(p);
            if (!m.matches()) {
                throw new IllegalArgumentException("Invalid schedule pattern '" + pattern + "': bad entry '" + part.trim() + "'");
            }
            int value = Integer.parseInt(m.group(1));
            if (value <= 0) {
                throw new IllegalArgumentException("Invalid schedule pattern '" + pattern + "': entries must be positive");
            }
            int days = switch (m.group(2)) {
                case "d" -> value;
                case "w" -> value * 7;
                case "m" -> value * 30;
                default -> value * 365;
            };
            intervals.add(days);
        }
        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("Schedule pattern must produce at least one interval: '" + pattern + "'");
        }
        return new SchedulePattern(pattern, intervals);
    }

    /**
     * Interval for the review that follows {@code completedReviews} earlier ones;
     * the last entry repeats once the pattern is exhausted.
     */
    public int intervalFor(int completedReviews) {
        int index = Math.min(Math.max(0, completedReviews), intervalsDays.size() - 1);
        return intervalsDays.get(index);
    }
}
