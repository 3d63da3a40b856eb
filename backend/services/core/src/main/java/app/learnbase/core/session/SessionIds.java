package app.learnbase.core.session;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

public final class SessionIds {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private SessionIds() {
    }

    /**
     * {@code yyyyMMdd-HHmmss-xxxxxx}: local time plus six random hex digits.
     */
    public static String next(Clock clock) {
        String stamp = FORMAT.format(clock.instant().atZone(clock.getZone()));
        int suffix = ThreadLocalRandom.current().nextInt(0x1000000);
        return stamp + "-" + String.format("%06x", suffix);
    }
}
