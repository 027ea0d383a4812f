package com.racelisting.common.seed;

import org.apache.commons.lang3.RandomUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Random values for demonstration rows.
 */
public final class DemoData {

    private static final Duration START_WINDOW_BEFORE = Duration.ofDays(1);
    private static final Duration START_WINDOW_AFTER = Duration.ofDays(2);

    private DemoData() {
    }

    /** Inclusive on both ends. */
    public static int between(int min, int max) {
        return RandomUtils.nextInt(min, max + 1);
    }

    public static <E> E pick(List<E> values) {
        return values.get(RandomUtils.nextInt(0, values.size()));
    }

    /**
     * A start time between one day ago and two days ahead, to the second,
     * as stored text. Whole seconds keep the text ordering chronological.
     */
    public static String startTime(Clock clock) {
        Instant now = clock.instant();
        Instant from = now.minus(START_WINDOW_BEFORE);
        long span = START_WINDOW_BEFORE.plus(START_WINDOW_AFTER).toSeconds();
        return from.plusSeconds(RandomUtils.nextLong(0, span + 1))
                .truncatedTo(ChronoUnit.SECONDS)
                .toString();
    }
}
