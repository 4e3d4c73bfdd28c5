package net.kairos.core.model;

import java.time.Duration;
import java.util.Locale;

/** 반복 주기 단위. WEEKS 는 ChronoUnit 상 추정 단위라 초 단위로 직접 환산한다. */
public enum IntervalUnit {
    SECONDS(1L),
    MINUTES(60L),
    HOURS(3_600L),
    DAYS(86_400L),
    WEEKS(604_800L);

    private final long seconds;

    IntervalUnit(long seconds) { this.seconds = seconds; }

    public Duration toDuration(long amount) {
        return Duration.ofSeconds(Math.multiplyExact(amount, seconds));
    }

    public String label() { return name().toLowerCase(Locale.ROOT); }

    public static IntervalUnit from(String s) {
        if (s == null || s.isBlank()) return null;
        return IntervalUnit.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
