package net.kairos.core.model;

public enum ScheduleKind {
    ONCE, INTERVAL, CRON;

    public static ScheduleKind from(String s) {
        if (s == null) throw new IllegalArgumentException("schedule kind is null");
        return ScheduleKind.valueOf(s.trim().toUpperCase());
    }

    public String code() { return name(); }
}
