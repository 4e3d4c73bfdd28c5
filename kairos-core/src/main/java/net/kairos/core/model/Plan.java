package net.kairos.core.model;

import java.time.Instant;

/**
 * 스케줄 계산 결과. schedule 은 repeat 가 갱신된 상태일 수 있다.
 * nextRunAt 이 null 이면 소진(exhausted).
 */
public record Plan(Schedule schedule, Instant nextRunAt) {

    public static Plan exhausted(Schedule schedule) { return new Plan(schedule, null); }

    public boolean exhausted() { return nextRunAt == null; }
}
