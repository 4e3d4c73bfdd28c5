package net.kairos.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Job 의 실행 시점 정의. 구현체 자체가 종류(kind)를 결정하므로 kind 와 payload 모양이 어긋날 수 없다.
 * <p>
 * repeat 는 "남은 디스패치 횟수"이다. null 이면 무제한, 0 이면 소진.
 */
public interface Schedule {

    ScheduleKind kind();

    default Integer repeat() { return null; }

    default Schedule withRepeat(Integer repeat) { return this; }

    /** 지정 시각 1회 */
    record Once(Instant runAt) implements Schedule {
        @Override public ScheduleKind kind() { return ScheduleKind.ONCE; }
    }

    /** every × unit 간격 반복. startAt 이 없으면 등록 시각 + 주기가 첫 슬롯 */
    record Interval(long every, IntervalUnit unit, Integer repeat, Instant startAt) implements Schedule {
        public static Interval of(long every, IntervalUnit unit) {
            return new Interval(every, unit, null, null);
        }

        @Override public ScheduleKind kind() { return ScheduleKind.INTERVAL; }

        public Duration period() { return unit.toDuration(every); }

        /** 예: "15 minutes" */
        public String display() { return every + " " + unit.label(); }

        @Override
        public Interval withRepeat(Integer repeat) {
            return new Interval(every, unit, repeat, startAt);
        }
    }

    /** 5필드(분 단위) 또는 6필드(초 포함) cron + 타임존 */
    record Cron(String expression, ZoneId zone, Integer repeat) implements Schedule {
        public static Cron of(String expression, ZoneId zone) {
            return new Cron(expression, zone, null);
        }

        @Override public ScheduleKind kind() { return ScheduleKind.CRON; }

        @Override
        public Cron withRepeat(Integer repeat) {
            return new Cron(expression, zone, repeat);
        }
    }
}
