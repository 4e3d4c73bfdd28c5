package net.kairos.core.service;

import net.kairos.core.error.InvalidScheduleSpecException;
import net.kairos.core.model.Job;
import net.kairos.core.model.Plan;
import net.kairos.core.model.Schedule;
import net.kairos.core.spi.CronCalculator;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 다음 실행 시각 계산기. I/O 없음, 호출 간 상태 없음.
 * cron 평가는 CronCalculator SPI 에 위임한다.
 */
public final class ScheduleEngine {
    private final CronCalculator cron;

    public ScheduleEngine(CronCalculator cron) { this.cron = Objects.requireNonNull(cron); }

    /** after 보다 엄격히 늦은 다음 슬롯. 없으면 empty */
    public Optional<Instant> nextOccurrence(Schedule schedule, Instant after) {
        validate(schedule);
        if (schedule instanceof Schedule.Once once) {
            return once.runAt().isAfter(after) ? Optional.of(once.runAt()) : Optional.empty();
        }
        if (schedule instanceof Schedule.Interval interval) {
            if (isSpent(interval.repeat())) return Optional.empty();
            return Optional.of(after.plus(interval.period()));
        }
        Schedule.Cron c = (Schedule.Cron) schedule;
        if (isSpent(c.repeat())) return Optional.empty();
        return cron.next(after, c.expression(), c.zone());
    }

    /** 구조 검사. 문제 있으면 InvalidScheduleSpecException */
    public void validate(Schedule schedule) {
        if (schedule == null) throw new InvalidScheduleSpecException("schedule is required");
        if (schedule.repeat() != null && schedule.repeat() < 0) {
            throw new InvalidScheduleSpecException("repeat must be >= 0 or unbounded, was " + schedule.repeat());
        }
        if (schedule instanceof Schedule.Once once) {
            if (once.runAt() == null) throw new InvalidScheduleSpecException("once schedule requires runAt");
        } else if (schedule instanceof Schedule.Interval interval) {
            if (interval.unit() == null) throw new InvalidScheduleSpecException("interval unit is required");
            if (interval.every() <= 0) {
                throw new InvalidScheduleSpecException("interval period must be positive, was " + interval.display());
            }
            try {
                // Instant 범위를 넘는 주기는 다음 슬롯 계산에서 터지므로 등록 시점에 거절
                Instant.EPOCH.plus(interval.period());
            } catch (ArithmeticException | DateTimeException e) {
                throw new InvalidScheduleSpecException("interval " + interval.display() + " is too large", e);
            }
        } else if (schedule instanceof Schedule.Cron c) {
            if (c.expression() == null || c.expression().isBlank()) {
                throw new InvalidScheduleSpecException("cron expression is required");
            }
            if (c.zone() == null) throw new InvalidScheduleSpecException("cron time zone is required");
            cron.validate(c.expression());
        } else {
            throw new InvalidScheduleSpecException("unsupported schedule " + schedule.getClass().getName());
        }
    }

    /**
     * 신규 등록 시 첫 슬롯. 과거 startAt 을 가진 Interval 은 놓친 슬롯만큼 repeat 를 소모하며 따라잡는다.
     */
    public Plan plan(Schedule schedule, Instant now) {
        return firstRun(schedule, now, true);
    }

    /**
     * 편집/재활성화 시 재계산. 놓친 슬롯은 건너뛰되 repeat 는 소모하지 않는다.
     */
    public Plan replan(Schedule schedule, Instant now) {
        return firstRun(schedule, now, false);
    }

    /**
     * 클레임 직후 커서 전진. 이번 디스패치 1회를 repeat 에서 차감하고, 다음 슬롯은 now 보다 엄격히 뒤.
     * 놓친 슬롯은 재생하지 않는다.
     */
    public Plan advance(Job job, Instant now) {
        Schedule s = job.schedule();
        if (s instanceof Schedule.Once) {
            return Plan.exhausted(s);
        }
        Integer remaining = s.repeat() == null ? null : Math.max(0, s.repeat() - 1);
        Schedule next = s.withRepeat(remaining);
        if (isSpent(remaining)) return Plan.exhausted(next);

        if (s instanceof Schedule.Interval interval) {
            // 기존 슬롯 위상을 유지: prevDue + k·period (k >= 1, 결과 > now)
            Instant base = job.nextRunAt() != null ? job.nextRunAt() : now;
            return new Plan(next, firstSlotAfter(base, interval.period(), now));
        }
        Schedule.Cron c = (Schedule.Cron) s;
        return cron.next(now, c.expression(), c.zone())
                .map(at -> new Plan(next, at))
                .orElseGet(() -> Plan.exhausted(next));
    }

    private Plan firstRun(Schedule schedule, Instant now, boolean consumeMissed) {
        validate(schedule);
        if (schedule instanceof Schedule.Once once) {
            return once.runAt().isAfter(now) ? new Plan(once, once.runAt()) : Plan.exhausted(once);
        }
        if (isSpent(schedule.repeat())) return Plan.exhausted(schedule);

        if (schedule instanceof Schedule.Interval interval) {
            Duration period = interval.period();
            Instant start = interval.startAt();
            if (start == null) return new Plan(interval, now.plus(period));
            if (start.isAfter(now)) return new Plan(interval, start);

            // startAt 이 과거: startAt + i·period (i = 0..missed-1) 슬롯은 이미 지나감
            long missed = Duration.between(start, now).dividedBy(period) + 1;
            Instant next = start.plus(period.multipliedBy(missed));
            if (!consumeMissed || interval.repeat() == null) return new Plan(interval, next);

            long remaining = interval.repeat() - missed;
            if (remaining <= 0) return Plan.exhausted(interval.withRepeat(0));
            return new Plan(interval.withRepeat((int) remaining), next);
        }
        Schedule.Cron c = (Schedule.Cron) schedule;
        Instant next = cron.next(now, c.expression(), c.zone())
                .orElseThrow(() -> new InvalidScheduleSpecException(
                        "cron expression has no future occurrence: " + c.expression()));
        return new Plan(c, next);
    }

    static Instant firstSlotAfter(Instant base, Duration period, Instant now) {
        if (base.isAfter(now)) return base.plus(period);
        long k = Duration.between(base, now).dividedBy(period) + 1;
        return base.plus(period.multipliedBy(k));
    }

    private static boolean isSpent(Integer repeat) {
        return repeat != null && repeat <= 0;
    }
}
