package net.kairos.core.service;

import net.kairos.core.error.InvalidScheduleSpecException;
import net.kairos.core.model.IntervalUnit;
import net.kairos.core.model.Job;
import net.kairos.core.model.Plan;
import net.kairos.core.model.Schedule;
import net.kairos.core.support.StepCron;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleEngineTest {

    static final ZoneId UTC = ZoneId.of("UTC");

    final ScheduleEngine engine = new ScheduleEngine(StepCron.hourly());

    static Instant t(String iso) { return Instant.parse(iso); }

    static Job job(Schedule schedule, Instant nextRunAt) {
        Instant created = t("2024-01-01T00:00:00Z");
        return new Job(1L, "default", "j", null, schedule, new byte[0], nextRunAt,
                true, false, null, 3L, created, created);
    }

    // ---------- nextOccurrence ----------

    @Test
    void interval_next_is_after_plus_period() {
        var s = Schedule.Interval.of(15, IntervalUnit.MINUTES);
        assertEquals(Optional.of(t("2024-01-01T10:15:00Z")), engine.nextOccurrence(s, t("2024-01-01T10:00:00Z")));
    }

    @Test
    void interval_next_is_strictly_later_for_any_after() {
        var s = Schedule.Interval.of(7, IntervalUnit.SECONDS);
        Instant after = t("2024-01-01T00:00:00Z");
        for (int i = 0; i < 1000; i++) {
            Instant next = engine.nextOccurrence(s, after).orElseThrow();
            assertTrue(next.isAfter(after));
            assertEquals(Duration.ofSeconds(7), Duration.between(after, next));
            after = after.plusMillis(1_337);
        }
    }

    @Test
    void interval_with_spent_repeat_has_no_next() {
        var s = new Schedule.Interval(1, IntervalUnit.HOURS, 0, null);
        assertTrue(engine.nextOccurrence(s, t("2024-01-01T00:00:00Z")).isEmpty());
    }

    @Test
    void once_returns_runAt_only_when_later() {
        var s = new Schedule.Once(t("2024-05-01T09:00:00Z"));
        assertEquals(Optional.of(t("2024-05-01T09:00:00Z")), engine.nextOccurrence(s, t("2024-05-01T08:59:59Z")));
        assertTrue(engine.nextOccurrence(s, t("2024-05-01T09:00:00Z")).isEmpty());
        assertTrue(engine.nextOccurrence(s, t("2024-05-02T00:00:00Z")).isEmpty());
    }

    @Test
    void cron_delegates_to_calculator() {
        var s = Schedule.Cron.of("0 * * * *", UTC);
        assertEquals(Optional.of(t("2024-01-01T11:00:00Z")), engine.nextOccurrence(s, t("2024-01-01T10:20:00Z")));
        assertEquals(Optional.of(t("2024-01-01T12:00:00Z")), engine.nextOccurrence(s, t("2024-01-01T11:00:00Z")));
    }

    // ---------- validate ----------

    @Test
    void validate_rejects_malformed_schedules() {
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(null));
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(new Schedule.Once(null)));
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(Schedule.Interval.of(0, IntervalUnit.MINUTES)));
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(new Schedule.Interval(5, null, null, null)));
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(new Schedule.Interval(5, IntervalUnit.MINUTES, -1, null)));
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(Schedule.Cron.of(" ", UTC)));
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(Schedule.Cron.of("0 * * * *", null)));
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(Schedule.Cron.of("bad cron", UTC)));
    }

    @Test
    void validate_rejects_interval_too_large_for_a_timestamp() {
        var overflowing = new Schedule.Interval(Long.MAX_VALUE, IntervalUnit.WEEKS, null, null);
        InvalidScheduleSpecException e =
                assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(overflowing));
        assertInstanceOf(ArithmeticException.class, e.getCause());

        // Duration 으로는 표현되지만 Instant 범위를 넘는 주기
        var beyondInstant = Schedule.Interval.of(Long.MAX_VALUE / 7 / 86_400, IntervalUnit.WEEKS);
        assertThrows(InvalidScheduleSpecException.class, () -> engine.validate(beyondInstant));
        assertThrows(InvalidScheduleSpecException.class,
                () -> engine.nextOccurrence(beyondInstant, t("2024-01-01T10:00:00Z")));
        assertThrows(InvalidScheduleSpecException.class,
                () -> engine.plan(overflowing, t("2024-01-01T10:00:00Z")));
    }

    // ---------- plan / replan ----------

    @Test
    void plan_interval_without_start_runs_one_period_from_now() {
        Plan p = engine.plan(Schedule.Interval.of(30, IntervalUnit.SECONDS), t("2024-01-01T00:00:00Z"));
        assertEquals(t("2024-01-01T00:00:30Z"), p.nextRunAt());
    }

    @Test
    void plan_interval_with_future_start_runs_at_start() {
        var s = new Schedule.Interval(1, IntervalUnit.DAYS, 3, t("2024-02-01T06:00:00Z"));
        Plan p = engine.plan(s, t("2024-01-01T00:00:00Z"));
        assertEquals(t("2024-02-01T06:00:00Z"), p.nextRunAt());
        assertEquals(3, p.schedule().repeat());
    }

    @Test
    void plan_interval_with_past_start_catches_up_and_consumes_missed_repeats() {
        // 00:00, 01:00, 02:00 은 지나감 → 03:00, repeat 5-3=2
        var s = new Schedule.Interval(1, IntervalUnit.HOURS, 5, t("2024-01-01T00:00:00Z"));
        Plan p = engine.plan(s, t("2024-01-01T02:30:00Z"));
        assertEquals(t("2024-01-01T03:00:00Z"), p.nextRunAt());
        assertEquals(2, p.schedule().repeat());
    }

    @Test
    void plan_interval_exhausted_when_missed_exceed_repeat() {
        var s = new Schedule.Interval(1, IntervalUnit.HOURS, 2, t("2024-01-01T00:00:00Z"));
        Plan p = engine.plan(s, t("2024-01-01T02:30:00Z"));
        assertTrue(p.exhausted());
        assertEquals(0, p.schedule().repeat());
    }

    @Test
    void replan_skips_missed_without_consuming_repeat() {
        var s = new Schedule.Interval(1, IntervalUnit.HOURS, 5, t("2024-01-01T00:00:00Z"));
        Plan p = engine.replan(s, t("2024-01-01T02:30:00Z"));
        assertEquals(t("2024-01-01T03:00:00Z"), p.nextRunAt());
        assertEquals(5, p.schedule().repeat());
    }

    @Test
    void plan_once_in_past_is_exhausted() {
        assertTrue(engine.plan(new Schedule.Once(t("2023-12-31T00:00:00Z")), t("2024-01-01T00:00:00Z")).exhausted());
    }

    @Test
    void plan_cron_without_future_occurrence_is_rejected() {
        assertThrows(InvalidScheduleSpecException.class,
                () -> engine.plan(Schedule.Cron.of("never", UTC), t("2024-01-01T00:00:00Z")));
    }

    // ---------- advance ----------

    @Test
    void advance_interval_decrements_repeat_until_exhausted() {
        var s = new Schedule.Interval(1, IntervalUnit.HOURS, 2, null);

        Plan first = engine.advance(job(s, t("2024-01-01T10:00:00Z")), t("2024-01-01T10:00:05Z"));
        assertEquals(t("2024-01-01T11:00:00Z"), first.nextRunAt());
        assertEquals(1, first.schedule().repeat());

        Plan second = engine.advance(job(first.schedule(), first.nextRunAt()), t("2024-01-01T11:00:03Z"));
        assertTrue(second.exhausted());
        assertEquals(0, second.schedule().repeat());
    }

    @Test
    void advance_interval_skips_missed_slots_keeping_phase() {
        var s = Schedule.Interval.of(1, IntervalUnit.HOURS);
        Plan p = engine.advance(job(s, t("2024-01-01T10:00:00Z")), t("2024-01-01T13:30:00Z"));
        assertEquals(t("2024-01-01T14:00:00Z"), p.nextRunAt());
        assertNull(p.schedule().repeat());
    }

    @Test
    void advance_interval_on_exact_boundary_moves_past_now() {
        var s = Schedule.Interval.of(1, IntervalUnit.HOURS);
        Plan p = engine.advance(job(s, t("2024-01-01T10:00:00Z")), t("2024-01-01T11:00:00Z"));
        assertEquals(t("2024-01-01T12:00:00Z"), p.nextRunAt());
    }

    @Test
    void advance_once_is_always_exhausted() {
        var s = new Schedule.Once(t("2024-01-01T10:00:00Z"));
        assertTrue(engine.advance(job(s, t("2024-01-01T10:00:00Z")), t("2024-01-01T10:00:01Z")).exhausted());
    }

    @Test
    void advance_cron_uses_next_slot_after_now() {
        var s = new Schedule.Cron("0 * * * *", UTC, 3);
        Plan p = engine.advance(job(s, t("2024-01-01T10:00:00Z")), t("2024-01-01T12:10:00Z"));
        assertEquals(t("2024-01-01T13:00:00Z"), p.nextRunAt());
        assertEquals(2, p.schedule().repeat());
    }

    @Test
    void advance_cron_without_more_slots_is_exhausted() {
        var s = Schedule.Cron.of("never", UTC);
        assertTrue(engine.advance(job(s, t("2024-01-01T10:00:00Z")), t("2024-01-01T10:00:01Z")).exhausted());
    }
}
