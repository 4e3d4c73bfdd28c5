package net.kairos.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskDescriptorTest {

    @Test
    void describe_renders_call_with_typed_args() {
        var t = TaskDescriptor.of("reports.tasks.build", "default").withArgs(
                List.of(TaskArg.integer(1), TaskArg.str("x")),
                List.of(TaskArg.keyword("dry", TaskArg.Type.BOOL, "TRUE")));
        assertEquals("reports.tasks.build(1, 'x', dry=true)", t.describe());
    }

    @Test
    void arg_lists_are_copied() {
        List<TaskArg> args = new ArrayList<>(List.of(TaskArg.str("a")));
        var t = TaskDescriptor.of("a.b", "q").withArgs(args, null);
        args.add(TaskArg.str("b"));
        assertEquals(1, t.args().size());
        assertTrue(t.kwargs().isEmpty());
    }

    @Test
    void parsed_values_follow_declared_type() {
        assertEquals(42L, TaskArg.positional(TaskArg.Type.INT, " 42 ").parsedValue());
        assertEquals(Boolean.FALSE, TaskArg.positional(TaskArg.Type.BOOL, "False").parsedValue());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), TaskArg.datetime(Instant.parse("2024-01-01T00:00:00Z")).parsedValue());
        assertThrows(IllegalArgumentException.class, () -> TaskArg.positional(TaskArg.Type.BOOL, "yes").parsedValue());
        assertThrows(IllegalArgumentException.class, () -> TaskArg.positional(TaskArg.Type.DATETIME, "tomorrow").parsedValue());
    }

    @Test
    void forever_ttl_is_minus_one_second() {
        assertTrue(TaskDescriptor.of("a.b", "q").withResultTtl(TaskDescriptor.RESULT_TTL_FOREVER).keepsResultForever());
        assertFalse(TaskDescriptor.of("a.b", "q").keepsResultForever());
    }

    @Test
    void interval_display_and_period() {
        var s = Schedule.Interval.of(15, IntervalUnit.MINUTES);
        assertEquals("15 minutes", s.display());
        assertEquals(900, s.period().getSeconds());
        assertEquals(IntervalUnit.WEEKS, IntervalUnit.from(" weeks "));
        assertNull(IntervalUnit.from(""));
    }
}
