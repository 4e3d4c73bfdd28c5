package net.kairos.bootstrap.catalog;

import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.error.InvalidScheduleSpecException;
import net.kairos.core.error.InvalidTaskDescriptorException;
import net.kairos.core.model.IntervalUnit;
import net.kairos.core.model.Schedule;
import net.kairos.core.model.TaskArg;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogRegistrarTest {

    // toDraft 는 저장소를 쓰지 않는다
    final CatalogRegistrar registrar = new CatalogRegistrar(null, ZoneOffset.UTC);

    static KairosProperties.JobDef job(String name) {
        var def = new KairosProperties.JobDef();
        def.setName(name);
        def.setCallable("app.tasks.run");
        return def;
    }

    @Test
    void cron_job_uses_default_zone_unless_overridden() {
        var def = job("a");
        def.setCron("0 * * * *");
        assertThat(registrar.toDraft(def).schedule()).isEqualTo(Schedule.Cron.of("0 * * * *", ZoneOffset.UTC));

        def.setZone("Europe/Paris");
        assertThat(registrar.toDraft(def).schedule())
                .isEqualTo(Schedule.Cron.of("0 * * * *", ZoneId.of("Europe/Paris")));
    }

    @Test
    void interval_job_maps_unit_repeat_and_start() {
        var def = job("b");
        def.setInterval(2L);
        def.setIntervalUnit("HOURS");
        def.setRepeat(4);
        def.setStartAt("2024-01-01T00:00:00Z");

        assertThat(registrar.toDraft(def).schedule())
                .isEqualTo(new Schedule.Interval(2, IntervalUnit.HOURS, 4, Instant.parse("2024-01-01T00:00:00Z")));
    }

    @Test
    void once_job_and_task_fields() {
        var def = job("c");
        def.setRunAt("2030-05-01T09:00:00Z");
        def.setQueue("high");
        def.setTimeout(Duration.ofMinutes(1));
        def.setAtFront(true);
        def.setEnabled(false);
        var arg = new KairosProperties.ArgDef();
        arg.setType("int");
        arg.setValue("42");
        def.getArgs().add(arg);

        var draft = registrar.toDraft(def);

        assertThat(draft.schedule()).isEqualTo(new Schedule.Once(Instant.parse("2030-05-01T09:00:00Z")));
        assertThat(draft.enabled()).isFalse();
        assertThat(draft.task().queue()).isEqualTo("high");
        assertThat(draft.task().timeout()).isEqualTo(Duration.ofMinutes(1));
        assertThat(draft.task().atFront()).isTrue();
        assertThat(draft.task().args()).containsExactly(TaskArg.integer(42));
    }

    @Test
    void requires_exactly_one_schedule_kind() {
        assertThatThrownBy(() -> registrar.toDraft(job("none")))
                .isInstanceOf(InvalidScheduleSpecException.class);

        var both = job("both");
        both.setCron("0 * * * *");
        both.setInterval(60L);
        assertThatThrownBy(() -> registrar.toDraft(both))
                .isInstanceOf(InvalidScheduleSpecException.class)
                .hasMessageContaining("exactly one");
    }

    @Test
    void rejects_bad_values() {
        var badZone = job("z");
        badZone.setCron("0 * * * *");
        badZone.setZone("Mars/Olympus");
        assertThatThrownBy(() -> registrar.toDraft(badZone)).isInstanceOf(InvalidScheduleSpecException.class);

        var badUnit = job("u");
        badUnit.setInterval(1L);
        badUnit.setIntervalUnit("fortnights");
        assertThatThrownBy(() -> registrar.toDraft(badUnit)).isInstanceOf(InvalidScheduleSpecException.class);

        var badRunAt = job("r");
        badRunAt.setRunAt("tomorrow");
        assertThatThrownBy(() -> registrar.toDraft(badRunAt)).isInstanceOf(InvalidScheduleSpecException.class);

        var badType = job("t");
        badType.setRunAt("2030-01-01T00:00:00Z");
        var arg = new KairosProperties.ArgDef();
        arg.setType("float");
        arg.setValue("1.5");
        badType.getArgs().add(arg);
        assertThatThrownBy(() -> registrar.toDraft(badType)).isInstanceOf(InvalidTaskDescriptorException.class);

        var unnamed = job(" ");
        assertThatThrownBy(() -> registrar.toDraft(unnamed)).isInstanceOf(InvalidTaskDescriptorException.class);
    }
}
