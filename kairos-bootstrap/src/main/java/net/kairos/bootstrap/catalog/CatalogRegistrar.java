package net.kairos.bootstrap.catalog;

import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.error.InvalidScheduleSpecException;
import net.kairos.core.error.InvalidTaskDescriptorException;
import net.kairos.core.model.IntervalUnit;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobDraft;
import net.kairos.core.model.Schedule;
import net.kairos.core.model.TaskArg;
import net.kairos.core.model.TaskDescriptor;
import net.kairos.core.service.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * 설정 파일의 잡 카탈로그를 이름 기준으로 멱등 등록한다.
 * 이미 있는 잡은 정의를 덮어쓰고, 스케줄이 같으면 커서는 유지된다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobStore store;
    private final ZoneId defaultZone;

    public CatalogRegistrar(JobStore store, ZoneId defaultZone) {
        this.store = store;
        this.defaultZone = defaultZone;
    }

    public List<Job> register(KairosProperties.Catalog catalog) {
        List<Job> registered = new ArrayList<>();
        for (var def : catalog.getJobs()) {
            Job job = store.register(toDraft(def));
            log.info("Catalog registered: job='{}' id={} nextRunAt={}", job.name(), job.id(), job.nextRunAt());
            registered.add(job);
        }
        return registered;
    }

    JobDraft toDraft(KairosProperties.JobDef def) {
        if (def.getName() == null || def.getName().isBlank()) {
            throw new InvalidTaskDescriptorException("catalog job name is required");
        }
        return new JobDraft(def.getName(), def.getDescription(), scheduleOf(def), taskOf(def), def.isEnabled());
    }

    private Schedule scheduleOf(KairosProperties.JobDef def) {
        int kinds = (def.getCron() != null ? 1 : 0) + (def.getInterval() != null ? 1 : 0) + (def.getRunAt() != null ? 1 : 0);
        if (kinds != 1) {
            throw new InvalidScheduleSpecException("catalog job '" + def.getName()
                    + "' needs exactly one of cron, interval or run-at");
        }
        if (def.getCron() != null) {
            return new Schedule.Cron(def.getCron(), zoneOf(def), def.getRepeat());
        }
        if (def.getInterval() != null) {
            IntervalUnit unit;
            try {
                unit = IntervalUnit.from(def.getIntervalUnit());
            } catch (IllegalArgumentException e) {
                throw new InvalidScheduleSpecException("unknown interval unit '" + def.getIntervalUnit() + "'", e);
            }
            if (unit == null) unit = IntervalUnit.SECONDS;
            Instant startAt = def.getStartAt() == null ? null : instant(def.getName(), def.getStartAt());
            return new Schedule.Interval(def.getInterval(), unit, def.getRepeat(), startAt);
        }
        return new Schedule.Once(instant(def.getName(), def.getRunAt()));
    }

    private static TaskDescriptor taskOf(KairosProperties.JobDef def) {
        return new TaskDescriptor(def.getCallable(),
                args(def.getArgs(), false),
                args(def.getKwargs(), true),
                def.getQueue(),
                def.getTimeout(),
                def.getResultTtl(),
                def.isAtFront());
    }

    private static List<TaskArg> args(List<KairosProperties.ArgDef> defs, boolean keyword) {
        List<TaskArg> out = new ArrayList<>();
        for (var a : defs) {
            TaskArg.Type type;
            try {
                type = TaskArg.Type.from(a.getType());
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new InvalidTaskDescriptorException("unknown argument type '" + a.getType() + "'", e);
            }
            out.add(keyword ? TaskArg.keyword(a.getKey(), type, a.getValue()) : new TaskArg(a.getKey(), type, a.getValue()));
        }
        return out;
    }

    private ZoneId zoneOf(KairosProperties.JobDef def) {
        if (def.getZone() == null) return defaultZone;
        try {
            return ZoneId.of(def.getZone());
        } catch (DateTimeException e) {
            throw new InvalidScheduleSpecException("unknown zone '" + def.getZone() + "' for job '" + def.getName() + "'", e);
        }
    }

    private static Instant instant(String job, String iso) {
        try {
            return Instant.parse(iso);
        } catch (DateTimeException e) {
            throw new InvalidScheduleSpecException("job '" + job + "': '" + iso + "' is not an ISO-8601 instant", e);
        }
    }
}
