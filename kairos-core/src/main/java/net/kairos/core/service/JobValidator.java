package net.kairos.core.service;

import net.kairos.core.error.InvalidScheduleSpecException;
import net.kairos.core.error.InvalidTaskDescriptorException;
import net.kairos.core.model.JobDraft;
import net.kairos.core.model.Schedule;
import net.kairos.core.model.TaskArg;
import net.kairos.core.model.TaskDescriptor;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 등록/편집 입력 검증. 스케줄 구조 검사는 ScheduleEngine, 운영 제약(폴링 주기, 큐, 인자)은 여기서.
 */
public final class JobValidator {
    private static final Pattern CALLABLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)+");

    private final ScheduleEngine engine;
    private final Duration pollInterval;
    private final Set<String> queues;

    /**
     * @param pollInterval 스케줄러 폴링 주기. Interval 주기는 이 값 이상이고 배수여야 한다 (null 이면 검사 생략)
     * @param queues       허용 큐 이름. 비어 있으면 검사 생략
     */
    public JobValidator(ScheduleEngine engine, Duration pollInterval, Set<String> queues) {
        this.engine = engine;
        this.pollInterval = pollInterval;
        this.queues = queues == null ? Set.of() : Set.copyOf(queues);
    }

    public void validate(JobDraft draft) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new InvalidTaskDescriptorException("job name is required");
        }
        engine.validate(draft.schedule());
        validateInterval(draft.schedule());
        validateTask(draft.task());
        validateResultTtl(draft.schedule(), draft.task());
    }

    void validateInterval(Schedule schedule) {
        if (!(schedule instanceof Schedule.Interval interval) || pollInterval == null) return;
        Duration period = interval.period();
        if (period.compareTo(pollInterval) < 0) {
            throw new InvalidScheduleSpecException("interval " + interval.display()
                    + " is shorter than the scheduler poll interval " + pollInterval + ", which is too frequent");
        }
        if (period.toMillis() % pollInterval.toMillis() != 0) {
            throw new InvalidScheduleSpecException("interval " + interval.display()
                    + " is not a multiple of the scheduler poll interval " + pollInterval);
        }
    }

    void validateTask(TaskDescriptor task) {
        if (task == null) throw new InvalidTaskDescriptorException("task is required");
        if (task.callable() == null || !CALLABLE.matcher(task.callable()).matches()) {
            throw new InvalidTaskDescriptorException("callable must be a dotted reference like 'module.function', was '"
                    + task.callable() + "'");
        }
        if (task.queue() == null || task.queue().isBlank()) {
            throw new InvalidTaskDescriptorException("queue is required");
        }
        if (!queues.isEmpty() && !queues.contains(task.queue())) {
            throw new InvalidTaskDescriptorException("unknown queue '" + task.queue() + "', expected one of " + queues);
        }
        if (task.timeout() != null && (task.timeout().isZero() || task.timeout().isNegative())) {
            throw new InvalidTaskDescriptorException("timeout must be positive");
        }
        validateArgs(task.args(), false);
        validateArgs(task.kwargs(), true);
    }

    /** 결과가 다음 실행 전에 만료되면 안 된다 (영구 보관 -1 은 허용) */
    void validateResultTtl(Schedule schedule, TaskDescriptor task) {
        Duration ttl = task.resultTtl();
        if (ttl == null || task.keepsResultForever()) return;
        if (ttl.isNegative()) throw new InvalidTaskDescriptorException("result ttl must be -1 or >= 0 seconds");
        if (schedule instanceof Schedule.Interval interval
                && interval.repeat() != null
                && ttl.compareTo(interval.period()) < 0) {
            throw new InvalidTaskDescriptorException("result ttl " + ttl + " must be at least the interval "
                    + interval.display() + " (or -1 to keep forever)");
        }
    }

    private static void validateArgs(List<TaskArg> args, boolean keyword) {
        Set<String> keys = new HashSet<>();
        for (TaskArg a : args) {
            if (keyword) {
                if (a.key() == null || a.key().isBlank()) {
                    throw new InvalidTaskDescriptorException("keyword argument requires a key");
                }
                if (!keys.add(a.key())) throw new InvalidTaskDescriptorException("duplicate keyword argument " + a.key());
            } else if (a.key() != null) {
                throw new InvalidTaskDescriptorException("positional argument must not have a key: " + a.key());
            }
            try {
                a.parsedValue();
            } catch (IllegalArgumentException e) {
                throw new InvalidTaskDescriptorException(e.getMessage(), e);
            }
        }
    }
}
