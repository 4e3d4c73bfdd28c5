package net.kairos.core.service;

import net.kairos.core.error.DuplicateNameException;
import net.kairos.core.error.JobConcurrentModificationException;
import net.kairos.core.error.JobNotFoundException;
import net.kairos.core.error.SchedulingException;
import net.kairos.core.error.StoreUnavailableException;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobDraft;
import net.kairos.core.model.Plan;
import net.kairos.core.model.Schedule;
import net.kairos.core.model.TaskDescriptor;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.PayloadCodec;
import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;

/**
 * Job 레코드 저장소 계약. 하나의 namespace 를 대상으로 동작한다.
 * <p>
 * 변경은 {@link #update} 와 {@link #claimAndAdvance} 두 경로로만 일어나며 둘 다 버전 검사를 거친다.
 */
public final class JobStore {
    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    public static final int DEFAULT_BATCH_SIZE = 500;

    private final JobRepository jobs;
    private final TxRunner tx;
    private final ScheduleEngine engine;
    private final JobValidator validator;
    private final PayloadCodec codec;
    private final Clock clock;
    private final String namespace;

    public JobStore(JobRepository jobs,
                    TxRunner tx,
                    ScheduleEngine engine,
                    JobValidator validator,
                    PayloadCodec codec,
                    Clock clock,
                    String namespace) {
        this.jobs = jobs;
        this.tx = tx;
        this.engine = engine;
        this.validator = validator;
        this.codec = codec;
        this.clock = clock;
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    public String namespace() { return namespace; }

    /** 신규 등록. 같은 namespace 에 같은 이름이 있으면 DuplicateNameException */
    public long create(JobDraft draft) {
        validator.validate(draft);
        Instant now = clock.now();
        Plan plan = engine.plan(draft.schedule(), now);
        Job job = Job.ofNew(namespace, draft, codec.encode(draft.task()), plan, now);

        long id = call("create " + draft.name(), () -> tx.required(() -> {
            if (jobs.findByName(namespace, draft.name()).isPresent()) {
                throw new DuplicateNameException(namespace, draft.name());
            }
            return jobs.insert(job);
        }));
        log.info("Job registered: id={} name='{}' schedule={} nextRunAt={}", id, draft.name(), plan.schedule(), job.nextRunAt());
        return id;
    }

    public Job get(long id) {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    public Optional<Job> find(long id) {
        return call("get " + id, () -> tx.required(() -> jobs.findById(id)
                .filter(j -> namespace.equals(j.namespace()))));
    }

    public Optional<Job> findByName(String name) {
        return call("findByName " + name, () -> tx.required(() -> jobs.findByName(namespace, name)));
    }

    public List<Job> list() {
        return call("list", () -> tx.required(() -> jobs.findAll(namespace)));
    }

    /**
     * 사용자 편집. mutator 결과를 재검증하고 nextRunAt 을 다시 계산한다.
     * 스케줄이 그대로이고 활성 상태가 유지되면 현재 커서를 보존한다.
     */
    public Job update(long id, UnaryOperator<JobDraft> mutator, long expectedVersion) {
        return call("update " + id, () -> tx.required(() -> {
            Job current = jobs.findById(id)
                    .filter(j -> namespace.equals(j.namespace()))
                    .orElseThrow(() -> new JobNotFoundException(id));
            if (current.version() != expectedVersion) {
                throw new JobConcurrentModificationException(id, expectedVersion, current.version());
            }
            JobDraft before = draftOf(current);
            JobDraft edited = mutator.apply(before);
            validator.validate(edited);

            if (!current.name().equals(edited.name())) {
                Optional<Job> clash = jobs.findByName(namespace, edited.name());
                if (clash.isPresent() && !clash.get().id().equals(current.id())) {
                    throw new DuplicateNameException(namespace, edited.name());
                }
            }

            Instant now = clock.now();
            Plan plan = keepsCursor(current, edited)
                    ? new Plan(current.schedule(), current.nextRunAt())
                    : engine.replan(edited.schedule(), now);
            Job next = current.editedBy(edited, codec.encode(edited.task()), plan, now);
            if (!jobs.updateIfVersion(next, expectedVersion)) {
                throw new JobConcurrentModificationException(id, expectedVersion, null);
            }
            log.info("Job updated: id={} name='{}' enabled={} nextRunAt={}", id, next.name(), next.enabled(), next.nextRunAt());
            return next;
        }));
    }

    public Job enable(long id, long expectedVersion) {
        return update(id, d -> d.withEnabled(true), expectedVersion);
    }

    public Job disable(long id, long expectedVersion) {
        return update(id, d -> d.withEnabled(false), expectedVersion);
    }

    /**
     * 이름 기준 멱등 등록. 없으면 생성, 있으면 정의를 덮어쓴다 (카탈로그 재등록용).
     */
    public Job register(JobDraft draft) {
        Optional<Job> existing = findByName(draft.name());
        if (existing.isEmpty()) {
            try {
                return get(create(draft));
            } catch (DuplicateNameException raced) {
                log.debug("Job '{}' registered concurrently, falling back to update", draft.name());
                existing = findByName(draft.name());
                if (existing.isEmpty()) throw raced;
            }
        }
        Job current = existing.get();
        // 남은 횟수만 다르면 저장된 repeat 를 유지 (소진된 잡이 재등록으로 되살아나지 않게)
        JobDraft merged = sameIgnoringRepeat(current.schedule(), draft.schedule())
                ? draft.withSchedule(current.schedule())
                : draft;
        return update(current.id(), ignored -> merged, current.version());
    }

    /** 멱등 삭제. 다른 namespace 의 잡은 건드리지 않는다 */
    public void delete(long id) {
        boolean deleted = call("delete " + id, () -> tx.required(() -> {
            Optional<Job> owned = jobs.findByIdForUpdate(id).filter(j -> namespace.equals(j.namespace()));
            return owned.isPresent() && jobs.deleteById(id);
        }));
        if (deleted) log.info("Job deleted: id={}", id);
    }

    public List<Job> dueBefore(Instant at) {
        return dueBefore(at, DEFAULT_BATCH_SIZE);
    }

    /** enabled 이고 nextRunAt <= at 인 잡. nextRunAt, id 오름차순 */
    public List<Job> dueBefore(Instant at, int limit) {
        return call("dueBefore " + at, () -> tx.required(() -> jobs.findDue(namespace, at, limit)));
    }

    /**
     * 원자적 클레임 + 커서 전진. 새 트랜잭션에서 재조회(행 잠금) → due/enabled 재확인 → 다음 슬롯 계산 →
     * 버전 조건부 갱신. 다른 인스턴스가 먼저 처리했으면 empty (예외 아님).
     */
    public Optional<Claim> claimAndAdvance(long id, Instant now) {
        return call("claim " + id, () -> tx.requiresNew(() -> {
            Optional<Job> locked = jobs.findByIdForUpdate(id);
            if (locked.isEmpty()) return Optional.<Claim>empty();
            Job job = locked.get();
            if (!namespace.equals(job.namespace()) || !job.isDue(now)) return Optional.<Claim>empty();

            Job advanced = job.advancedBy(engine.advance(job, now), now);
            if (!jobs.updateIfVersion(advanced, job.version())) return Optional.<Claim>empty();
            return Optional.of(new Claim(job, advanced));
        }));
    }

    public TaskDescriptor taskOf(Job job) {
        return codec.decode(job.payload());
    }

    public JobDraft draftOf(Job job) {
        return new JobDraft(job.name(), job.description(), job.schedule(), taskOf(job), job.enabled());
    }

    static boolean sameIgnoringRepeat(Schedule stored, Schedule configured) {
        return stored.withRepeat(null).equals(configured.withRepeat(null));
    }

    private static boolean keepsCursor(Job current, JobDraft edited) {
        return current.enabled() && edited.enabled()
                && current.nextRunAt() != null
                && current.schedule().equals(edited.schedule());
    }

    /** SPI 의 검사 예외를 저장소 예외로 변환. 도메인 예외는 그대로 통과 */
    private static <T> T call(String op, Callable<T> body) {
        try {
            return body.call();
        } catch (SchedulingException e) {
            throw e;
        } catch (Exception e) {
            throw new StoreUnavailableException("job store operation failed: " + op, e);
        }
    }
}
