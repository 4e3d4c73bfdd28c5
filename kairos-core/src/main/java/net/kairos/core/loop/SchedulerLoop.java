package net.kairos.core.loop;

import net.kairos.core.error.SinkException;
import net.kairos.core.error.SinkUnavailableException;
import net.kairos.core.model.Job;
import net.kairos.core.service.Claim;
import net.kairos.core.service.JobStore;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.DispatchSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * due 잡을 주기적으로 스캔해 claim → advance → enqueue 순서로 디스패치한다.
 * <p>
 * 전달 보장은 at-most-once: 커서는 enqueue 전에 커밋되므로 enqueue 가 실패해도 같은 슬롯은 다시 나가지 않는다.
 * 여러 인스턴스가 같은 저장소를 공유해도 {@link JobStore#claimAndAdvance} 의 원자성만으로 중복 발사를 막는다.
 * <p>
 * 스레드 풀은 생성자에서 만들어지므로 {@link #start()} 여부와 관계없이 {@link #close()} 로 정리해야 한다.
 */
public final class SchedulerLoop implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    public enum State { IDLE, SCANNING, DISPATCHING, STOPPED, HALTED }

    private enum Result { DISPATCHED, FAILED, ALREADY_CLAIMED, CLAIM_ERROR, SKIPPED }

    private record Outcome(Result result, boolean drifted) {
        static Outcome of(Result result) { return new Outcome(result, false); }
    }

    private final JobStore store;
    private final DispatchSink sink;
    private final Clock clock;
    private final SchedulerSettings settings;

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final AtomicInteger consecutiveStoreFailures = new AtomicInteger();
    private final ExecutorService dispatchPool;
    private final ExecutorService sinkPool;

    private ScheduledExecutorService ticker;
    private ScheduledFuture<?> tickHandle;
    private volatile boolean stopping;

    public SchedulerLoop(JobStore store, DispatchSink sink, Clock clock, SchedulerSettings settings) {
        this.store = store;
        this.sink = sink;
        this.clock = clock;
        this.settings = settings;
        this.dispatchPool = Executors.newFixedThreadPool(settings.dispatchThreads(), named("kairos-dispatch"));
        this.sinkPool = boundedSinkPool(settings.dispatchThreads());
    }

    /**
     * 인터럽트를 무시하고 매달린 싱크 호출이 스레드를 무한히 늘리지 않도록 상한을 둔다.
     * 상한에 닿으면 enqueue 는 즉시 SinkUnavailableException.
     */
    static ThreadPoolExecutor boundedSinkPool(int dispatchThreads) {
        int max = dispatchThreads * 2;
        return new ThreadPoolExecutor(0, max, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                named("kairos-sink"), new ThreadPoolExecutor.AbortPolicy());
    }

    public State state() { return state.get(); }

    /** HALTED 나 STOPPED 가 아니면 정상 */
    public boolean isHealthy() {
        State s = state.get();
        return s != State.HALTED && s != State.STOPPED;
    }

    public SchedulerSettings settings() { return settings; }

    /** 고정 지연 틱 시작. 이미 시작했으면 무시 */
    public synchronized void start() {
        if (ticker != null) return;
        if (state.get() == State.STOPPED) throw new IllegalStateException("scheduler loop already stopped");
        ticker = Executors.newSingleThreadScheduledExecutor(named("kairos-scheduler"));
        long delayMs = settings.pollInterval().toMillis();
        tickHandle = ticker.scheduleWithFixedDelay(this::safeTick, 0L, delayMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler loop started: namespace={} pollInterval={} dispatchThreads={}",
                store.namespace(), settings.pollInterval(), settings.dispatchThreads());
    }

    /**
     * 협조적 종료. 새 잡 제출을 멈추고 진행 중인 claim+enqueue 가 끝날 때까지 기다린다.
     * 이미 커밋된 claim 은 되돌리지 않는다.
     */
    public synchronized void stop() {
        if (state.get() == State.STOPPED) return;
        stopping = true;
        Duration grace = settings.dispatchTimeout().plus(settings.dispatchTimeout());
        if (ticker != null) {
            tickHandle.cancel(false);
            ticker.shutdown();
            awaitQuietly(ticker, grace, "ticker");
        }
        dispatchPool.shutdown();
        awaitQuietly(dispatchPool, grace, "dispatch pool");
        sinkPool.shutdown();
        awaitQuietly(sinkPool, settings.dispatchTimeout(), "sink pool");
        state.set(State.STOPPED);
        log.info("Scheduler loop stopped: namespace={}", store.namespace());
    }

    /** {@link #stop()} 과 같다. 컨테이너가 destroy 메서드로 호출한다 */
    @Override
    public void close() {
        stop();
    }

    /**
     * 틱 1회. 스캔 실패는 예외로 새지 않고 리포트와 연속 실패 카운터에 반영된다.
     */
    public TickReport tick() {
        TickReport r = new TickReport();
        Instant now = clock.now();
        r.timestamp = now;
        if (stopping || !state.compareAndSet(State.IDLE, State.SCANNING)) {
            r.skipped = true;
            return r;
        }

        List<Job> due;
        try {
            due = store.dueBefore(now, settings.batchSize());
        } catch (RuntimeException e) {
            r.storeFailed = true;
            onStoreFailure(e);
            return r;
        }
        consecutiveStoreFailures.set(0);
        r.scanned = due.size();
        if (due.isEmpty()) {
            state.compareAndSet(State.SCANNING, State.IDLE);
            return r;
        }

        state.compareAndSet(State.SCANNING, State.DISPATCHING);
        List<Future<Outcome>> inFlight = new ArrayList<>(due.size());
        for (Job job : due) {
            if (stopping) break;
            inFlight.add(dispatchPool.submit(() -> process(job, now)));
        }
        for (Future<Outcome> f : inFlight) {
            tally(r, await(f));
        }
        state.compareAndSet(State.DISPATCHING, State.IDLE);

        log.debug("Tick finished: {}", r);
        return r;
    }

    /**
     * 관리자 "지금 실행". 스케줄 커서와 버전은 건드리지 않는다.
     *
     * @return 싱크가 발급한 실행 id
     */
    public String runNow(long jobId) throws SinkException {
        Job job = store.get(jobId);
        Instant now = clock.now();
        String executionId = enqueue(job.payload(), now);
        log.info("Job run on demand: id={} name='{}' executionId={}", job.id(), job.name(), executionId);
        return executionId;
    }

    private void safeTick() {
        try {
            TickReport r = tick();
            if (!r.isEmpty()) log.info("Tick: {}", r);
        } catch (RuntimeException e) {
            // 예외가 새면 ScheduledExecutorService 가 이후 실행을 취소한다
            log.error("Unexpected failure in scheduler tick", e);
        }
    }

    private Outcome process(Job job, Instant now) {
        if (stopping) return Outcome.of(Result.SKIPPED);

        Optional<Claim> claimed;
        try {
            claimed = store.claimAndAdvance(job.id(), now);
        } catch (RuntimeException e) {
            log.error("Claim failed for job id={} name='{}'", job.id(), job.name(), e);
            return Outcome.of(Result.CLAIM_ERROR);
        }
        if (claimed.isEmpty()) {
            log.debug("Job id={} already claimed by another scheduler", job.id());
            return Outcome.of(Result.ALREADY_CLAIMED);
        }

        Claim claim = claimed.get();
        boolean drifted = checkDrift(claim, now);
        try {
            String executionId = enqueue(claim.payload(), claim.scheduledFor());
            log.info("Job dispatched: id={} name='{}' scheduledFor={} executionId={} nextRunAt={}",
                    claim.jobId(), job.name(), claim.scheduledFor(), executionId, claim.advanced().nextRunAt());
            return new Outcome(Result.DISPATCHED, drifted);
        } catch (SinkException e) {
            log.warn("Dispatch failed for job id={} name='{}' scheduledFor={}; occurrence dropped",
                    claim.jobId(), job.name(), claim.scheduledFor(), e);
            return new Outcome(Result.FAILED, drifted);
        }
    }

    private boolean checkDrift(Claim claim, Instant now) {
        Duration lag = Duration.between(claim.scheduledFor(), now);
        if (lag.compareTo(settings.driftThreshold()) <= 0) return false;
        log.warn("Job id={} dispatched {} late (scheduledFor={}, threshold={})",
                claim.jobId(), lag, claim.scheduledFor(), settings.driftThreshold());
        return true;
    }

    /** 싱크 호출을 dispatchTimeout 으로 제한. 타임아웃은 SinkUnavailableException */
    private String enqueue(byte[] payload, Instant scheduledFor) throws SinkException {
        Future<String> call;
        try {
            call = sinkPool.submit(() -> sink.enqueue(payload, scheduledFor));
        } catch (RejectedExecutionException e) {
            throw new SinkUnavailableException("no free sink thread (stuck enqueue calls or loop stopped)", e);
        }
        try {
            return call.get(settings.dispatchTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new SinkUnavailableException("enqueue timed out after " + settings.dispatchTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new SinkUnavailableException("interrupted while waiting for enqueue", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SinkException se) throw se;
            throw new SinkUnavailableException("enqueue failed: " + cause, cause);
        }
    }

    private void onStoreFailure(RuntimeException e) {
        int failures = consecutiveStoreFailures.incrementAndGet();
        int max = settings.maxConsecutiveStoreFailures();
        log.error("Due-job scan failed ({}/{} consecutive)", failures, max, e);
        if (failures >= max) {
            state.set(State.HALTED);
            if (tickHandle != null) tickHandle.cancel(false);
            log.error("Scheduler loop halted after {} consecutive store failures: namespace={}",
                    failures, store.namespace());
        } else {
            state.compareAndSet(State.SCANNING, State.IDLE);
        }
    }

    private static Outcome await(Future<Outcome> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.of(Result.SKIPPED);
        } catch (ExecutionException e) {
            log.error("Dispatch task failed unexpectedly", e.getCause());
            return Outcome.of(Result.CLAIM_ERROR);
        }
    }

    private static void tally(TickReport r, Outcome o) {
        if (o.drifted()) r.drifted++;
        switch (o.result()) {
            case DISPATCHED -> { r.claimed++; r.dispatched++; }
            case FAILED -> { r.claimed++; r.failed++; }
            case ALREADY_CLAIMED -> r.alreadyClaimed++;
            case CLAIM_ERROR -> r.claimErrors++;
            case SKIPPED -> { }
        }
    }

    private static void awaitQuietly(ExecutorService pool, Duration timeout, String what) {
        try {
            if (!pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler {} did not terminate within {}", what, timeout);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
