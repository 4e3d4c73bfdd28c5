package net.kairos.adapter.jdbc;

import net.kairos.adapter.jdbc.repo.JdbcJobRepository;
import net.kairos.core.loop.SchedulerLoop;
import net.kairos.core.loop.SchedulerSettings;
import net.kairos.core.loop.TickReport;
import net.kairos.core.model.IntervalUnit;
import net.kairos.core.model.Job;
import net.kairos.core.model.JobDraft;
import net.kairos.core.model.Schedule;
import net.kairos.core.model.TaskDescriptor;
import net.kairos.core.service.Claim;
import net.kairos.core.service.JobStore;
import net.kairos.core.service.JobValidator;
import net.kairos.core.service.ScheduleEngine;
import net.kairos.core.spi.DispatchSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 병렬 경합 인수 테스트
 * - 같은 저장소를 여러 스레드/여러 루프가 동시에 클레임
 * - FOR UPDATE + 버전 조건부 UPDATE 로 슬롯당 정확히 1회만 성공해야 한다
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class ConcurrentClaimAcceptanceTest extends TestSupport {

    Fixtures.MovableClock clock;
    JobStore store;

    @BeforeEach
    void initStore() {
        clock = new Fixtures.MovableClock("2024-01-01T10:00:00Z");
        var engine = new ScheduleEngine(new Fixtures.HourlyCron());
        var validator = new JobValidator(engine, Duration.ofSeconds(60), Set.of("default"));
        store = new JobStore(new JdbcJobRepository(), tx, engine, validator, new Fixtures.TextCodec(), clock, "default");
    }

    long hourly(String name) {
        return store.create(JobDraft.of(name, Schedule.Interval.of(1, IntervalUnit.HOURS),
                TaskDescriptor.of("jobs." + name.replace('-', '_') + ".run", "default")));
    }

    // ========== t1: 같은 슬롯을 N 스레드가 클레임 — 한 스레드만 성공 ==========
    @Test
    void t1_concurrent_claimAndAdvance_onlyOneWins() throws Exception {
        long id = hourly("contended");
        Instant now = Instant.parse("2024-01-01T11:00:01Z");

        int threads = 8;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<Claim>>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                return store.claimAndAdvance(id, now);
            }));
        }
        start.countDown();

        int wins = 0;
        for (Future<Optional<Claim>> f : futures) wins += f.get().isPresent() ? 1 : 0;
        es.shutdown();
        assertEquals(1, wins, "exactly one thread should win the claim");

        Job after = store.get(id);
        assertEquals(1L, after.version());
        assertEquals(Instant.parse("2024-01-01T12:00:00Z"), after.nextRunAt());
        assertEquals(now, after.lastEnqueuedAt());
    }

    // ========== t2: 두 스케줄러 인스턴스가 동시에 틱 — 잡마다 정확히 1회 디스패치 ==========
    @Test
    void t2_two_loops_racing_dispatch_each_job_once() throws Exception {
        int jobCount = 20;
        for (int i = 0; i < jobCount; i++) hourly("job-" + i);
        clock.set("2024-01-01T11:00:30Z");

        Queue<String> delivered = new ConcurrentLinkedQueue<>();
        DispatchSink sink = (payload, scheduledFor) -> {
            delivered.add(new String(payload, StandardCharsets.UTF_8));
            return "exec-" + delivered.size();
        };
        SchedulerLoop a = new SchedulerLoop(store, sink, clock, SchedulerSettings.defaults());
        SchedulerLoop b = new SchedulerLoop(store, sink, clock, SchedulerSettings.defaults());

        ExecutorService es = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Future<TickReport> fa = es.submit(() -> { start.await(); return a.tick(); });
        Future<TickReport> fb = es.submit(() -> { start.await(); return b.tick(); });
        start.countDown();
        TickReport ra = fa.get();
        TickReport rb = fb.get();
        es.shutdown();
        a.stop();
        b.stop();

        assertEquals(jobCount, ra.dispatched + rb.dispatched);
        assertEquals(jobCount, delivered.size());
        assertEquals(jobCount, new HashSet<>(delivered).size(), "no payload delivered twice");
        assertEquals(0, ra.claimErrors + rb.claimErrors);
        // 스캔은 겹칠 수 있지만, 진 쪽은 AlreadyClaimed 로만 집계된다
        assertEquals(ra.scanned + rb.scanned, ra.claimed + rb.claimed + ra.alreadyClaimed + rb.alreadyClaimed);
    }
}
