package net.kairos.core.loop;

import java.time.Duration;

/**
 * 스케줄러 루프 설정.
 *
 * @param pollInterval                틱 간격 (fixed delay)
 * @param dispatchTimeout             enqueue 1건당 상한. 초과하면 디스패치 실패로 본다
 * @param dispatchThreads             한 틱 안에서 병렬 처리할 스레드 수
 * @param batchSize                   한 번 스캔에서 가져올 최대 due 잡 수
 * @param maxConsecutiveStoreFailures 연속 스캔 실패가 이 횟수에 도달하면 HALTED
 * @param driftThreshold              claim 시각 - 예정 시각이 이 값을 넘으면 WARN. null 이면 pollInterval × 2
 */
public record SchedulerSettings(
        Duration pollInterval,
        Duration dispatchTimeout,
        int dispatchThreads,
        int batchSize,
        int maxConsecutiveStoreFailures,
        Duration driftThreshold
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_DISPATCH_TIMEOUT = Duration.ofSeconds(10);

    public SchedulerSettings {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (dispatchTimeout == null || dispatchTimeout.isZero() || dispatchTimeout.isNegative()) {
            throw new IllegalArgumentException("dispatchTimeout must be positive");
        }
        if (dispatchThreads < 1) throw new IllegalArgumentException("dispatchThreads must be >= 1");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (maxConsecutiveStoreFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveStoreFailures must be >= 1");
        }
        if (driftThreshold == null) driftThreshold = pollInterval.multipliedBy(2);
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(DEFAULT_POLL_INTERVAL, DEFAULT_DISPATCH_TIMEOUT, 4, 500, 3, null);
    }

    public SchedulerSettings withPollInterval(Duration pollInterval) {
        return new SchedulerSettings(pollInterval, dispatchTimeout, dispatchThreads, batchSize,
                maxConsecutiveStoreFailures, null);
    }

    public SchedulerSettings withDispatchTimeout(Duration dispatchTimeout) {
        return new SchedulerSettings(pollInterval, dispatchTimeout, dispatchThreads, batchSize,
                maxConsecutiveStoreFailures, driftThreshold);
    }

    public SchedulerSettings withMaxConsecutiveStoreFailures(int max) {
        return new SchedulerSettings(pollInterval, dispatchTimeout, dispatchThreads, batchSize, max, driftThreshold);
    }
}
