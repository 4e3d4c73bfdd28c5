package net.kairos.integration.spring.sched;

import net.kairos.core.loop.SchedulerLoop;
import org.springframework.context.SmartLifecycle;

/**
 * 스프링 컨텍스트 수명에 SchedulerLoop 를 묶는다.
 * 컨텍스트 종료 시 진행 중인 디스패치를 기다린 뒤 멈춘다.
 */
public class SchedulerLifecycle implements SmartLifecycle {
    private final SchedulerLoop loop;
    private volatile boolean running;

    public SchedulerLifecycle(SchedulerLoop loop) { this.loop = loop; }

    @Override
    public void start() {
        loop.start();
        running = true;
    }

    @Override
    public void stop() {
        loop.stop();
        running = false;
    }

    @Override
    public boolean isRunning() { return running; }

    // 다른 빈(DataSource 등)보다 늦게 시작하고 먼저 멈춘다
    @Override
    public int getPhase() { return Integer.MAX_VALUE - 100; }

    public SchedulerLoop loop() { return loop; }
}
