package net.kairos.core.spi;

import java.time.Instant;

/** 현재 시각 공급자. 테스트에서 고정/이동 가능한 구현으로 대체한다 */
@FunctionalInterface
public interface Clock {
    Instant now();

    static Clock system() { return Instant::now; }
}
