package net.kairos.core.spi;

import net.kairos.core.error.SinkException;

import java.time.Instant;

/**
 * 외부 작업 큐. 코어는 payload 를 해석하지 않고 그대로 넘긴다.
 * 구현은 호출을 유한 시간 안에 끝내야 하며, 루프는 별도로 타임아웃을 건다.
 */
public interface DispatchSink {
    /** @return 싱크가 부여한 실행 ID */
    String enqueue(byte[] payload, Instant scheduledFor) throws SinkException;
}
