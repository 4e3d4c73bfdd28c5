package net.kairos.core.loop;

import java.time.Instant;

/** 틱 1회 결과 DTO */
public final class TickReport {
    public Instant timestamp;
    public int scanned;
    public int claimed;
    public int alreadyClaimed;
    public int dispatched;
    public int failed;
    public int drifted;
    public int claimErrors;
    public boolean storeFailed;
    public boolean skipped;     // 정지/중단 상태라 아무것도 하지 않음

    public boolean isEmpty() { return scanned == 0; }

    @Override public String toString() {
        return "TickReport{" +
                "timestamp=" + timestamp +
                ", scanned=" + scanned +
                ", claimed=" + claimed +
                ", alreadyClaimed=" + alreadyClaimed +
                ", dispatched=" + dispatched +
                ", failed=" + failed +
                ", drifted=" + drifted +
                ", claimErrors=" + claimErrors +
                ", storeFailed=" + storeFailed +
                ", skipped=" + skipped +
                '}';
    }
}
