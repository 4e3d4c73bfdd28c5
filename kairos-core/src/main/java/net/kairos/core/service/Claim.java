package net.kairos.core.service;

import net.kairos.core.model.Job;

import java.time.Instant;

/**
 * 클레임 성공 결과. claimed 는 전진 전 상태(디스패치할 payload 와 슬롯 시각), advanced 는 커밋된 상태.
 */
public record Claim(Job claimed, Job advanced) {

    public long jobId() { return claimed.id(); }

    public byte[] payload() { return claimed.payload(); }

    public Instant scheduledFor() { return claimed.nextRunAt(); }
}
