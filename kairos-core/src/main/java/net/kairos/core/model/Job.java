package net.kairos.core.model;

import java.time.Instant;

public record Job(
        Long id,
        String namespace,
        String name,
        String description,
        Schedule schedule,
        byte[] payload,          // 직렬화된 TaskDescriptor (불투명)
        Instant nextRunAt,       // null: 다음 슬롯 없음(소진 또는 비활성)
        boolean enabled,
        boolean exhausted,
        Instant lastEnqueuedAt,
        long version,            // 낙관적 동시성 토큰
        Instant createdAt,
        Instant updatedAt
) {
    public static Job ofNew(String namespace, JobDraft draft, byte[] payload, Plan plan, Instant now) {
        return new Job(null, namespace, draft.name(), draft.description(),
                plan.schedule(), payload,
                draft.enabled() ? plan.nextRunAt() : null,
                draft.enabled(), plan.exhausted(),
                null, 0L, now, now);
    }

    public ScheduleKind kind() { return schedule.kind(); }

    /** enabled 이고 nextRunAt <= at 이면 due */
    public boolean isDue(Instant at) {
        return enabled && nextRunAt != null && !nextRunAt.isAfter(at);
    }

    /** 클레임 성공 시 상태: 커서 전진 + lastEnqueuedAt 기록 + 버전 증가 */
    public Job advancedBy(Plan plan, Instant now) {
        return new Job(id, namespace, name, description,
                plan.schedule(), payload,
                plan.nextRunAt(), enabled, plan.exhausted(),
                now, version + 1, createdAt, now);
    }

    /** 사용자 편집 반영. nextRunAt 은 호출자가 재계산해서 넘긴다 */
    public Job editedBy(JobDraft draft, byte[] payload, Plan plan, Instant now) {
        return new Job(id, namespace, draft.name(), draft.description(),
                plan.schedule(), payload,
                draft.enabled() ? plan.nextRunAt() : null,
                draft.enabled(), plan.exhausted(),
                lastEnqueuedAt, version + 1, createdAt, now);
    }

    @Override
    public String toString() {
        return "Job{" +
                "id=" + id +
                ", namespace='" + namespace + '\'' +
                ", name='" + name + '\'' +
                ", schedule=" + schedule +
                ", nextRunAt=" + nextRunAt +
                ", enabled=" + enabled +
                ", exhausted=" + exhausted +
                ", lastEnqueuedAt=" + lastEnqueuedAt +
                ", version=" + version +
                '}';
    }
}
