package net.kairos.core.model;

/** 등록/편집 입력. 사용자가 바꿀 수 있는 필드만 담는다 */
public record JobDraft(
        String name,
        String description,
        Schedule schedule,
        TaskDescriptor task,
        boolean enabled
) {
    public static JobDraft of(String name, Schedule schedule, TaskDescriptor task) {
        return new JobDraft(name, null, schedule, task, true);
    }

    public JobDraft withName(String name) {
        return new JobDraft(name, description, schedule, task, enabled);
    }

    public JobDraft withDescription(String description) {
        return new JobDraft(name, description, schedule, task, enabled);
    }

    public JobDraft withSchedule(Schedule schedule) {
        return new JobDraft(name, description, schedule, task, enabled);
    }

    public JobDraft withTask(TaskDescriptor task) {
        return new JobDraft(name, description, schedule, task, enabled);
    }

    public JobDraft withEnabled(boolean enabled) {
        return new JobDraft(name, description, schedule, task, enabled);
    }
}
