package net.kairos.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 싱크에 넘길 실행 단위 기술(payload 의 원형).
 * 직렬화된 바이트는 Job 이 소유하고, 해석은 PayloadCodec 이 담당한다.
 */
public record TaskDescriptor(
        String callable,        // 예: "reports.tasks.build_daily"
        List<TaskArg> args,
        List<TaskArg> kwargs,
        String queue,
        Duration timeout,       // null: 싱크 기본값
        Duration resultTtl,     // null: 싱크 기본값, -1초: 영구 보관
        boolean atFront
) {
    public static final Duration RESULT_TTL_FOREVER = Duration.ofSeconds(-1);

    public TaskDescriptor {
        args = args == null ? List.of() : List.copyOf(args);
        kwargs = kwargs == null ? List.of() : List.copyOf(kwargs);
    }

    public static TaskDescriptor of(String callable, String queue) {
        return new TaskDescriptor(callable, List.of(), List.of(), queue, null, null, false);
    }

    public TaskDescriptor withArgs(List<TaskArg> args, List<TaskArg> kwargs) {
        return new TaskDescriptor(callable, args, kwargs, queue, timeout, resultTtl, atFront);
    }

    public TaskDescriptor withResultTtl(Duration resultTtl) {
        return new TaskDescriptor(callable, args, kwargs, queue, timeout, resultTtl, atFront);
    }

    public TaskDescriptor withQueue(String queue) {
        return new TaskDescriptor(callable, args, kwargs, queue, timeout, resultTtl, atFront);
    }

    public boolean keepsResultForever() { return RESULT_TTL_FOREVER.equals(resultTtl); }

    /** 예: "reports.tasks.build(1, 'x', day=2024-01-01T00:00:00Z)" */
    public String describe() {
        List<String> parts = new ArrayList<>();
        for (TaskArg a : args) parts.add(a.render());
        for (TaskArg k : kwargs) parts.add(k.render());
        return callable + "(" + String.join(", ", parts) + ")";
    }
}
