package net.kairos.adapter.jdbc;

import net.kairos.core.error.InvalidScheduleSpecException;
import net.kairos.core.model.TaskDescriptor;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.PayloadCodec;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** 어댑터 테스트용 협력 객체 */
final class Fixtures {
    private Fixtures() {}

    /** "callable@queue" 텍스트 payload */
    static final class TextCodec implements PayloadCodec {
        @Override
        public byte[] encode(TaskDescriptor task) {
            return (task.callable() + "@" + task.queue()).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public TaskDescriptor decode(byte[] payload) {
            String s = new String(payload, StandardCharsets.UTF_8);
            int at = s.indexOf('@');
            if (at < 0) throw new IllegalArgumentException("not a text payload: " + s);
            return TaskDescriptor.of(s.substring(0, at), s.substring(at + 1));
        }
    }

    /** 매 정시 */
    static final class HourlyCron implements CronCalculator {
        @Override
        public Optional<Instant> next(Instant after, String cronExpr, ZoneId zone) {
            return Optional.of(after.truncatedTo(ChronoUnit.HOURS).plus(Duration.ofHours(1)));
        }

        @Override
        public void validate(String cronExpr) {
            if (cronExpr.isBlank()) throw new InvalidScheduleSpecException("empty cron");
        }
    }

    static final class MovableClock implements Clock {
        private final AtomicReference<Instant> now;

        MovableClock(String iso) { this.now = new AtomicReference<>(Instant.parse(iso)); }

        @Override public Instant now() { return now.get(); }

        void set(String iso) { now.set(Instant.parse(iso)); }
    }
}
