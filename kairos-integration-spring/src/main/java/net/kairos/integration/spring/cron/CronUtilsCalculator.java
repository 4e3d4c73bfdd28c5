package net.kairos.integration.spring.cron;

import net.kairos.core.error.InvalidScheduleSpecException;
import net.kairos.core.spi.CronCalculator;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.Optional;

/**
 * 코어 CronCalculator SPI 의 cron-utils 구현.
 * <p>
 * 표현식은 zone 의 벽시계(LocalDateTime) 기준으로 평가하고, 그 뒤 실제 시각으로 변환한다.
 * <ul>
 *   <li>DST gap 으로 존재하지 않는 벽시계 시각은 건너뛴다.</li>
 *   <li>overlap 으로 두 번 나타나는 벽시계 시각은 늦은 오프셋(두 번째)으로 한 번만 발사한다.</li>
 * </ul>
 */
public final class CronUtilsCalculator implements CronCalculator {
    // overlap/gap 처리로 후보를 넘기는 최대 횟수
    private static final int MAX_CANDIDATES = 1_000;

    @Override
    public Optional<Instant> next(Instant after, String cronExpr, ZoneId zone) {
        var parsed = CronExpressions.parse(cronExpr);
        Instant from = after.truncatedTo(ChronoUnit.SECONDS);
        LocalDateTime cursor = searchStart(from, zone);

        for (int i = 0; i < MAX_CANDIDATES; i++) {
            Optional<ZonedDateTime> wall;
            try {
                wall = parsed.executionTime().nextExecution(cursor.atZone(ZoneOffset.UTC));
            } catch (RuntimeException e) {
                throw new InvalidScheduleSpecException("cannot evaluate cron expression '" + cronExpr + "'", e);
            }
            if (wall.isEmpty()) return Optional.empty();

            LocalDateTime local = wall.get().toLocalDateTime();
            Optional<Instant> resolved = resolve(local, zone);
            if (resolved.isPresent()) {
                if (resolved.get().isAfter(after)) return resolved;
                cursor = local;
            } else {
                // gap 안의 후보는 하나씩 넘기지 않고 gap 끝 직전으로 건너뛴다
                cursor = afterGap(local, zone);
            }
        }
        throw new InvalidScheduleSpecException("no valid occurrence of cron expression '" + cronExpr
                + "' found after " + after + " in zone " + zone);
    }

    @Override
    public void validate(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) throw new InvalidScheduleSpecException("cron expression is required");
        var parsed = CronExpressions.parse(cronExpr);
        Optional<ZonedDateTime> upcoming;
        try {
            upcoming = parsed.executionTime().nextExecution(ZonedDateTime.now(ZoneOffset.UTC));
        } catch (RuntimeException e) {
            throw new InvalidScheduleSpecException("cron expression '" + cronExpr + "' cannot be evaluated", e);
        }
        if (upcoming.isEmpty()) {
            throw new InvalidScheduleSpecException("cron expression '" + cronExpr + "' never fires");
        }
    }

    @Override
    public String describe(String cronExpr) {
        return CronExpressions.describe(cronExpr);
    }

    /**
     * 벽시계 검색 시작점. after 가 overlap 의 첫 번째 통과(이른 오프셋) 중이면
     * 같은 벽시계 시각이 늦은 오프셋으로 아직 남아 있으므로 overlap 시작 직전부터 찾는다.
     */
    static LocalDateTime searchStart(Instant after, ZoneId zone) {
        ZonedDateTime z = after.atZone(zone);
        ZoneOffsetTransition t = zone.getRules().getTransition(z.toLocalDateTime());
        if (t != null && t.isOverlap() && z.getOffset().equals(t.getOffsetBefore())) {
            return t.getDateTimeAfter().minusSeconds(1);
        }
        return z.toLocalDateTime();
    }

    /** gap 에 빠진 벽시계 시각에서 다음 검색 시작점: gap 이 끝나기 1초 전 */
    static LocalDateTime afterGap(LocalDateTime inGap, ZoneId zone) {
        ZoneOffsetTransition t = zone.getRules().getTransition(inGap);
        if (t == null || !t.isGap()) return inGap;
        return t.getDateTimeAfter().minusSeconds(1);
    }

    /** gap 이면 empty, overlap 이면 늦은 오프셋 */
    static Optional<Instant> resolve(LocalDateTime local, ZoneId zone) {
        ZoneRules rules = zone.getRules();
        if (rules.getValidOffsets(local).isEmpty()) return Optional.empty();
        return Optional.of(ZonedDateTime.ofLocal(local, zone, null).withLaterOffsetAtOverlap().toInstant());
    }
}
