package net.kairos.core.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

public interface CronCalculator {
    /** after 보다 엄격히 늦은 첫 슬롯(zone 기준으로 평가). 더 이상 없으면 empty */
    Optional<Instant> next(Instant after, String cronExpr, ZoneId zone);

    /** 문법 오류, 도달 불가능한 표현식이면 InvalidScheduleSpecException */
    void validate(String cronExpr);

    /** 사람이 읽는 설명. 기본은 표현식 그대로 */
    default String describe(String cronExpr) { return cronExpr; }
}
