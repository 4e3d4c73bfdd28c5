package net.kairos.adapter.jdbc.mapper;

import net.kairos.core.model.IntervalUnit;
import net.kairos.core.model.Job;
import net.kairos.core.model.Schedule;
import net.kairos.core.model.ScheduleKind;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.ZoneId;

import static net.kairos.adapter.jdbc.JdbcUtil.getInstant;
import static net.kairos.adapter.jdbc.JdbcUtil.getNullableInt;
import static net.kairos.adapter.jdbc.JdbcUtil.isYes;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs) throws SQLException {
        return new Job(
                rs.getLong("ID"),
                rs.getString("NAMESPACE"),
                rs.getString("NAME"),
                rs.getString("DESCRIPTION"),
                toSchedule(rs),
                rs.getBytes("PAYLOAD"),
                getInstant(rs, "NEXT_RUN_AT"),
                isYes(rs.getString("ENABLED")),
                isYes(rs.getString("EXHAUSTED")),
                getInstant(rs, "LAST_ENQUEUED_AT"),
                rs.getLong("ROW_VERSION"),
                getInstant(rs, "CREATED_AT"),
                getInstant(rs, "UPDATED_AT")
        );
    }

    // --- Schedule (SCHEDULE_KIND 별 컬럼 묶음) ---
    public static Schedule toSchedule(ResultSet rs) throws SQLException {
        ScheduleKind kind = ScheduleKind.from(rs.getString("SCHEDULE_KIND"));
        Integer repeat = getNullableInt(rs, "REPEAT_LEFT");
        switch (kind) {
            case ONCE:
                return new Schedule.Once(getInstant(rs, "RUN_AT"));
            case INTERVAL:
                return new Schedule.Interval(
                        rs.getLong("INTERVAL_EVERY"),
                        IntervalUnit.from(rs.getString("INTERVAL_UNIT")),
                        repeat,
                        getInstant(rs, "START_AT"));
            case CRON:
                return new Schedule.Cron(rs.getString("CRON_EXPR"), ZoneId.of(rs.getString("CRON_ZONE")), repeat);
            default:
                throw new SQLException("unknown SCHEDULE_KIND " + kind);
        }
    }
}
