package net.kairos.adapter.jdbc.repo;

import net.kairos.adapter.jdbc.mapper.RowMappers;
import net.kairos.core.error.DuplicateNameException;
import net.kairos.core.model.Job;
import net.kairos.core.model.Schedule;
import net.kairos.core.spi.JobRepository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.kairos.adapter.jdbc.JdbcUtil.conn;
import static net.kairos.adapter.jdbc.JdbcUtil.setInstant;
import static net.kairos.adapter.jdbc.JdbcUtil.setNullableInt;
import static net.kairos.adapter.jdbc.JdbcUtil.setNullableLong;
import static net.kairos.adapter.jdbc.JdbcUtil.yn;

/**
 * TB_JOB 리포지토리. 모든 쿼리는 TxContext 커넥션에서 실행된다.
 * 표준 SQL 만 사용 (FOR UPDATE, FETCH FIRST).
 */
public final class JdbcJobRepository implements JobRepository {
    private static final String UNIQUE_VIOLATION = "23505";

    @Override
    public long insert(Job job) throws Exception {
        try (var ps = conn().prepareStatement("""
                INSERT INTO TB_JOB(NAMESPACE, NAME, DESCRIPTION,
                                   SCHEDULE_KIND, RUN_AT, INTERVAL_EVERY, INTERVAL_UNIT, START_AT,
                                   CRON_EXPR, CRON_ZONE, REPEAT_LEFT,
                                   PAYLOAD, NEXT_RUN_AT, ENABLED, EXHAUSTED, LAST_ENQUEUED_AT,
                                   ROW_VERSION, CREATED_AT, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """, new String[]{"ID"})) {
            int i = 1;
            ps.setString(i++, job.namespace());
            ps.setString(i++, job.name());
            ps.setString(i++, job.description());
            i = bindSchedule(ps, i, job.schedule());
            ps.setBytes(i++, job.payload());
            setInstant(ps, i++, job.nextRunAt());
            ps.setString(i++, yn(job.enabled()));
            ps.setString(i++, yn(job.exhausted()));
            setInstant(ps, i++, job.lastEnqueuedAt());
            ps.setLong(i++, job.version());
            setInstant(ps, i++, job.createdAt());
            setInstant(ps, i, job.updatedAt());
            try {
                ps.executeUpdate();
            } catch (SQLException e) {
                throw translate(e, job);
            }
            try (var k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new SQLException("no generated key for TB_JOB insert");
                return k.getLong(1);
            }
        }
    }

    @Override
    public Optional<Job> findById(long id) throws Exception {
        return selectOne("SELECT * FROM TB_JOB WHERE ID = ?", id);
    }

    @Override
    public Optional<Job> findByIdForUpdate(long id) throws Exception {
        // 경합하는 클레임은 커밋까지 여기서 대기
        return selectOne("SELECT * FROM TB_JOB WHERE ID = ? FOR UPDATE", id);
    }

    @Override
    public Optional<Job> findByName(String namespace, String name) throws Exception {
        try (var ps = conn().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE NAMESPACE = ?
                   AND NAME = ?
            """)) {
            ps.setString(1, namespace);
            ps.setString(2, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    @Override
    public List<Job> findAll(String namespace) throws Exception {
        try (var ps = conn().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE NAMESPACE = ?
                 ORDER BY ID
            """)) {
            ps.setString(1, namespace);
            return list(ps);
        }
    }

    @Override
    public List<Job> findDue(String namespace, Instant at, int limit) throws Exception {
        try (var ps = conn().prepareStatement("""
                SELECT *
                  FROM TB_JOB
                 WHERE NAMESPACE = ?
                   AND ENABLED = 'Y'
                   AND NEXT_RUN_AT IS NOT NULL
                   AND NEXT_RUN_AT <= ?
                 ORDER BY NEXT_RUN_AT ASC, ID ASC
                 FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setString(1, namespace);
            setInstant(ps, 2, at);
            ps.setInt(3, limit);
            return list(ps);
        }
    }

    @Override
    public boolean updateIfVersion(Job job, long expectedVersion) throws Exception {
        try (var ps = conn().prepareStatement("""
                UPDATE TB_JOB
                   SET NAME             = ?,
                       DESCRIPTION      = ?,
                       SCHEDULE_KIND    = ?,
                       RUN_AT           = ?,
                       INTERVAL_EVERY   = ?,
                       INTERVAL_UNIT    = ?,
                       START_AT         = ?,
                       CRON_EXPR        = ?,
                       CRON_ZONE        = ?,
                       REPEAT_LEFT      = ?,
                       PAYLOAD          = ?,
                       NEXT_RUN_AT      = ?,
                       ENABLED          = ?,
                       EXHAUSTED        = ?,
                       LAST_ENQUEUED_AT = ?,
                       ROW_VERSION      = ?,
                       UPDATED_AT       = ?
                 WHERE ID = ?
                   AND ROW_VERSION = ?
            """)) {
            int i = 1;
            ps.setString(i++, job.name());
            ps.setString(i++, job.description());
            i = bindSchedule(ps, i, job.schedule());
            ps.setBytes(i++, job.payload());
            setInstant(ps, i++, job.nextRunAt());
            ps.setString(i++, yn(job.enabled()));
            ps.setString(i++, yn(job.exhausted()));
            setInstant(ps, i++, job.lastEnqueuedAt());
            ps.setLong(i++, expectedVersion + 1);
            setInstant(ps, i++, job.updatedAt());
            ps.setLong(i++, job.id());
            ps.setLong(i, expectedVersion);
            try {
                return ps.executeUpdate() == 1;
            } catch (SQLException e) {
                throw translate(e, job);
            }
        }
    }

    @Override
    public boolean deleteById(long id) throws Exception {
        try (var ps = conn().prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    /** SCHEDULE_KIND ~ REPEAT_LEFT 8개 컬럼. 다음 인덱스 반환 */
    private static int bindSchedule(PreparedStatement ps, int i, Schedule s) throws SQLException {
        Instant runAt = null;
        Long every = null;
        String unit = null;
        Instant startAt = null;
        String cronExpr = null;
        String cronZone = null;
        if (s instanceof Schedule.Once once) {
            runAt = once.runAt();
        } else if (s instanceof Schedule.Interval interval) {
            every = interval.every();
            unit = interval.unit().name();
            startAt = interval.startAt();
        } else if (s instanceof Schedule.Cron cron) {
            cronExpr = cron.expression();
            cronZone = cron.zone().getId();
        }
        ps.setString(i++, s.kind().code());
        setInstant(ps, i++, runAt);
        setNullableLong(ps, i++, every);
        ps.setString(i++, unit);
        setInstant(ps, i++, startAt);
        ps.setString(i++, cronExpr);
        ps.setString(i++, cronZone);
        setNullableInt(ps, i++, s.repeat());
        return i;
    }

    private static Optional<Job> selectOne(String sql, long id) throws SQLException {
        try (var ps = conn().prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toJob(rs));
            }
        }
    }

    private static List<Job> list(PreparedStatement ps) throws SQLException {
        List<Job> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJob(rs));
        }
        return out;
    }

    /** (NAMESPACE, NAME) 유니크 위반은 도메인 예외로 */
    private static Exception translate(SQLException e, Job job) {
        boolean unique = UNIQUE_VIOLATION.equals(e.getSQLState())
                || (e instanceof SQLIntegrityConstraintViolationException
                    && String.valueOf(e.getMessage()).toUpperCase().contains("UK_TB_JOB_NS_NAME"));
        return unique ? new DuplicateNameException(job.namespace(), job.name(), e) : e;
    }
}
