package net.kairos.adapter.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** TxRunner 가 바인딩한 커넥션. 없으면 경계 밖 호출 */
    public static Connection conn() {
        return TxContext.required();
    }

    // TIMESTAMP WITH TIME ZONE 은 UTC 오프셋으로 저장
    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP_WITH_TIMEZONE);
        else ps.setObject(idx, OffsetDateTime.ofInstant(i, ZoneOffset.UTC));
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime odt = rs.getObject(column, OffsetDateTime.class);
        return odt == null ? null : odt.toInstant();
    }

    public static void setNullableInt(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.INTEGER);
        else ps.setInt(idx, v);
    }

    public static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    public static void setNullableLong(PreparedStatement ps, int idx, Long v) throws SQLException {
        if (v == null) ps.setNull(idx, Types.BIGINT);
        else ps.setLong(idx, v);
    }

    public static String yn(boolean b) { return b ? "Y" : "N"; }

    public static boolean isYes(String s) { return "Y".equals(s); }
}
