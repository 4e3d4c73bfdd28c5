package net.kairos.adapter.jdbc;

import net.kairos.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * DataSource 기반 TxRunner. 커넥션은 TxContext 로 스레드에 바인딩되고
 * 리포지토리는 그 커넥션만 사용한다.
 */
public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 이미 진행 중인 트랜잭션에 참여
            return body.call();
        }
        return inNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // 바깥 트랜잭션을 정지하고 새 커넥션으로 대체, 종료 시 복원
        Connection suspended = TxContext.get();
        try {
            return inNewTransaction(body);
        } finally {
            TxContext.restore(suspended);
        }
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = ds.getConnection()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {            // Throwable 로 롤백 보장
                rollback(c, t);
                sneakyThrow(t);                 // 검사/비검사 구분없이 재던짐
                return null; // unreachable
            } finally {
                TxContext.clear();
                restoreAutoCommit(c, prevAuto);
            }
        }
    }

    private static void rollback(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Rollback failed", e);
        }
    }

    private static void restoreAutoCommit(Connection c, boolean prevAuto) {
        try {
            c.setAutoCommit(prevAuto);
        } catch (SQLException e) {
            log.warn("Failed to restore autoCommit={} on pooled connection", prevAuto, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
