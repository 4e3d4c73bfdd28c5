package net.kairos.integration.spring.tx;

import net.kairos.adapter.jdbc.TxContext;
import net.kairos.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 매니저 위에서 동작하는 TxRunner.
 * 스프링이 바인딩한 커넥션을 TxContext 에 꽂아 JDBC 리포지토리가 그대로 쓰게 한다.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(required, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNew, body);
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body) throws Exception {
        try {
            return tpl.execute(status -> {
                // REQUIRES_NEW 면 스프링이 바깥 커넥션을 정지시켰으므로 TxContext 도 교체 후 복원
                Connection outer = TxContext.get();
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedFailure(e);  // 롤백 유도 후 아래에서 원래 예외로 복원
                } finally {
                    TxContext.restore(outer);
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedFailure f) {
            throw f.checked;
        }
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    private static final class CheckedFailure extends RuntimeException {
        final Exception checked;

        CheckedFailure(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
