package net.kairos.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;

/**
 * H2(in-memory) + Hikari + Flyway. 테스트 클래스마다 별도 DB.
 * KAIROS_JDBC_URL 이 있으면 그 DB 를 쓴다.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected DataSource ds;
    protected JdbcTxRunner tx;

    @BeforeAll
    void setupDb() {
        String url = System.getenv("KAIROS_JDBC_URL");
        String user = System.getenv("KAIROS_JDBC_USERNAME");
        String pass = System.getenv("KAIROS_JDBC_PASSWORD");

        if (url == null || url.isBlank()) {
            url = "jdbc:h2:mem:" + getClass().getSimpleName() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
            user = "sa";
            pass = "";
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(url);
        cfg.setUsername(user);
        cfg.setPassword(pass);
        cfg.setMaximumPoolSize(10);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration")
                .load()
                .migrate();

        tx = new JdbcTxRunner(ds);
    }

    @BeforeEach
    void truncateAll() throws Exception {
        tx.required(() -> {
            try (var st = TxContext.get().createStatement()) {
                st.execute("DELETE FROM TB_JOB");
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() {
        if (ds instanceof HikariDataSource h) h.close();
    }
}
