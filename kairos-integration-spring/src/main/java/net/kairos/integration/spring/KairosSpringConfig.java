package net.kairos.integration.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.kairos.adapter.jdbc.repo.JdbcJobRepository;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.PayloadCodec;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.codec.JsonPayloadCodec;
import net.kairos.integration.spring.cron.CronUtilsCalculator;
import net.kairos.integration.spring.tx.SpringTxRunner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** SPI 기본 구현 등록 (adapter-jdbc, cron-utils, Jackson) */
@Configuration(proxyBeanMethods = false)
public class KairosSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean
    public JobRepository jobRepository() { return new JdbcJobRepository(); }

    @Bean
    public Clock systemClock() { return Clock.system(); }

    @Bean
    public CronCalculator cronCalculator() { return new CronUtilsCalculator(); }

    @Bean
    public PayloadCodec payloadCodec(ObjectProvider<ObjectMapper> mapper) {
        return new JsonPayloadCodec(mapper.getIfAvailable(ObjectMapper::new));
    }
}
