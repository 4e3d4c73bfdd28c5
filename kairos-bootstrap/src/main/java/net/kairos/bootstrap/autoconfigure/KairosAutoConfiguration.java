package net.kairos.bootstrap.autoconfigure;

import net.kairos.bootstrap.catalog.CatalogRegistrar;
import net.kairos.bootstrap.props.KairosProperties;
import net.kairos.core.loop.SchedulerLoop;
import net.kairos.core.loop.SchedulerSettings;
import net.kairos.core.service.JobStore;
import net.kairos.core.service.JobValidator;
import net.kairos.core.service.ScheduleEngine;
import net.kairos.core.spi.Clock;
import net.kairos.core.spi.CronCalculator;
import net.kairos.core.spi.DispatchSink;
import net.kairos.core.spi.JobRepository;
import net.kairos.core.spi.PayloadCodec;
import net.kairos.core.spi.TxRunner;
import net.kairos.integration.spring.KairosSpringConfig;
import net.kairos.integration.spring.sched.SchedulerLifecycle;
import net.kairos.integration.spring.sink.KafkaDispatchSink;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class})
@EnableConfigurationProperties(KairosProperties.class)
@Import(KairosSpringConfig.class) // integration-spring: repos/tx/clock/cron/codec wiring
public class KairosAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KairosAutoConfiguration.class);

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ScheduleEngine scheduleEngine(CronCalculator cron) {
        return new ScheduleEngine(cron);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings schedulerSettings(KairosProperties props) {
        var s = props.getScheduler();
        return new SchedulerSettings(s.getPollInterval(), s.getDispatchTimeout(), s.getDispatchThreads(),
                s.getBatchSize(), s.getMaxConsecutiveStoreFailures(), s.getDriftThreshold());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobValidator jobValidator(ScheduleEngine engine, SchedulerSettings settings, KairosProperties props) {
        return new JobValidator(engine, settings.pollInterval(), Set.copyOf(props.getQueues()));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(JobRepository jobs,
                             TxRunner tx,
                             ScheduleEngine engine,
                             JobValidator validator,
                             PayloadCodec codec,
                             Clock clock,
                             KairosProperties props) {
        return new JobStore(jobs, tx, engine, validator, codec, clock, props.getNamespace());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLoop schedulerLoop(JobStore store, DispatchSink sink, Clock clock, SchedulerSettings settings) {
        return new SchedulerLoop(store, sink, clock, settings);
    }

    // --- 루프 수명 (kairos.scheduler.enabled=false 면 등록만 하고 돌리지 않는다) ---
    @Bean
    @ConditionalOnProperty(prefix = "kairos.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SchedulerLifecycle schedulerLifecycle(SchedulerLoop loop) {
        return new SchedulerLifecycle(loop);
    }

    // --- 카탈로그 ---

    @Bean
    public CatalogRegistrar catalogRegistrar(JobStore store, KairosProperties props) {
        return new CatalogRegistrar(store, ZoneId.of(props.getZone()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "kairos.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, KairosProperties props) {
        return args -> {
            log.info("Registering {} catalog job(s) in namespace '{}'",
                    props.getCatalog().getJobs().size(), props.getNamespace());
            registrar.register(props.getCatalog());
        };
    }

    /** kairos.sink.kafka.topic 이 있고 사용자 정의 싱크가 없을 때만 */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "kairos.sink.kafka", name = "topic")
    @ConditionalOnMissingBean(DispatchSink.class)
    static class KafkaSinkConfiguration {

        @Bean
        public ProducerFactory<String, byte[]> kairosProducerFactory(KairosProperties props) {
            var kafka = props.getSink().getKafka();
            Map<String, Object> cfg = new HashMap<>();
            cfg.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
            cfg.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
            cfg.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
            cfg.put(ProducerConfig.ACKS_CONFIG, "all");
            cfg.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, (int) kafka.getSendTimeout().toMillis());
            return new DefaultKafkaProducerFactory<>(cfg);
        }

        @Bean
        public KafkaTemplate<String, byte[]> kairosKafkaTemplate(ProducerFactory<String, byte[]> kairosProducerFactory) {
            return new KafkaTemplate<>(kairosProducerFactory);
        }

        @Bean
        public DispatchSink kafkaDispatchSink(KafkaTemplate<String, byte[]> kairosKafkaTemplate, KairosProperties props) {
            var kafka = props.getSink().getKafka();
            log.info("Kafka dispatch sink: topic={} servers={}", kafka.getTopic(), kafka.getBootstrapServers());
            return new KafkaDispatchSink(kairosKafkaTemplate, kafka.getTopic(), kafka.getSendTimeout());
        }
    }
}
