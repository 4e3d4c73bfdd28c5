package net.kairos.integration.spring.sink;

import net.kairos.core.error.SinkException;
import net.kairos.core.error.SinkRejectedException;
import net.kairos.core.error.SinkUnavailableException;
import net.kairos.core.spi.DispatchSink;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.AuthorizationException;
import org.apache.kafka.common.errors.InvalidTopicException;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.apache.kafka.common.errors.SerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * payload 를 Kafka 토픽으로 발행하는 싱크. 키는 실행 ID(UUID), 예정 시각은 헤더로.
 * 브로커 ack 까지 sendTimeout 만큼만 기다린다.
 */
public final class KafkaDispatchSink implements DispatchSink {
    private static final Logger log = LoggerFactory.getLogger(KafkaDispatchSink.class);

    public static final String HEADER_SCHEDULED_FOR = "kairos-scheduled-for";

    private final KafkaTemplate<String, byte[]> template;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaDispatchSink(KafkaTemplate<String, byte[]> template, String topic, Duration sendTimeout) {
        this.template = template;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public String enqueue(byte[] payload, Instant scheduledFor) throws SinkException {
        String executionId = UUID.randomUUID().toString();
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, executionId, payload);
        record.headers().add(HEADER_SCHEDULED_FOR, scheduledFor.toString().getBytes(StandardCharsets.UTF_8));
        try {
            var result = template.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Published {} to {}-{}@{}", executionId, topic,
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            return executionId;
        } catch (TimeoutException e) {
            throw new SinkUnavailableException("no ack from Kafka within " + sendTimeout + " for topic " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkUnavailableException("interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            throw classify(e.getCause());
        } catch (KafkaException e) {
            // send() 가 동기적으로 실패하는 경우 (직렬화 등)
            throw classify(e);
        }
    }

    /** 재시도해도 안 되는 거절과 일시 장애를 구분 */
    static SinkException classify(Throwable failure) {
        Throwable root = failure;
        while (root instanceof KafkaException && root.getCause() != null) root = root.getCause();

        if (root instanceof SerializationException
                || root instanceof RecordTooLargeException
                || root instanceof AuthorizationException
                || root instanceof InvalidTopicException) {
            return new SinkRejectedException("Kafka rejected record: " + root.getMessage(), failure);
        }
        return new SinkUnavailableException("Kafka publish failed: " + root, failure);
    }
}
