package net.kairos.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("kairos")
public class KairosProperties {
    private String zone = "UTC";
    private String namespace = "default";
    private List<String> queues = new ArrayList<>(List.of("default"));
    private Scheduler scheduler = new Scheduler();
    private Sink sink = new Sink();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public List<String> getQueues() {
        return queues;
    }

    public void setQueues(List<String> queues) {
        this.queues = queues;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Sink getSink() {
        return sink;
    }

    public void setSink(Sink sink) {
        this.sink = sink;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(60);
        private Duration dispatchTimeout = Duration.ofSeconds(10);
        private int dispatchThreads = 4;
        private int batchSize = 500;
        private int maxConsecutiveStoreFailures = 3;
        private Duration driftThreshold;   // null: pollInterval × 2

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getDispatchTimeout() {
            return dispatchTimeout;
        }

        public void setDispatchTimeout(Duration dispatchTimeout) {
            this.dispatchTimeout = dispatchTimeout;
        }

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxConsecutiveStoreFailures() {
            return maxConsecutiveStoreFailures;
        }

        public void setMaxConsecutiveStoreFailures(int maxConsecutiveStoreFailures) {
            this.maxConsecutiveStoreFailures = maxConsecutiveStoreFailures;
        }

        public Duration getDriftThreshold() {
            return driftThreshold;
        }

        public void setDriftThreshold(Duration driftThreshold) {
            this.driftThreshold = driftThreshold;
        }
    }

    public static class Sink {
        private Kafka kafka = new Kafka();

        public Kafka getKafka() {
            return kafka;
        }

        public void setKafka(Kafka kafka) {
            this.kafka = kafka;
        }
    }

    public static class Kafka {
        private String topic;                  // 없으면 Kafka 싱크 비활성
        private String bootstrapServers = "localhost:9092";
        private Duration sendTimeout = Duration.ofSeconds(5);

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    /** cron, interval, run-at 중 정확히 하나 */
    public static class JobDef {
        private String name;
        private String description;
        private String cron;
        private String zone;                   // null: kairos.zone
        private Long interval;
        private String intervalUnit = "seconds";
        private String startAt;
        private Integer repeat;
        private String runAt;                  // ISO-8601 instant
        private String callable;
        private String queue = "default";
        private List<ArgDef> args = new ArrayList<>();
        private List<ArgDef> kwargs = new ArrayList<>();
        private Duration timeout;
        private Duration resultTtl;
        private boolean atFront;
        private boolean enabled = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public Long getInterval() {
            return interval;
        }

        public void setInterval(Long interval) {
            this.interval = interval;
        }

        public String getIntervalUnit() {
            return intervalUnit;
        }

        public void setIntervalUnit(String intervalUnit) {
            this.intervalUnit = intervalUnit;
        }

        public String getStartAt() {
            return startAt;
        }

        public void setStartAt(String startAt) {
            this.startAt = startAt;
        }

        public Integer getRepeat() {
            return repeat;
        }

        public void setRepeat(Integer repeat) {
            this.repeat = repeat;
        }

        public String getRunAt() {
            return runAt;
        }

        public void setRunAt(String runAt) {
            this.runAt = runAt;
        }

        public String getCallable() {
            return callable;
        }

        public void setCallable(String callable) {
            this.callable = callable;
        }

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }

        public List<ArgDef> getArgs() {
            return args;
        }

        public void setArgs(List<ArgDef> args) {
            this.args = args;
        }

        public List<ArgDef> getKwargs() {
            return kwargs;
        }

        public void setKwargs(List<ArgDef> kwargs) {
            this.kwargs = kwargs;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getResultTtl() {
            return resultTtl;
        }

        public void setResultTtl(Duration resultTtl) {
            this.resultTtl = resultTtl;
        }

        public boolean isAtFront() {
            return atFront;
        }

        public void setAtFront(boolean atFront) {
            this.atFront = atFront;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", cron='" + cron + '\'' +
                    ", interval=" + interval + ' ' + intervalUnit +
                    ", runAt='" + runAt + '\'' +
                    ", callable='" + callable + '\'' +
                    ", queue='" + queue + '\'' +
                    ", enabled=" + enabled +
                    '}';
        }
    }

    /** 인자 하나. kwargs 에서만 key 를 쓴다 */
    public static class ArgDef {
        private String key;
        private String type = "str";
        private String value;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }
    }
}
