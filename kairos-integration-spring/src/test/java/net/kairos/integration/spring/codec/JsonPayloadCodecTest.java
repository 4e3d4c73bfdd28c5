package net.kairos.integration.spring.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.kairos.core.model.TaskArg;
import net.kairos.core.model.TaskDescriptor;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonPayloadCodecTest {

    final JsonPayloadCodec codec = new JsonPayloadCodec();

    @Test
    void writes_explicit_fields_for_queue_consumers() throws Exception {
        var task = new TaskDescriptor("reports.tasks.build",
                List.of(TaskArg.integer(7)),
                List.of(TaskArg.keyword("day", TaskArg.Type.STR, "mon")),
                "high", Duration.ofSeconds(30), TaskDescriptor.RESULT_TTL_FOREVER, true);

        JsonNode json = new ObjectMapper().readTree(codec.encode(task));

        assertThat(json.get("callable").asText()).isEqualTo("reports.tasks.build");
        assertThat(json.get("queue").asText()).isEqualTo("high");
        assertThat(json.get("args").get(0).get("type").asText()).isEqualTo("INT");
        assertThat(json.get("args").get(0).has("key")).isFalse();
        assertThat(json.get("kwargs").get(0).get("key").asText()).isEqualTo("day");
        assertThat(json.get("timeout").asLong()).isEqualTo(30);
        assertThat(json.get("resultTtl").asLong()).isEqualTo(-1);
        assertThat(json.get("atFront").asBoolean()).isTrue();

        assertThat(codec.decode(codec.encode(task))).isEqualTo(task);
    }

    @Test
    void optional_fields_are_omitted_and_defaulted() {
        var task = TaskDescriptor.of("a.b", "default");
        String json = new String(codec.encode(task), StandardCharsets.UTF_8);
        assertThat(json).doesNotContain("timeout").doesNotContain("resultTtl");

        var decoded = codec.decode("{\"callable\":\"a.b\",\"queue\":\"default\"}".getBytes(StandardCharsets.UTF_8));
        assertThat(decoded).isEqualTo(task);
    }

    @Test
    void rejects_garbage() {
        assertThatThrownBy(() -> codec.decode("nope".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode("{\"queue\":\"q\"}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("callable");
        assertThatThrownBy(() -> codec.decode("[1,2]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
