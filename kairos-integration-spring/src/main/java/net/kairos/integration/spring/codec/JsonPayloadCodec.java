package net.kairos.integration.spring.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.kairos.core.model.TaskArg;
import net.kairos.core.model.TaskDescriptor;
import net.kairos.core.spi.PayloadCodec;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * TaskDescriptor 를 JSON 으로. 큐 소비자(다른 언어일 수 있음)가 읽는 포맷이라 필드를 명시적으로 쓴다.
 * <pre>
 * {"callable":"reports.tasks.build","queue":"default",
 *  "args":[{"type":"INT","value":"1"}],"kwargs":[{"key":"day","type":"STR","value":"mon"}],
 *  "timeout":30,"resultTtl":-1,"atFront":false}
 * </pre>
 * timeout, resultTtl 은 초 단위이며 없으면 생략.
 */
public final class JsonPayloadCodec implements PayloadCodec {
    private final ObjectMapper mapper;

    public JsonPayloadCodec(ObjectMapper mapper) { this.mapper = mapper; }

    public JsonPayloadCodec() { this(new ObjectMapper()); }

    @Override
    public byte[] encode(TaskDescriptor task) {
        ObjectNode root = mapper.createObjectNode();
        root.put("callable", task.callable());
        root.put("queue", task.queue());
        root.set("args", writeArgs(task.args(), false));
        root.set("kwargs", writeArgs(task.kwargs(), true));
        if (task.timeout() != null) root.put("timeout", task.timeout().getSeconds());
        if (task.resultTtl() != null) root.put("resultTtl", task.resultTtl().getSeconds());
        root.put("atFront", task.atFront());
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize task " + task.callable(), e);
        }
    }

    @Override
    public TaskDescriptor decode(byte[] payload) {
        JsonNode root;
        try {
            root = mapper.readTree(payload);
        } catch (IOException e) {
            throw new IllegalArgumentException("payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) throw new IllegalArgumentException("payload must be a JSON object");
        return new TaskDescriptor(
                text(root, "callable", true),
                readArgs(root.get("args"), false),
                readArgs(root.get("kwargs"), true),
                text(root, "queue", true),
                seconds(root, "timeout"),
                seconds(root, "resultTtl"),
                root.path("atFront").asBoolean(false));
    }

    private ArrayNode writeArgs(List<TaskArg> args, boolean keyword) {
        ArrayNode arr = mapper.createArrayNode();
        for (TaskArg a : args) {
            ObjectNode n = arr.addObject();
            if (keyword) n.put("key", a.key());
            n.put("type", a.type().name());
            n.put("value", a.value());
        }
        return arr;
    }

    private static List<TaskArg> readArgs(JsonNode arr, boolean keyword) {
        List<TaskArg> out = new ArrayList<>();
        if (arr == null || arr.isNull()) return out;
        if (!arr.isArray()) throw new IllegalArgumentException((keyword ? "kwargs" : "args") + " must be an array");
        for (JsonNode n : arr) {
            TaskArg.Type type = TaskArg.Type.from(text(n, "type", true));
            String value = text(n, "value", true);
            out.add(keyword ? TaskArg.keyword(text(n, "key", true), type, value) : TaskArg.positional(type, value));
        }
        return out;
    }

    private static String text(JsonNode n, String field, boolean required) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) {
            if (required) throw new IllegalArgumentException("missing field '" + field + "'");
            return null;
        }
        return v.asText();
    }

    private static Duration seconds(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.canConvertToLong()) throw new IllegalArgumentException("'" + field + "' must be a number of seconds");
        return Duration.ofSeconds(v.asLong());
    }
}
