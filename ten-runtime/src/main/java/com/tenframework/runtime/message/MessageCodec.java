package com.tenframework.runtime.message;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Command / CommandResult 的逻辑线上格式（与具体传输无关），使用 JSON 表达：
 * <pre>
 * cmd:        {id, name, properties}
 * cmd_result: {id, in_response_to, status_code, is_final, detail, properties}
 * </pre>
 */
@Slf4j
public final class MessageCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {
    };

    private MessageCodec() {
    }

    public static String encode(Command command) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("type", MessageType.CMD.getValue());
        node.put("id", command.getCommandId());
        node.put("name", command.getName());
        node.set("properties", OBJECT_MAPPER.valueToTree(command.getProperties()));
        return write(node);
    }

    public static String encode(CommandResult result) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("type", MessageType.CMD_RESULT.getValue());
        node.put("id", result.getId());
        node.put("in_response_to", result.getInResponseTo());
        node.put("status_code", result.getStatusCode().getValue());
        node.put("is_final", result.isFinal());
        if (result.getDetail() != null) {
            node.put("detail", result.getDetail());
        }
        node.set("properties", OBJECT_MAPPER.valueToTree(result.getProperties()));
        return write(node);
    }

    /**
     * 解析一条线上消息，仅支持 cmd 与 cmd_result。
     *
     * @throws IllegalArgumentException 格式不合法
     */
    public static Message decode(String json) {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("无法解析消息 JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("消息必须是 JSON 对象");
        }
        MessageType type = MessageType.fromValue(root.path("type").asText(null));
        Map<String, Object> properties = OBJECT_MAPPER.convertValue(
                root.path("properties").isObject() ? root.get("properties") : OBJECT_MAPPER.createObjectNode(),
                PROPERTIES_TYPE);
        long id = requireLong(root, "id");

        switch (type) {
            case CMD: {
                Command command = new Command(root.path("name").asText(null));
                command.restoreIdentity(id, id);
                command.setProperties(properties);
                return command;
            }
            case CMD_RESULT: {
                CommandResult result = new CommandResult(
                        StatusCode.fromValue(root.path("status_code").asText("ok")),
                        requireLong(root, "in_response_to"),
                        root.path("name").asText(null));
                result.restoreIdentity(id);
                result.setFinal(root.path("is_final").asBoolean(true));
                if (root.hasNonNull("detail")) {
                    result.setDetail(root.get("detail").asText());
                }
                result.setProperties(properties);
                return result;
            }
            default:
                throw new IllegalArgumentException("线上格式不支持的消息类型: " + type.getValue());
        }
    }

    private static long requireLong(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new IllegalArgumentException("缺少或非法的字段: " + field);
        }
        return value.asLong();
    }

    private static String write(JsonNode node) {
        try {
            return OBJECT_MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.error("消息序列化失败: {}", e.getMessage(), e);
            throw new IllegalStateException("消息序列化失败", e);
        }
    }
}
