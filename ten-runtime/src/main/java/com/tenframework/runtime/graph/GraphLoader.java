package com.tenframework.runtime.graph;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tenframework.runtime.common.GraphException;
import com.tenframework.runtime.message.MessageType;
import lombok.extern.slf4j.Slf4j;

/**
 * 加载并校验 Graph 定义。
 * 所有引用（连接的源和目的地）都在加载时解析，而不是在发送消息时。
 */
@Slf4j
public final class GraphLoader {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final List<MessageType> ROUTABLE_TYPES = List.of(
            MessageType.CMD, MessageType.DATA, MessageType.AUDIO_FRAME, MessageType.VIDEO_FRAME);

    private GraphLoader() {
    }

    /**
     * 从JSON字符串加载并校验图定义。
     *
     * @param jsonString JSON格式的图定义
     * @return 校验通过的 GraphDefinition
     * @throws GraphException JSON 非法或图结构不合法
     */
    public static GraphDefinition load(String jsonString) {
        GraphDefinition definition;
        try {
            definition = OBJECT_MAPPER.readValue(jsonString, GraphDefinition.class);
        } catch (JsonProcessingException e) {
            throw new GraphException("graph", "无法解析 Graph JSON: " + e.getOriginalMessage(), e);
        }
        if (definition == null) {
            throw new GraphException("graph", "Graph JSON 为空");
        }
        validate(definition);
        return definition;
    }

    public static String toJson(GraphDefinition definition) {
        try {
            return OBJECT_MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Graph 序列化失败", e);
        }
    }

    /**
     * 校验节点声明和连接表。失败时异常信息指明出错的节点或连接。
     */
    public static void validate(GraphDefinition definition) {
        Map<String, GraphNode> extensions = new HashMap<>();
        Set<String> groups = new HashSet<>();

        List<GraphNode> nodes = definition.getNodes() != null ? definition.getNodes() : List.of();
        for (int i = 0; i < nodes.size(); i++) {
            GraphNode node = nodes.get(i);
            String where = "nodes[%d]".formatted(i);
            if (node == null || node.getType() == null) {
                throw new GraphException(where, "节点缺少 type");
            }
            if (isBlank(node.getName())) {
                throw new GraphException(where, "节点缺少 name");
            }
            where = "nodes[%d](%s)".formatted(i, node.getName());
            if (node.getType() == NodeType.EXTENSION) {
                if (isBlank(node.getAddon())) {
                    throw new GraphException(where, "extension 节点缺少 addon");
                }
                if (extensions.putIfAbsent(node.getName(), node) != null) {
                    throw new GraphException(where, "重复的 extension 名称");
                }
            } else if (!groups.add(node.getName())) {
                throw new GraphException(where, "重复的 extension_group 名称");
            }
        }

        List<GraphConnection> connections = definition.getConnections() != null
                ? definition.getConnections() : List.of();
        for (int i = 0; i < connections.size(); i++) {
            GraphConnection connection = connections.get(i);
            String where = "connections[%d]".formatted(i);
            if (connection == null || isBlank(connection.getExtension())) {
                throw new GraphException(where, "连接缺少源 extension");
            }
            where = "connections[%d](%s)".formatted(i, connection.getExtension());
            checkReference(extensions, where, connection.getExtension(), connection.getExtensionGroup());

            for (MessageType type : ROUTABLE_TYPES) {
                Set<String> seenNames = new HashSet<>();
                List<MessageFlow> flows = connection.flowsOf(type);
                for (int j = 0; j < flows.size(); j++) {
                    MessageFlow flow = flows.get(j);
                    String flowWhere = "%s.%s[%d]".formatted(where, type.getValue(), j);
                    if (flow == null || isBlank(flow.getName())) {
                        throw new GraphException(flowWhere, "消息流缺少 name");
                    }
                    flowWhere = "%s.%s[%s]".formatted(where, type.getValue(), flow.getName());
                    if (!seenNames.add(flow.getName())) {
                        throw new GraphException(flowWhere, "同一源上重复声明的消息名");
                    }
                    if (flow.getDest() == null || flow.getDest().isEmpty()) {
                        throw new GraphException(flowWhere, "消息流没有目的地");
                    }
                    for (int k = 0; k < flow.getDest().size(); k++) {
                        Destination dest = flow.getDest().get(k);
                        String destWhere = "%s.dest[%d]".formatted(flowWhere, k);
                        if (dest == null || isBlank(dest.getExtension())) {
                            throw new GraphException(destWhere, "目的地缺少 extension");
                        }
                        checkReference(extensions, destWhere, dest.getExtension(), dest.getExtensionGroup());
                    }
                }
            }
        }
        log.debug("Graph 校验通过: extensions={}, groups={}, connections={}",
                extensions.size(), groups.size(), connections.size());
    }

    private static void checkReference(Map<String, GraphNode> extensions, String where, String extension,
            String extensionGroup) {
        GraphNode node = extensions.get(extension);
        if (node == null) {
            throw new GraphException(where, "引用了未声明的 extension '%s'".formatted(extension));
        }
        if (!isBlank(extensionGroup) && !extensionGroup.equals(GraphDefinition.groupOf(node))) {
            throw new GraphException(where, "extension '%s' 不属于分组 '%s'".formatted(extension, extensionGroup));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
