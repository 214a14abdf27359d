package com.tenframework.runtime.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 表示一个消息处理图的静态配置或蓝图。
 * 它不包含任何运行时状态，仅定义图的节点和连接路由表。
 * 对应C语言中的ten_graph_t结构体。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphDefinition {

    public static final String DEFAULT_EXTENSION_GROUP = "default_extension_group";

    // 可选，缺省时由 Engine 生成
    @JsonProperty("graph_id")
    private String graphId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("nodes")
    private List<GraphNode> nodes = new ArrayList<>();

    @JsonProperty("connections")
    private List<GraphConnection> connections = new ArrayList<>();

    // JSON 中显式的 null 按空列表处理
    @JsonProperty("nodes")
    public GraphDefinition setNodes(List<GraphNode> nodes) {
        this.nodes = nodes != null ? new ArrayList<>(nodes) : new ArrayList<>();
        return this;
    }

    @JsonProperty("connections")
    public GraphDefinition setConnections(List<GraphConnection> connections) {
        this.connections = connections != null ? new ArrayList<>(connections) : new ArrayList<>();
        return this;
    }

    public GraphDefinition addNode(GraphNode node) {
        nodes.add(node);
        return this;
    }

    public GraphDefinition addConnection(GraphConnection connection) {
        connections.add(connection);
        return this;
    }

    @JsonIgnore
    public List<GraphNode> getExtensionNodes() {
        return nodes.stream().filter(n -> n.getType() == NodeType.EXTENSION).toList();
    }

    @JsonIgnore
    public Optional<GraphNode> findExtension(String extensionName) {
        return getExtensionNodes().stream().filter(n -> extensionName.equals(n.getName())).findFirst();
    }

    @JsonIgnore
    public Optional<GraphNode> findExtensionGroup(String groupName) {
        return nodes.stream()
                .filter(n -> n.getType() == NodeType.EXTENSION_GROUP && groupName.equals(n.getName()))
                .findFirst();
    }

    /**
     * 按首次出现的顺序返回所有分组名，这也是分组的创建顺序。
     */
    @JsonIgnore
    public List<String> getGroupNamesInOrder() {
        Set<String> ordered = new LinkedHashSet<>();
        for (GraphNode node : nodes) {
            if (node.getType() == NodeType.EXTENSION_GROUP) {
                ordered.add(node.getName());
            } else if (node.getType() == NodeType.EXTENSION) {
                ordered.add(groupOf(node));
            }
        }
        return new ArrayList<>(ordered);
    }

    public static String groupOf(GraphNode extensionNode) {
        String group = extensionNode.getExtensionGroup();
        return group == null || group.isEmpty() ? DEFAULT_EXTENSION_GROUP : group;
    }
}
