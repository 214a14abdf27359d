package com.tenframework.runtime.app;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tenframework.runtime.graph.GraphConnection;
import com.tenframework.runtime.graph.GraphDefinition;
import com.tenframework.runtime.graph.GraphNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * property.json 中 "predefined_graphs" 数组的一项。
 * 图既可以写在 "graph" 对象里，也可以直接把 nodes/connections 写在本层。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PredefinedGraph {

    @JsonProperty("name")
    private String name;

    @JsonProperty("auto_start")
    private boolean autoStart;

    @JsonProperty("graph")
    private GraphDefinition graph;

    @JsonProperty("nodes")
    private List<GraphNode> nodes = new ArrayList<>();

    @JsonProperty("connections")
    private List<GraphConnection> connections = new ArrayList<>();

    // JSON 中显式的 null 按空列表处理
    @JsonProperty("nodes")
    public PredefinedGraph setNodes(List<GraphNode> nodes) {
        this.nodes = nodes != null ? new ArrayList<>(nodes) : new ArrayList<>();
        return this;
    }

    @JsonProperty("connections")
    public PredefinedGraph setConnections(List<GraphConnection> connections) {
        this.connections = connections != null ? new ArrayList<>(connections) : new ArrayList<>();
        return this;
    }

    /**
     * 生成一份新的图定义，name 沿用本项的名称。
     */
    public GraphDefinition toGraphDefinition() {
        GraphDefinition definition = new GraphDefinition().setName(name);
        if (graph != null) {
            definition.setGraphId(graph.getGraphId());
            definition.getNodes().addAll(graph.getNodes());
            definition.getConnections().addAll(graph.getConnections());
        } else {
            definition.getNodes().addAll(nodes);
            definition.getConnections().addAll(connections);
        }
        return definition;
    }
}
