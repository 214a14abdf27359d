package com.tenframework.runtime.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.tenframework.runtime.message.Location;
import com.tenframework.runtime.message.MessageType;
import lombok.extern.slf4j.Slf4j;

/**
 * 由校验后的 GraphDefinition 构建的不可变路由索引：
 * (源 Extension, 消息类型, 消息名) -> 有序目的地列表。
 * 构建完成后只读，因此可以被任何线程安全地查询。
 */
@Slf4j
public final class ConnectionTable {

    private record RouteKey(String sourceExtension, MessageType type, String name) {
    }

    private final Map<RouteKey, List<Location>> routes;

    private ConnectionTable(Map<RouteKey, List<Location>> routes) {
        this.routes = routes;
    }

    public static ConnectionTable build(GraphDefinition definition, String appUri, String graphId) {
        Map<RouteKey, List<Location>> routes = new HashMap<>();
        for (GraphConnection connection : definition.getConnections()) {
            for (MessageType type : MessageType.values()) {
                for (MessageFlow flow : connection.flowsOf(type)) {
                    List<Location> destinations = new ArrayList<>(flow.getDest().size());
                    for (Destination dest : flow.getDest()) {
                        GraphNode node = definition.findExtension(dest.getExtension())
                                .orElseThrow(() -> new IllegalStateException(
                                        "未校验的 Graph: " + dest.getExtension()));
                        destinations.add(new Location(appUri, graphId, GraphDefinition.groupOf(node), node.getName()));
                    }
                    routes.put(new RouteKey(connection.getExtension(), type, flow.getName()),
                            Collections.unmodifiableList(destinations));
                }
            }
        }
        log.debug("ConnectionTable 构建完成: graphId={}, routes={}", graphId, routes.size());
        return new ConnectionTable(Map.copyOf(routes));
    }

    /**
     * 解析消息的目的地。没有匹配时返回空列表。
     */
    public List<Location> resolve(Location source, MessageType type, String name) {
        if (source == null || name == null) {
            return List.of();
        }
        return routes.getOrDefault(new RouteKey(source.getExtensionName(), type, name), List.of());
    }

    public int size() {
        return routes.size();
    }
}
