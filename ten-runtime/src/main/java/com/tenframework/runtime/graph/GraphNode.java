package com.tenframework.runtime.graph;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Graph 中声明的一个节点：Extension 或 Extension Group。
 * 对应 C 语言中的 ten_extension_info_t / ten_extension_group_info_t。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphNode {

    @JsonProperty("type")
    private NodeType type;

    @JsonProperty("name")
    private String name;

    @JsonProperty("addon")
    private String addon;

    // 仅对 extension 节点有意义
    @JsonProperty("extension_group")
    private String extensionGroup;

    @JsonProperty("property")
    private Map<String, Object> property = new LinkedHashMap<>();

    public static GraphNode extension(String name, String addon, String extensionGroup) {
        return new GraphNode().setType(NodeType.EXTENSION).setName(name).setAddon(addon)
                .setExtensionGroup(extensionGroup);
    }

    public static GraphNode extensionGroup(String name, String addon) {
        return new GraphNode().setType(NodeType.EXTENSION_GROUP).setName(name).setAddon(addon);
    }
}
