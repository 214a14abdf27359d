package com.tenframework.runtime.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 消息在 App 内的位置。
 * (extensionGroup, extensionName) 在一个 Graph 内即是 Extension 的身份。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class Location {

    @JsonProperty("app_uri")
    private String appUri;

    // Engine 的唯一 ID，也是 Graph 实例的 ID
    @JsonProperty("graph_id")
    private String graphId;

    @JsonProperty("extension_group")
    private String extensionGroup;

    @JsonProperty("extension")
    private String extensionName;

    public Location copy() {
        return new Location(appUri, graphId, extensionGroup, extensionName);
    }

    @Override
    public String toString() {
        return "%s/%s/%s/%s".formatted(appUri, graphId, extensionGroup, extensionName);
    }
}
