package com.tenframework.runtime.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Destination {

    @JsonProperty("extension")
    private String extension;

    // 可选，给出时必须与节点声明的分组一致
    @JsonProperty("extension_group")
    private String extensionGroup;

    public static Destination of(String extension) {
        return new Destination(extension, null);
    }
}
