package com.tenframework.runtime.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 某个消息名到有序目的地列表的映射。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageFlow {

    @JsonProperty("name")
    private String name;

    @JsonProperty("dest")
    private List<Destination> dest = new ArrayList<>();

    public static MessageFlow of(String name, String... destinations) {
        MessageFlow flow = new MessageFlow().setName(name);
        Arrays.stream(destinations).map(Destination::of).forEach(flow.dest::add);
        return flow;
    }
}
