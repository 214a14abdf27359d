package com.tenframework.runtime.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Engine 配置，对应 property.json 中 "ten.engine" 字段。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    @JsonProperty("start_timeout_ms")
    private long startTimeoutMs = 5000;

    @JsonProperty("stop_timeout_ms")
    private long stopTimeoutMs = 5000;

    @JsonProperty("drain_policy")
    private DrainPolicy drainPolicy = DrainPolicy.PROCESS;
}
