package com.tenframework.runtime.engine;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import lombok.Getter;

/**
 * 路由器指标，每个 Engine 一份。
 */
@Getter
public class RouterMetrics {

    private final MetricRegistry metricRegistry;

    private final Counter messagesRouted;
    private final Counter messagesDropped;
    private final Counter commandsNoRoute;
    private final Counter resultsStale;
    private final Counter commandsAborted;

    public RouterMetrics() {
        this(new MetricRegistry());
    }

    public RouterMetrics(MetricRegistry metricRegistry) {
        this.metricRegistry = metricRegistry;
        messagesRouted = metricRegistry.counter(MetricRegistry.name("router", "messages", "routed"));
        messagesDropped = metricRegistry.counter(MetricRegistry.name("router", "messages", "dropped"));
        commandsNoRoute = metricRegistry.counter(MetricRegistry.name("router", "commands", "no_route"));
        resultsStale = metricRegistry.counter(MetricRegistry.name("router", "results", "stale"));
        commandsAborted = metricRegistry.counter(MetricRegistry.name("router", "commands", "aborted"));
    }

    /**
     * 分组内消息处理耗时
     */
    public Timer handlerTimer(String groupName) {
        return metricRegistry.timer(MetricRegistry.name("group", groupName, "handler"));
    }
}
