package com.tenframework.runtime.engine;

import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import com.tenframework.runtime.extension.Delivery;
import com.tenframework.runtime.extension.ExtensionGroup;
import com.tenframework.runtime.graph.ConnectionTable;
import com.tenframework.runtime.message.Command;
import com.tenframework.runtime.message.CommandResult;
import com.tenframework.runtime.message.Location;
import com.tenframework.runtime.message.Message;
import com.tenframework.runtime.path.PathOut;
import com.tenframework.runtime.path.PathTable;
import com.tenframework.runtime.path.ResultResolution;
import lombok.extern.slf4j.Slf4j;

/**
 * 消息路由器：解析目的地、扇出、跨线程投递以及命令结果的关联。
 * 只在 Engine 线程上运行，路径表因此无需同步。
 */
@Slf4j
class MessageRouter {

    private final String graphId;
    private final ConnectionTable connectionTable;
    private final Map<String, ExtensionGroup> groups;
    private final RouterMetrics metrics;
    private final BooleanSupplier stopping;
    private final PathTable pathTable = new PathTable();

    MessageRouter(String graphId, ConnectionTable connectionTable, Map<String, ExtensionGroup> groups,
            RouterMetrics metrics, BooleanSupplier stopping) {
        this.graphId = graphId;
        this.connectionTable = connectionTable;
        this.groups = groups;
        this.metrics = metrics;
        this.stopping = stopping;
    }

    void route(Message message) {
        if (message instanceof CommandResult result) {
            routeResult(result);
        } else if (message instanceof Command command) {
            routeCommand(command);
        } else {
            routeNonCommand(message);
        }
    }

    /**
     * 为每个在途命令向其发送方投递 ABORTED 结果，并清空路径表。
     */
    void abortAll() {
        for (PathOut pathOut : pathTable.removeAll()) {
            metrics.getCommandsAborted().inc();
            deliver(CommandResult.aborted(pathOut.getCommandId(), pathOut.getCommandName()), pathOut.getSender(),
                    true);
        }
    }

    int getPendingCommandCount() {
        return pathTable.getOutPathCount();
    }

    private void routeCommand(Command command) {
        Location source = command.getSrcLoc();
        if (stopping.getAsBoolean()) {
            metrics.getCommandsAborted().inc();
            log.debug("Engine {}: 停止中，命令 {} 直接放弃", graphId, command);
            deliver(CommandResult.aborted(command.getCommandId(), command.getName()), source, true);
            return;
        }

        List<Location> destinations = connectionTable.resolve(source, command.getType(), command.getName());
        if (destinations.isEmpty()) {
            metrics.getCommandsNoRoute().inc();
            log.warn("Engine {}: 命令 {} 没有路由", graphId, command);
            deliver(CommandResult.noRoute(command), source, true);
            return;
        }

        PathOut pathOut = new PathOut(command.getCommandId(), command.getName(), source,
                command.resolveExpectedResultCount(destinations.size()));
        if (!pathTable.addOutPath(pathOut)) {
            log.warn("Engine {}: 命令 {} 已在途，忽略重复提交", graphId, command);
            return;
        }
        fanOut(command, destinations);
    }

    private void routeResult(CommandResult result) {
        ResultResolution resolution = pathTable.resolveResult(result);
        if (resolution == null) {
            metrics.getResultsStale().inc();
            log.warn("Engine {}: StaleResult，命令 {} 不在途，丢弃 {}", graphId, result.getInResponseTo(), result);
            return;
        }
        deliver(result, resolution.path().getSender(), resolution.completesCommand());
    }

    private void routeNonCommand(Message message) {
        List<Location> destinations = connectionTable.resolve(message.getSrcLoc(), message.getType(),
                message.getName());
        if (destinations.isEmpty()) {
            metrics.getMessagesDropped().inc();
            log.debug("Engine {}: {} 没有路由，已丢弃", graphId, message);
            return;
        }
        fanOut(message, destinations);
    }

    /**
     * 单个目的地直接投递原消息；多个目的地时每份都是深拷贝并分配新 ID，命令副本共享 commandId。
     */
    private void fanOut(Message message, List<Location> destinations) {
        if (destinations.size() == 1) {
            deliver(message, destinations.get(0), false);
            return;
        }
        for (Location destination : destinations) {
            deliver(message.copy(false), destination, false);
        }
    }

    private void deliver(Message message, Location destination, boolean completesCommand) {
        if (destination == null) {
            metrics.getMessagesDropped().inc();
            log.warn("Engine {}: {} 没有目标位置，已丢弃", graphId, message);
            return;
        }
        ExtensionGroup group = groups.get(destination.getExtensionGroup());
        if (group == null
                || !group.enqueue(new Delivery(message, destination.getExtensionName(), completesCommand))) {
            metrics.getMessagesDropped().inc();
            log.warn("Engine {}: 分组 {} 不可用，丢弃 {}", graphId, destination.getExtensionGroup(), message);
            return;
        }
        metrics.getMessagesRouted().inc();
        log.debug("Engine {}: {} -> {}", graphId, message, destination);
    }
}
