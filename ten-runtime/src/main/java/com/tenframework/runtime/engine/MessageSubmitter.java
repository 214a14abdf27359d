package com.tenframework.runtime.engine;

import com.tenframework.runtime.graph.ConnectionTable;
import com.tenframework.runtime.message.Message;

/**
 * 消息提交器接口，定义了 Extension 环境与 Engine 之间的全部交互。
 * 用于解耦 ExtensionEnv 和 Engine 的直接依赖。
 */
public interface MessageSubmitter {

    /**
     * 向 Engine 提交消息（非阻塞，线程安全）。
     */
    void submitMessage(Message message);

    /**
     * 不可变的路由表，可在任意线程上读取。
     */
    ConnectionTable getConnectionTable();

    RouterMetrics getRouterMetrics();

    void requestStopGraph();

    void requestCloseApp();
}
