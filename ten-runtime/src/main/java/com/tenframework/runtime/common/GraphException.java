package com.tenframework.runtime.common;

import lombok.Getter;

/**
 * Graph 定义无法解析或引用了未声明的节点。
 * 在 Engine 启动时抛出，此时不会创建任何线程。
 */
@Getter
public class GraphException extends TenException {

    /**
     * 出错的节点或连接描述，例如 "connection[0].cmd[ping].dest[1]"
     */
    private final String offendingElement;

    public GraphException(String offendingElement, String message) {
        super(TenErrorCode.INVALID_GRAPH, "%s: %s".formatted(offendingElement, message));
        this.offendingElement = offendingElement;
    }

    public GraphException(String offendingElement, String message, Throwable cause) {
        super(TenErrorCode.INVALID_GRAPH, "%s: %s".formatted(offendingElement, message), cause);
        this.offendingElement = offendingElement;
    }
}
