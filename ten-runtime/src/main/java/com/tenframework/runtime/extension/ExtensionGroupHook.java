package com.tenframework.runtime.extension;

import com.tenframework.runtime.runloop.EventLoop;
import com.tenframework.runtime.runloop.Runloop;

/**
 * extension_group 类 Addon 产出的实例。
 * 决定分组使用的事件循环，并在分组线程上收到分组级别的初始化/去初始化回调。
 */
public interface ExtensionGroupHook {

    /**
     * 为分组创建事件循环。默认每个分组一个独立线程。
     */
    default EventLoop createEventLoop(String loopName) {
        return new Runloop(loopName);
    }

    default void onInit(String groupName) throws Exception {
    }

    default void onDeinit(String groupName) throws Exception {
    }
}
