package com.tenframework.runtime.extension;

import com.tenframework.runtime.message.Message;
import lombok.Getter;

/**
 * 投递到 Extension Group 入站队列的一条消息及其目标 Extension。
 */
@Getter
public final class Delivery {

    private final Message message;

    private final String targetExtension;

    // 仅对 CommandResult 有意义：true 表示该命令在路由器中已经结清
    private final boolean completesCommand;

    public Delivery(Message message, String targetExtension, boolean completesCommand) {
        this.message = message;
        this.targetExtension = targetExtension;
        this.completesCommand = completesCommand;
    }

    public static Delivery of(Message message, String targetExtension) {
        return new Delivery(message, targetExtension, false);
    }

    @Override
    public String toString() {
        return message + " -> " + targetExtension;
    }
}
