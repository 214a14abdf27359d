package com.tenframework.runtime.message;

import lombok.Getter;

/**
 * 命令消息，期待一个（或按扇入策略多个）关联的 CommandResult。
 */
@Getter
public class Command extends Message {

    /**
     * 关联 ID。原始命令等于自身 id，扇出产生的副本共享同一个值。
     */
    private long commandId;

    private FanInPolicy fanInPolicy = FanInPolicy.FIRST_WINS;

    /**
     * 显式的扇入数量，null 表示按策略默认
     */
    private Integer expectedResultCount;

    public Command(String name) {
        super(name);
        this.commandId = id;
    }

    protected Command(Command other, boolean keepId) {
        super(other, keepId);
        this.commandId = other.commandId;
        this.fanInPolicy = other.fanInPolicy;
        this.expectedResultCount = other.expectedResultCount;
    }

    public static Command create(String name) {
        return new Command(name);
    }

    @Override
    public MessageType getType() {
        return MessageType.CMD;
    }

    @Override
    public Command copy(boolean keepId) {
        return new Command(this, keepId);
    }

    /**
     * 作为一条新命令发出的副本：新的 id，关联 ID 等于新 id，属性深拷贝。
     * 转发收到的命令时使用，使每一跳都有自己的在途路径。
     */
    public Command copyAsNewCommand() {
        Command copy = copy(false);
        copy.commandId = copy.id;
        return copy;
    }

    public Command setFanInPolicy(FanInPolicy fanInPolicy) {
        this.fanInPolicy = fanInPolicy != null ? fanInPolicy : FanInPolicy.FIRST_WINS;
        return this;
    }

    public Command setExpectedResultCount(Integer expectedResultCount) {
        if (expectedResultCount != null && expectedResultCount < 1) {
            throw new IllegalArgumentException("expectedResultCount 必须 >= 1: " + expectedResultCount);
        }
        this.expectedResultCount = expectedResultCount;
        return this;
    }

    /**
     * 计算该命令在给定目的地数量下需要的最终结果数。
     */
    public int resolveExpectedResultCount(int destinationCount) {
        if (expectedResultCount != null) {
            return Math.min(expectedResultCount, destinationCount);
        }
        return fanInPolicy == FanInPolicy.WAIT_FOR_ALL ? destinationCount : 1;
    }

    /**
     * 仅供解码器恢复线上的关联 ID。
     */
    void restoreIdentity(long id, long commandId) {
        this.id = id;
        this.commandId = commandId;
    }
}
