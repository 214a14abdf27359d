package com.tenframework.runtime.path;

import com.tenframework.runtime.message.Location;
import lombok.Getter;

/**
 * 命令输出路径：一个在途命令的发送方及其扇入进度。
 * 对应 C 语言中的 ten_path_out_t。
 */
@Getter
public class PathOut {

    private final long commandId;

    private final String commandName;

    /**
     * 结果要送回的位置，即命令的发送方
     */
    private final Location sender;

    private final int expectedResultCount;

    private final long createdAt;

    private int finalResultCount;

    public PathOut(long commandId, String commandName, Location sender, int expectedResultCount) {
        if (expectedResultCount < 1) {
            throw new IllegalArgumentException("expectedResultCount must be >= 1");
        }
        this.commandId = commandId;
        this.commandName = commandName;
        this.sender = sender;
        this.expectedResultCount = expectedResultCount;
        this.createdAt = System.currentTimeMillis();
    }

    /**
     * 记录一个最终结果。
     *
     * @return 达到期望数量时返回 true
     */
    boolean recordFinalResult() {
        finalResultCount++;
        return finalResultCount >= expectedResultCount;
    }

    @Override
    public String toString() {
        return "PathOut{commandId=%d, name='%s', sender=%s, %d/%d}".formatted(commandId, commandName, sender,
                finalResultCount, expectedResultCount);
    }
}
