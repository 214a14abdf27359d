package com.tenframework.runtime.message;

/**
 * 命令被扇出到多个目的地时，发送方如何收取结果。
 */
public enum FanInPolicy {

    /**
     * 第一个最终结果即完成该命令，其余目的地的结果视为过期结果。
     */
    FIRST_WINS,

    /**
     * 每个目的地的最终结果都回传给发送方，全部到齐后命令完成。
     */
    WAIT_FOR_ALL
}
