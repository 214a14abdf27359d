package com.tenframework.runtime.message;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 消息类型枚举
 * 对应C语言中的TEN_MSG_TYPE枚举
 */
public enum MessageType {

    /**
     * 命令消息 - 期待一个关联结果
     */
    CMD("cmd"),

    /**
     * 命令结果消息 - 命令执行结果的回溯
     */
    CMD_RESULT("cmd_result"),

    /**
     * 数据消息
     */
    DATA("data"),

    /**
     * 音频帧消息
     */
    AUDIO_FRAME("audio_frame"),

    /**
     * 视频帧消息
     */
    VIDEO_FRAME("video_frame");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * 从字符串值解析消息类型
     */
    public static MessageType fromValue(String value) {
        for (MessageType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的消息类型: " + value);
    }

    public boolean isCommand() {
        return this == CMD;
    }

    public boolean isCommandResult() {
        return this == CMD_RESULT;
    }

    /**
     * 检查是否是数据类型消息（包括音视频帧）
     */
    public boolean isData() {
        return this == DATA || this == VIDEO_FRAME || this == AUDIO_FRAME;
    }
}
