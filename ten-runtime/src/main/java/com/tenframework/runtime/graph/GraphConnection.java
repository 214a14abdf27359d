package com.tenframework.runtime.graph;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tenframework.runtime.message.MessageType;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 一个源 Extension 发出的所有连接，按消息类型分组。
 */
@Data
@NoArgsConstructor
@Accessors(chain = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphConnection {

    @JsonProperty("extension")
    private String extension;

    @JsonProperty("extension_group")
    private String extensionGroup;

    @JsonProperty("cmd")
    private List<MessageFlow> cmd = new ArrayList<>();

    @JsonProperty("data")
    private List<MessageFlow> data = new ArrayList<>();

    @JsonProperty("audio_frame")
    private List<MessageFlow> audioFrame = new ArrayList<>();

    @JsonProperty("video_frame")
    private List<MessageFlow> videoFrame = new ArrayList<>();

    public List<MessageFlow> flowsOf(MessageType type) {
        List<MessageFlow> flows;
        switch (type) {
            case CMD:
                flows = cmd;
                break;
            case DATA:
                flows = data;
                break;
            case AUDIO_FRAME:
                flows = audioFrame;
                break;
            case VIDEO_FRAME:
                flows = videoFrame;
                break;
            default:
                // 结果沿 PathTable 回溯，不走连接表
                flows = null;
                break;
        }
        return flows != null ? flows : List.of();
    }

    public static GraphConnection from(String extension) {
        return new GraphConnection().setExtension(extension);
    }

    public GraphConnection addCmd(MessageFlow flow) {
        cmd.add(flow);
        return this;
    }

    public GraphConnection addData(MessageFlow flow) {
        data.add(flow);
        return this;
    }

    public GraphConnection addAudioFrame(MessageFlow flow) {
        audioFrame.add(flow);
        return this;
    }

    public GraphConnection addVideoFrame(MessageFlow flow) {
        videoFrame.add(flow);
        return this;
    }
}
