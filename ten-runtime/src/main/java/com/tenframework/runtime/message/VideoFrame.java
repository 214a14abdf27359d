package com.tenframework.runtime.message;

import java.util.Arrays;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@Getter
@Setter
@Accessors(chain = true)
public class VideoFrame extends Message {

    private byte[] buf = new byte[0];
    private int width;
    private int height;
    // 例如 "rgba"、"i420"
    private String pixelFormat;
    private long frameTimestamp;
    private boolean eof;

    public VideoFrame(String name) {
        super(name);
    }

    protected VideoFrame(VideoFrame other, boolean keepId) {
        super(other, keepId);
        this.buf = Arrays.copyOf(other.buf, other.buf.length);
        this.width = other.width;
        this.height = other.height;
        this.pixelFormat = other.pixelFormat;
        this.frameTimestamp = other.frameTimestamp;
        this.eof = other.eof;
    }

    public static VideoFrame create(String name) {
        return new VideoFrame(name);
    }

    @Override
    public MessageType getType() {
        return MessageType.VIDEO_FRAME;
    }

    @Override
    public VideoFrame copy(boolean keepId) {
        return new VideoFrame(this, keepId);
    }
}
