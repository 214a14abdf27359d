package com.tenframework.runtime.message;

import java.util.Arrays;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * PCM 音频帧
 */
@Getter
@Setter
@Accessors(chain = true)
public class AudioFrame extends Message {

    private byte[] buf = new byte[0];
    private int sampleRate;
    private int bytesPerSample;
    private int samplesPerChannel;
    private int numberOfChannels;
    private long frameTimestamp;
    private boolean eof;

    public AudioFrame(String name) {
        super(name);
    }

    protected AudioFrame(AudioFrame other, boolean keepId) {
        super(other, keepId);
        this.buf = Arrays.copyOf(other.buf, other.buf.length);
        this.sampleRate = other.sampleRate;
        this.bytesPerSample = other.bytesPerSample;
        this.samplesPerChannel = other.samplesPerChannel;
        this.numberOfChannels = other.numberOfChannels;
        this.frameTimestamp = other.frameTimestamp;
        this.eof = other.eof;
    }

    public static AudioFrame create(String name) {
        return new AudioFrame(name);
    }

    @Override
    public MessageType getType() {
        return MessageType.AUDIO_FRAME;
    }

    @Override
    public AudioFrame copy(boolean keepId) {
        return new AudioFrame(this, keepId);
    }
}
