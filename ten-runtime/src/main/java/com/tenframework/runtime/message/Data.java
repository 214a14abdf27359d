package com.tenframework.runtime.message;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import lombok.Getter;

/**
 * 数据消息，属性表之外可以携带一段二进制缓冲区。
 */
@Getter
public class Data extends Message {

    private byte[] buf = new byte[0];

    public Data(String name) {
        super(name);
    }

    protected Data(Data other, boolean keepId) {
        super(other, keepId);
        this.buf = Arrays.copyOf(other.buf, other.buf.length);
    }

    public static Data create(String name) {
        return new Data(name);
    }

    public static Data text(String name, String text) {
        return new Data(name).setBuf(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public MessageType getType() {
        return MessageType.DATA;
    }

    @Override
    public Data copy(boolean keepId) {
        return new Data(this, keepId);
    }

    public Data setBuf(byte[] buf) {
        this.buf = buf != null ? buf : new byte[0];
        return this;
    }
}
