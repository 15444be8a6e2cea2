package org.muma.mini.kv.protocol;

// 5. 数组 (*) - 请求帧的载体，elements 为 null 表示 Null Array
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    /**
     * 按下标读取字符串参数；越界或非 BulkString 时返回 null
     */
    public String getString(int index) {
        if (elements == null || index < 0 || index >= elements.length) {
            return null;
        }
        return elements[index] instanceof BulkString b ? b.asString() : null;
    }

    public byte[] getBytes(int index) {
        if (elements == null || index < 0 || index >= elements.length) {
            return null;
        }
        return elements[index] instanceof BulkString b ? b.content() : null;
    }

    public static RedisArray of(String... parts) {
        RedisMessage[] msgs = new RedisMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            msgs[i] = new BulkString(parts[i]);
        }
        return new RedisArray(msgs);
    }
}
