package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RESP 请求解码器
 * <p>
 * 只接受 multi-bulk 请求：{@code *<n>\r\n} 后跟 n 个 {@code $<len>\r\n<data>\r\n}。
 * 每个元素严格按声明长度读取，所以参数里可以包含 CRLF。
 * 半包由 ReplayingDecoder 自动回滚重放，粘包会在同一次 read 中被连续解出。
 * <p>
 * 帧格式错误时丢弃本次缓冲的字节，向下游输出一个 {@link ErrorMessage}，连接保持打开。
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    private static final Logger log = LoggerFactory.getLogger(RespDecoder.class);

    public static final String INCOMPLETE_COMMAND = "Error: incomplete command";

    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int DEFAULT_MAX_MULTIBULK_LENGTH = 1024 * 1024;

    // RESP 协议常量
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    // 回车换行
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 长度行最多这么多字节，防止垃圾数据让 readLine 无限等待
    private static final int MAX_LINE_LENGTH = 32;

    private final int maxBulkLength;
    private final int maxMultiBulkLength;

    public RespDecoder() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_MULTIBULK_LENGTH);
    }

    public RespDecoder(int maxBulkLength, int maxMultiBulkLength) {
        this.maxBulkLength = maxBulkLength;
        this.maxMultiBulkLength = maxMultiBulkLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        try {
            out.add(decodeArray(in));
        } catch (RespProtocolException e) {
            // 注意：ReplayingDecoder 的 REPLAY 信号是 Error，不会被这里吞掉
            log.debug("Protocol error from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            in.skipBytes(actualReadableBytes());
            out.add(new ErrorMessage(INCOMPLETE_COMMAND));
        }
    }

    // 解析 Array: *<count>\r\n<element1>...<elementN>
    private RedisArray decodeArray(ByteBuf in) {
        byte typeByte = in.readByte();
        if (typeByte != ASTERISK_BYTE) {
            throw new RespProtocolException("expected '*', got '" + (char) typeByte + "'");
        }

        long count = readLong(in);
        if (count == -1) {
            return new RedisArray(null); // Null Array
        }
        if (count < 0 || count > maxMultiBulkLength) {
            throw new RespProtocolException("invalid multibulk length: " + count);
        }

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < count; i++) {
            elements[i] = decodeBulkString(in);
        }
        return new RedisArray(elements);
    }

    // 解析 BulkString: $<length>\r\n<data>\r\n
    private BulkString decodeBulkString(ByteBuf in) {
        byte typeByte = in.readByte();
        if (typeByte != DOLLAR_BYTE) {
            throw new RespProtocolException("expected '$', got '" + (char) typeByte + "'");
        }

        long length = readLong(in);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0 || length > maxBulkLength) {
            throw new RespProtocolException("invalid bulk length: " + length);
        }

        // readSlice 在数据不足时触发重放，不会每次重放都分配 length 大小的数组
        byte[] content = ByteBufUtil.getBytes(in.readSlice((int) length));
        readCRLF(in);
        return new BulkString(content);
    }

    // 辅助：读取一行（读取到 \r\n 为止）
    private String readLine(ByteBuf in) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            byte b = in.readByte();
            if (b == CR) {
                if (in.readByte() != LF) {
                    throw new RespProtocolException("expected LF after CR");
                }
                return sb.toString();
            }
            if (sb.length() >= MAX_LINE_LENGTH) {
                throw new RespProtocolException("length line too long");
            }
            sb.append((char) b);
        }
    }

    // 辅助：读取并解析长整型
    private long readLong(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new RespProtocolException("invalid length '" + s + "'");
        }
    }

    // 辅助：跳过 CRLF
    private void readCRLF(ByteBuf in) {
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new RespProtocolException("expected CRLF after bulk payload");
        }
    }
}
