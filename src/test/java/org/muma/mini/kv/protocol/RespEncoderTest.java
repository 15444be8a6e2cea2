package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RespEncoderTest {

    private String encode(RedisMessage msg) {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());
        assertTrue(channel.writeOutbound(msg));
        ByteBuf buf = channel.readOutbound();
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
            channel.finishAndReleaseAll();
        }
    }

    @Test
    void testReplyEncodings() {
        assertEquals("+PONG\r\n", encode(SimpleString.PONG));
        assertEquals("+OK\r\n", encode(SimpleString.OK));
        assertEquals("-Error: Invalid command\r\n", encode(new ErrorMessage("Error: Invalid command")));
        assertEquals("$5\r\nhello\r\n", encode(new BulkString("hello")));
        assertEquals("$0\r\n\r\n", encode(new BulkString("")));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
    }

    @Test
    void testBulkLengthCountsBytes() {
        // 中文每个字符 3 字节
        assertEquals("$6\r\n你好\r\n", encode(new BulkString("你好")));
    }

    @Test
    void testArrayEncoding() {
        assertEquals("*2\r\n$3\r\nGET\r\n$1\r\nk\r\n", encode(RedisArray.of("GET", "k")));
        assertEquals("*-1\r\n", encode(new RedisArray(null)));
    }
}
