package org.muma.mini.kv.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class CommandDispatcherTest {

    private StorageEngine storage;
    private ReplicationManager replicationManager;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
        replicationManager = new ReplicationManager();
        dispatcher = new CommandDispatcher(storage, replicationManager);
    }

    private long offset() {
        return replicationManager.getMetadata().getReplOffset();
    }

    @Test
    void testCommandNameIsCaseInsensitive() {
        assertEquals(SimpleString.PONG, dispatcher.dispatch(RedisArray.of("PING")));
        assertEquals(SimpleString.PONG, dispatcher.dispatch(RedisArray.of("ping")));
        assertEquals(SimpleString.PONG, dispatcher.dispatch(RedisArray.of("PiNg")));
    }

    @Test
    void testUnknownCommand() {
        RedisMessage res = dispatcher.dispatch(RedisArray.of("FOO"));
        assertEquals(new ErrorMessage("Error: Invalid command"), res);
    }

    @Test
    void testEmptyOrNullFrameIsIncomplete() {
        ErrorMessage incomplete = new ErrorMessage("Error: incomplete command");

        assertEquals(incomplete, dispatcher.dispatch(new RedisArray(new RedisMessage[0])));
        assertEquals(incomplete, dispatcher.dispatch(new RedisArray(null)));
        assertEquals(incomplete, dispatcher.dispatch(new RedisArray(new RedisMessage[]{BulkString.NULL})));
    }

    @Test
    void testInfoAfterSlaveOfShowsOnlyRole() {
        assertEquals(SimpleString.OK, dispatcher.dispatch(RedisArray.of("SLAVEOF", "host", "1234")));

        BulkString info = (BulkString) dispatcher.dispatch(RedisArray.of("INFO"));
        assertEquals("role:replica\r\n", info.asString());
        assertFalse(info.asString().contains("master_host"));
    }

    @Test
    void testOffsetAdvancesOnlyOnSuccessfulSet() {
        assertEquals(0, offset());

        dispatcher.dispatch(RedisArray.of("SET", "a", "1"));
        assertEquals(1, offset());

        dispatcher.dispatch(RedisArray.of("SET", "b", "2", "PX", "1000"));
        assertEquals(2, offset());

        // 读命令、PING、失败的 SET 都不计数
        dispatcher.dispatch(RedisArray.of("GET", "a"));
        dispatcher.dispatch(RedisArray.of("PING"));
        dispatcher.dispatch(RedisArray.of("SET", "c"));
        dispatcher.dispatch(RedisArray.of("SET", "c", "3", "PX", "oops"));
        dispatcher.dispatch(RedisArray.of("INFO"));
        assertEquals(2, offset());
    }

    @Test
    void testHandlerExceptionBecomesErrorReply() {
        RedisCommand broken = mock(RedisCommand.class);
        when(broken.execute(any(), any())).thenThrow(new IllegalStateException("boom"));
        dispatcher.register("BROKEN", broken);

        RedisMessage res = dispatcher.dispatch(RedisArray.of("broken", "x"));
        assertEquals(new ErrorMessage("Error: command failed"), res);

        // 分发器仍然可用
        assertEquals(SimpleString.PONG, dispatcher.dispatch(RedisArray.of("PING")));
    }

    @Test
    void testFailedWriteDoesNotPropagate() {
        ReplicationManager spyManager = spy(new ReplicationManager());
        CommandDispatcher d = new CommandDispatcher(storage, spyManager);

        RedisCommand write = mock(RedisCommand.class);
        when(write.isWrite()).thenReturn(true);
        when(write.execute(any(), any())).thenReturn(new ErrorMessage("Error: nope"));
        d.register("w", write);

        d.dispatch(RedisArray.of("W"));
        verify(spyManager, never()).propagate(any());

        d.dispatch(RedisArray.of("SET", "k", "v"));
        verify(spyManager, times(1)).propagate(any());
    }

    @Test
    void testGetThroughDispatcher() {
        assertTrue(((BulkString) dispatcher.dispatch(RedisArray.of("GET", "k"))).isNull());

        dispatcher.dispatch(RedisArray.of("SET", "k", "v"));
        assertEquals("v", ((BulkString) dispatcher.dispatch(RedisArray.of("get", "k"))).asString());
    }
}
