package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

import java.io.ByteArrayOutputStream;

/**
 * ECHO msg [msg ...]
 * <p>
 * 多个参数用 CRLF 拼接，统一以 BulkString 返回；没有参数时返回空串。
 */
public class EchoCommand implements RedisCommand {

    private static final byte[] CRLF = {'\r', '\n'};

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        for (int i = 1; i < args.size(); i++) {
            byte[] part = args.getBytes(i);
            if (i > 1) bos.writeBytes(CRLF);
            if (part != null) bos.writeBytes(part);
        }
        return new BulkString(bos.toByteArray());
    }
}
