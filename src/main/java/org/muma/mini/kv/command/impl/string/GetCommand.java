package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

public class GetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        String key = args.getString(1);
        if (key == null) {
            return error("incomplete get command");
        }

        byte[] value = storage.get(key);
        if (value == null) {
            return BulkString.NULL; // Nil
        }
        return new BulkString(value);
    }
}
