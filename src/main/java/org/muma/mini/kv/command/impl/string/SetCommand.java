package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        // 基本格式: SET key value [PX milliseconds]
        String key = args.getString(1);
        byte[] value = args.getBytes(2);
        if (key == null || value == null) {
            return error("incomplete set command");
        }

        // --- 1. 参数解析阶段，全部校验通过之前不碰存储 ---
        boolean hasPx = false;
        long expireAt = StorageEngine.NO_EXPIRE;

        for (int i = 3; i < args.size(); i++) {
            String opt = args.getString(i);
            if (!"PX".equalsIgnoreCase(opt) || hasPx) {
                return error("syntax error");
            }
            if (i + 1 >= args.size()) {
                return error("incomplete set command");
            }
            try {
                long millis = Long.parseLong(args.getString(++i));
                if (millis < 0) return error("invalid expire time in set");
                expireAt = Math.addExact(storage.currentTimeMillis(), millis);
            } catch (NumberFormatException | ArithmeticException e) {
                return error("invalid expire time in set");
            }
            hasPx = true;
        }

        // --- 2. 写入阶段：整体覆盖，没带 PX 时清除旧 TTL ---
        storage.set(key, value, expireAt);
        return SimpleString.OK;
    }

    @Override
    public boolean isWrite() {
        return true;
    }
}
