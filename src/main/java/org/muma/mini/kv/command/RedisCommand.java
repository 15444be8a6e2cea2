package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.store.StorageEngine;

public interface RedisCommand {

    /**
     * 执行命令，传入存储引擎和完整参数 (下标 0 是命令名)。
     * 参数校验失败时返回 {@link ErrorMessage}，且不得修改任何共享状态。
     */
    RedisMessage execute(StorageEngine storage, RedisArray args);

    /**
     * 辅助工具：统一错误前缀
     */
    default ErrorMessage error(String message) {
        return new ErrorMessage("Error: " + message);
    }

    // 默认不是写命令，SET 等需要覆盖返回 true
    default boolean isWrite() {
        return false;
    }
}
