package org.muma.mini.kv.protocol;

// 密封接口，限制实现类
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, BulkString, RedisArray {
}
