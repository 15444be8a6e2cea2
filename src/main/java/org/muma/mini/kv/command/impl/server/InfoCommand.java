package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.store.StorageEngine;

/**
 * INFO [section]
 * <p>
 * 目前只有 Replication 段，section 参数被忽略。
 */
public class InfoCommand implements RedisCommand {

    private final ReplicationManager replicationManager;

    public InfoCommand(ReplicationManager replicationManager) {
        this.replicationManager = replicationManager;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        return new BulkString(replicationManager.info());
    }
}
