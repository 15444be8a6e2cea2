package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.store.StorageEngine;

/**
 * SLAVEOF host port | SLAVEOF NO ONE
 * <p>
 * 只切换本地角色并记录 Master 地址，不发起任何连接。
 */
public class SlaveOfCommand implements RedisCommand {

    private final ReplicationManager replicationManager;

    public SlaveOfCommand(ReplicationManager replicationManager) {
        this.replicationManager = replicationManager;
    }

    @Override
    public RedisMessage execute(StorageEngine storage, RedisArray args) {
        String host = args.getString(1);
        String portStr = args.getString(2);
        if (args.size() != 3 || host == null || portStr == null) {
            return error("SLAVEOF requires a host and port");
        }

        if ("NO".equalsIgnoreCase(host) && "ONE".equalsIgnoreCase(portStr)) {
            replicationManager.slaveOfNoOne();
            return SimpleString.OK;
        }

        int port;
        try {
            port = Integer.parseInt(portStr);
        } catch (NumberFormatException e) {
            return error("invalid master port");
        }
        if (port < 1 || port > 65535) {
            return error("invalid master port");
        }

        replicationManager.slaveOf(host, port);
        return SimpleString.OK;
    }
}
