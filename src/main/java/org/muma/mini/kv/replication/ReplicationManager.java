package org.muma.mini.kv.replication;

import lombok.Getter;
import org.muma.mini.kv.protocol.RedisArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 复制管理器 (Replication Manager)
 * <p>
 * 只维护角色与偏移量的记账：SLAVEOF 切换角色，写命令推进 offset，INFO 渲染当前状态。
 * 不会真的连接 Master，也不会向任何 Slave 传播命令流。
 */
public class ReplicationManager {

    private static final Logger log = LoggerFactory.getLogger(ReplicationManager.class);

    private static final String CRLF = "\r\n";

    @Getter
    private final ReplicationMetadata metadata;

    public ReplicationManager() {
        this(new ReplicationMetadata());
    }

    public ReplicationManager(ReplicationMetadata metadata) {
        this.metadata = metadata;
        log.info("Replication initialized. replid: {}", metadata.getReplId());
    }

    // =========================================================
    // 角色切换
    // =========================================================

    public void slaveOf(String host, int port) {
        metadata.setMaster(host, port);
        log.info("SLAVEOF {}:{} enabled, role: {}", host, port, ReplRole.REPLICA.infoName());
    }

    public void slaveOfNoOne() {
        metadata.clearMaster();
        log.info("SLAVEOF NO ONE, turned into a MASTER");
    }

    public ReplRole getRole() {
        return metadata.getRoleState().role();
    }

    // =========================================================
    // 命令传播 (目前只推进 offset)
    // =========================================================

    /**
     * 写命令执行成功后调用，offset 精确 +1
     */
    public long propagate(RedisArray command) {
        long offset = metadata.incrementOffset();
        if (log.isTraceEnabled()) {
            log.trace("Write command {} accepted, master_repl_offset={}", command.getString(0), offset);
        }
        return offset;
    }

    // =========================================================
    // INFO replication
    // =========================================================

    public String info() {
        ReplicationMetadata.RoleState state = metadata.getRoleState();

        StringBuilder sb = new StringBuilder();
        sb.append("role:").append(state.role().infoName()).append(CRLF);

        // replica 只输出 role 行，link 状态等字段未建模
        if (state.role() == ReplRole.REPLICA) {
            return sb.toString();
        }

        sb.append("connected_slaves:0").append(CRLF);
        sb.append("master_replid:").append(metadata.getReplId()).append(CRLF);
        sb.append("master_repl_offset:").append(metadata.getReplOffset()).append(CRLF);
        // backlog 相关字段暂未实现，固定值
        sb.append("second_repl_offset:-1").append(CRLF);
        sb.append("repl_backlog_active:0").append(CRLF);
        sb.append("repl_backlog_size:1048576").append(CRLF);
        sb.append("repl_backlog_first_byte_offset:0").append(CRLF);
        sb.append("repl_backlog_histlen:0").append(CRLF);
        return sb.toString();
    }
}
