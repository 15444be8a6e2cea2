package org.muma.mini.kv.replication;

import io.netty.buffer.ByteBufUtil;
import lombok.Getter;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 复制元数据
 * <p>
 * 角色和 Master 地址作为一个不可变快照整体替换，读方 (INFO) 不会看到只更新了一半的目标地址。
 * replId 进程内只生成一次，重启后会变化。
 */
public class ReplicationMetadata {

    private static final int REPL_ID_BYTES = 20; // hex 之后正好 40 个字符

    // 自身 ReplId (作为 Master 时对外展示)
    @Getter
    private final String replId;

    // 全局复制偏移量 (Master: 成功写入的命令数)
    private final AtomicLong replOffset = new AtomicLong(0);

    private final AtomicReference<RoleState> roleState = new AtomicReference<>(RoleState.MASTER);

    /**
     * 角色快照：role=REPLICA 当且仅当 masterHost/masterPort 都有值
     */
    public record RoleState(ReplRole role, String masterHost, int masterPort) {

        public static final RoleState MASTER = new RoleState(ReplRole.MASTER, null, -1);

        public static RoleState replicaOf(String host, int port) {
            return new RoleState(ReplRole.REPLICA, host, port);
        }
    }

    public ReplicationMetadata() {
        this(generateReplId(new SecureRandom()));
    }

    public ReplicationMetadata(String replId) {
        if (replId == null || !replId.matches("[0-9a-f]{40}")) {
            throw new IllegalArgumentException("replId must be 40 lowercase hex characters: " + replId);
        }
        this.replId = replId;
    }

    static String generateReplId(SecureRandom random) {
        byte[] bytes = new byte[REPL_ID_BYTES];
        random.nextBytes(bytes);
        return ByteBufUtil.hexDump(bytes);
    }

    public RoleState getRoleState() {
        return roleState.get();
    }

    public long getReplOffset() {
        return replOffset.get();
    }

    public long incrementOffset() {
        return replOffset.incrementAndGet();
    }

    public void setMaster(String host, int port) {
        roleState.set(RoleState.replicaOf(host, port));
    }

    public void clearMaster() {
        roleState.set(RoleState.MASTER);
    }
}
