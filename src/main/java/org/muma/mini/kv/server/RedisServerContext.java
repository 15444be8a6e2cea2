package org.muma.mini.kv.server;

import lombok.Getter;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;
import org.muma.mini.kv.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 服务器上下文
 * 负责组装存储、复制状态和分发器，管理后台任务的生命周期。
 * 每个服务器实例一份，不使用全局单例。
 */
public class RedisServerContext {

    private static final Logger log = LoggerFactory.getLogger(RedisServerContext.class);

    @Getter
    private final MiniKvConfig config;
    @Getter
    private final StorageEngine storage;
    @Getter
    private final ReplicationManager replicationManager;
    @Getter
    private final CommandDispatcher dispatcher;

    // 当前连接数 (仅用于日志)
    @Getter
    private final AtomicInteger connectedClients = new AtomicInteger();

    private ScheduledExecutorService cleanupExecutor;

    public RedisServerContext(MiniKvConfig config) {
        this.config = config;

        // 1. Storage
        this.storage = new MemoryStorageEngine(Clock.systemUTC(), config.getLockStripes());

        // 2. Replication
        this.replicationManager = new ReplicationManager();

        // 3. Dispatcher
        this.dispatcher = new CommandDispatcher(storage, replicationManager);
    }

    /**
     * 初始化流程：恢复配置的复制角色 -> 启动后台任务
     */
    public void init() {
        // Step 1: 启动时配置了 slaveof，直接以 replica 身份运行
        if (config.getSlaveOfHost() != null) {
            replicationManager.slaveOf(config.getSlaveOfHost(), config.getSlaveOfPort());
        }

        // Step 2: 可选的主动过期任务
        if (config.isActiveExpireEnabled()) {
            cleanupExecutor = Executors.newSingleThreadScheduledExecutor(
                    ThreadUtils.namedDaemonFactory("mini-kv-active-expire"));
            int sampleSize = config.getActiveExpireSampleSize();
            cleanupExecutor.scheduleAtFixedRate(() -> storage.activeExpireCycle(sampleSize),
                    config.getActiveExpireIntervalMs(), config.getActiveExpireIntervalMs(), TimeUnit.MILLISECONDS);
            log.info("Active expire enabled: every {}ms, sample size {}", config.getActiveExpireIntervalMs(), sampleSize);
        }
    }

    public void shutdown() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
        }
        log.info("Server context shut down. keys in memory: {}", storage.size());
    }
}
