package org.muma.mini.kv.command;

import org.muma.mini.kv.command.impl.server.EchoCommand;
import org.muma.mini.kv.command.impl.server.InfoCommand;
import org.muma.mini.kv.command.impl.server.PingCommand;
import org.muma.mini.kv.command.impl.server.SlaveOfCommand;
import org.muma.mini.kv.command.impl.string.GetCommand;
import org.muma.mini.kv.command.impl.string.SetCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.replication.ReplicationManager;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令分发器
 * <p>
 * 命令名统一转小写后查表；命令内部抛出的任何异常都在这里转换成错误回复，连接不受影响。
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final String INVALID_COMMAND = "Error: Invalid command";
    public static final String COMMAND_FAILED = "Error: command failed";

    private static final long SLOW_COMMAND_MS = 10;

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final StorageEngine storage;
    private final ReplicationManager replicationManager;

    public CommandDispatcher(StorageEngine storage, ReplicationManager replicationManager) {
        this.storage = storage;
        this.replicationManager = replicationManager;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表
     */
    private void initCommandRegistry() {
        registerServerCommands();
        registerStringCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerServerCommands() {
        register("ping", new PingCommand());
        register("echo", new EchoCommand());
        register("info", new InfoCommand(replicationManager));
        register("slaveof", new SlaveOfCommand(replicationManager));
    }

    private void registerStringCommands() {
        register("set", new SetCommand());
        register("get", new GetCommand());
    }

    void register(String name, RedisCommand command) {
        commandMap.put(name.toLowerCase(Locale.ROOT), command);
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(RedisArray args) {
        // 1. 帧里至少要有一个非空的命令名
        if (args.size() == 0 || !(args.elements()[0] instanceof BulkString name) || name.isNull()) {
            return new ErrorMessage(RespDecoder.INCOMPLETE_COMMAND);
        }

        // 2. 查找命令
        String commandName = name.asString().toLowerCase(Locale.ROOT);
        RedisCommand command = commandMap.get(commandName);
        if (command == null) {
            log.debug("Command not found: {}", commandName);
            return new ErrorMessage(INVALID_COMMAND);
        }

        // 3. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(storage, args);

            // 写命令成功后推进复制偏移量，失败的写不计数
            if (command.isWrite() && !(response instanceof ErrorMessage)) {
                replicationManager.propagate(args);
            }

            long duration = (System.nanoTime() - startTime) / 1_000_000; // ms
            if (duration > SLOW_COMMAND_MS) {
                log.warn("Slow command detected: {} cost {}ms", commandName, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", commandName, duration);
            }

            return response;

        } catch (Exception e) {
            // 意料之外的系统错误 (如 NPE)
            log.error("Internal error processing command: {}", commandName, e);
            return new ErrorMessage(COMMAND_FAILED);
        }
    }
}
