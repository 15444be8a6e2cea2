package org.muma.mini.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;

/**
 * 全局配置中心
 * 优先级: 命令行参数 > 环境变量 > 配置文件 (mini-kv.properties) > 默认值
 */
@Getter
@Setter
public class MiniKvConfig {

    private static final Logger log = LoggerFactory.getLogger(MiniKvConfig.class);
    private static final MiniKvConfig INSTANCE = new MiniKvConfig();

    public static final String DEFAULT_CONFIG_FILE = "mini-kv.properties";

    // --- Core Settings ---
    private String bind = "0.0.0.0";
    private int port = 6379;
    private int workerThreads = 0; // 0 = Netty default

    // --- Protocol ---
    private int maxBulkLength = RespDecoder.DEFAULT_MAX_BULK_LENGTH;

    // --- Store ---
    private int lockStripes = MemoryStorageEngine.DEFAULT_LOCK_STRIPES;

    // --- Active Expire (默认关闭，只做惰性删除) ---
    private boolean activeExpireEnabled = false;
    private int activeExpireIntervalMs = 100;
    private int activeExpireSampleSize = 20;

    // --- Replication ---
    private String slaveOfHost = null;
    private int slaveOfPort = -1;

    private String configFilePath = DEFAULT_CONFIG_FILE;

    public MiniKvConfig() {
    }

    public static MiniKvConfig getInstance() {
        return INSTANCE;
    }

    // --- Loading Logic ---

    /**
     * 按优先级加载：配置文件 -> 环境变量 -> 命令行参数
     */
    public void load(String[] args) {
        this.configFilePath = findConfigPath(args);
        loadConfig(configFilePath);
        applyEnvOverrides(System.getenv());
        parseArgs(args);
        log.info("MiniKvConfig initialized: {}", this);
    }

    private String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return configFilePath;
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) && i + 1 < args.length) {
                this.configFilePath = args[++i];
            } else if ("--port".equals(arg) && i + 1 < args.length) {
                this.port = parseInt("--port", args[++i], this.port);
            } else if ("--bind".equals(arg) && i + 1 < args.length) {
                this.bind = args[++i];
            } else if ("--slaveof".equals(arg) && i + 2 < args.length) {
                applySlaveOf(args[++i] + " " + args[++i]);
            } else if ("--active-expire".equals(arg)) {
                this.activeExpireEnabled = true;
            } else {
                log.warn("Ignoring unknown argument: {}", arg);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        // 1. Core
        this.bind = getString(props, "server.bind", this.bind);
        this.port = getInt(props, "server.port", this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);

        // 2. Protocol & Store
        this.maxBulkLength = getPositiveInt(props, "proto-max-bulk-len", this.maxBulkLength);
        int stripes = getInt(props, "store.lock_stripes", this.lockStripes);
        if (stripes > 0 && Integer.bitCount(stripes) == 1) {
            this.lockStripes = stripes;
        } else {
            log.warn("store.lock_stripes must be a power of two, got {}, using {}.", stripes, this.lockStripes);
        }

        // 3. Active Expire
        this.activeExpireEnabled = getBoolean(props, "active-expire.enabled", this.activeExpireEnabled);
        this.activeExpireIntervalMs = getPositiveInt(props, "active-expire.interval-ms", this.activeExpireIntervalMs);
        this.activeExpireSampleSize = getPositiveInt(props, "active-expire.sample-size", this.activeExpireSampleSize);

        // 4. SlaveOf，格式: slaveof <host> <port>
        String slaveof = getString(props, "slaveof", "");
        if (!slaveof.isEmpty()) {
            applySlaveOf(slaveof);
        }
    }

    public void applyEnvOverrides(Map<String, String> env) {
        String envPort = env.get("MINIKV_PORT");
        if (envPort != null) {
            this.port = parseInt("MINIKV_PORT", envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }

        String envBind = env.get("MINIKV_BIND");
        if (envBind != null) {
            this.bind = envBind;
            log.info("Bind address overridden by ENV: {}", this.bind);
        }
    }

    private void applySlaveOf(String value) {
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            log.warn("Invalid slaveof config format: {}", value);
            return;
        }
        int masterPort = parseInt("slaveof port", parts[1], -1);
        if (masterPort < 1 || masterPort > 65535) {
            log.warn("Invalid slaveof port: {}", parts[1]);
            return;
        }
        this.slaveOfHost = parts[0];
        this.slaveOfPort = masterPort;
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            // 如果是 classpath 资源
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
                return props;
            }
        } catch (IOException e) {
            log.error("Error loading config from classpath: {}", path, e);
        }

        // 尝试作为文件系统路径加载
        try (InputStream fis = new FileInputStream(path)) {
            props.load(fis);
            log.info("Loaded config from file: {}", path);
        } catch (IOException e) {
            log.warn("Config file not found: {}, using defaults.", path);
        }
        return props;
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        return val != null ? parseInt(key, val, defaultValue) : defaultValue;
    }

    // 0 或负数会让调度器/解码器在启动时直接抛异常，这里统一回退默认值
    private int getPositiveInt(Properties props, String key, int defaultValue) {
        int value = getInt(props, key, defaultValue);
        if (value <= 0) {
            log.warn("{} must be positive, got {}, using default {}.", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private boolean getBoolean(Properties props, String key, boolean defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        String v = val.trim();
        if ("yes".equalsIgnoreCase(v) || "true".equalsIgnoreCase(v)) return true;
        if ("no".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) return false;
        log.warn("Invalid {} value '{}', using default {}.", key, val, defaultValue);
        return defaultValue;
    }

    private String getString(Properties props, String key, String defaultValue) {
        return props.getProperty(key, defaultValue).trim();
    }

    private int parseInt(String key, String value, int defaultValue) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using default {}.", key, value, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{bind=" + bind + ", port=" + port + ", activeExpire=" + activeExpireEnabled
                + ", slaveof=" + (slaveOfHost == null ? "none" : slaveOfHost + ":" + slaveOfPort) + "}";
    }
}
