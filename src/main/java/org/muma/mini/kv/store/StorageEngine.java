package org.muma.mini.kv.store;

/**
 * 存储引擎
 * <p>
 * 同一个 key 上的所有读写（包括惰性过期删除）互斥执行；
 * 原始 Map 不对外暴露。
 */
public interface StorageEngine {

    /** 没有过期时间 */
    long NO_EXPIRE = -1;

    /**
     * 读取 key，返回值的副本。已过期的 key 会在同一个临界区内被删除并返回 null。
     */
    byte[] get(String key);

    /**
     * 整体覆盖写入，存入 value 的副本。
     *
     * @param expireAt 绝对过期时间戳 (ms)，{@link #NO_EXPIRE} 表示不过期，同时清除旧的 TTL
     */
    void set(String key, byte[] value, long expireAt);

    boolean remove(String key);

    /**
     * 当前记录的过期时间戳，不存在或未设置 TTL 时返回 {@link #NO_EXPIRE}。
     * 不触发惰性删除。
     */
    long getExpireAt(String key);

    int size();

    // 清空数据
    void flush();

    /**
     * 主动过期：抽样检查一批带 TTL 的 key，删除其中已过期的
     *
     * @return 本轮删除的 key 数量
     */
    int activeExpireCycle(int sampleSize);

    /**
     * 存储引擎使用的时钟 (ms)，命令计算过期时间时必须用同一个时钟
     */
    long currentTimeMillis();
}
