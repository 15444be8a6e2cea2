package org.muma.mini.kv.store.impl;

import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    public static final int DEFAULT_LOCK_STRIPES = 64;

    // 1. 数据存储 (Key -> Value)
    private final Map<String, byte[]> memoryDb = new ConcurrentHashMap<>();

    // 2. 过期时间存储 (Key -> ExpireAt Timestamp)
    // 不变式：ttlMap 里的 key 一定也在 memoryDb 里
    private final Map<String, Long> ttlMap = new ConcurrentHashMap<>();

    // 3. 分段锁，同一个 key 永远落在同一把锁上
    private final Object[] locks;
    private final int mask;

    private final Clock clock;

    public MemoryStorageEngine() {
        this(Clock.systemUTC(), DEFAULT_LOCK_STRIPES);
    }

    public MemoryStorageEngine(Clock clock, int lockStripes) {
        if (lockStripes <= 0 || Integer.bitCount(lockStripes) != 1) {
            throw new IllegalArgumentException("lockStripes must be a positive power of two: " + lockStripes);
        }
        this.clock = clock;
        this.mask = lockStripes - 1;
        this.locks = new Object[lockStripes];
        for (int i = 0; i < lockStripes; i++) {
            locks[i] = new Object();
        }
    }

    private Object lockFor(String key) {
        int h = key.hashCode();
        return locks[(h ^ (h >>> 16)) & mask];
    }

    @Override
    public long currentTimeMillis() {
        return clock.millis();
    }

    @Override
    public byte[] get(String key) {
        synchronized (lockFor(key)) {
            byte[] value = memoryDb.get(key);
            if (value == null) {
                // 防御不变式被破坏的残留 TTL
                ttlMap.remove(key);
                return null;
            }

            // 惰性删除 (Lazy Expiration)：检查和删除在同一把锁内完成
            Long expireAt = ttlMap.get(key);
            if (expireAt != null && currentTimeMillis() >= expireAt) {
                memoryDb.remove(key);
                ttlMap.remove(key);
                log.debug("Lazy expired key: {}", key);
                return null;
            }
            return Arrays.copyOf(value, value.length);
        }
    }

    @Override
    public void set(String key, byte[] value, long expireAt) {
        synchronized (lockFor(key)) {
            memoryDb.put(key, Arrays.copyOf(value, value.length));
            // 有过期时间则记录；没有则移除 (可能由有过期变为无过期)
            if (expireAt != NO_EXPIRE) {
                ttlMap.put(key, expireAt);
            } else {
                ttlMap.remove(key);
            }
        }
    }

    @Override
    public boolean remove(String key) {
        synchronized (lockFor(key)) {
            ttlMap.remove(key); // 记得同步移除 TTL
            return memoryDb.remove(key) != null;
        }
    }

    @Override
    public long getExpireAt(String key) {
        synchronized (lockFor(key)) {
            Long expireAt = ttlMap.get(key);
            return expireAt == null ? NO_EXPIRE : expireAt;
        }
    }

    @Override
    public int size() {
        return memoryDb.size();
    }

    @Override
    public void flush() {
        // 逐个 key 加锁删除，避免和正在进行的 get/set 交错出半个状态
        for (String key : memoryDb.keySet()) {
            remove(key);
        }
    }

    /**
     * 定期删除策略 (简化版 Redis 算法)
     * 每次顺序抽取一部分带 TTL 的 Key 进行检查
     */
    @Override
    public int activeExpireCycle(int sampleSize) {
        if (ttlMap.isEmpty()) return 0;

        long now = currentTimeMillis();
        int expiredCount = 0;
        int loop = 0;

        // ConcurrentHashMap 的迭代器是弱一致性的，不会抛 CME
        Iterator<String> iterator = ttlMap.keySet().iterator();
        while (iterator.hasNext() && loop < sampleSize) {
            String key = iterator.next();
            loop++;
            synchronized (lockFor(key)) {
                // 迭代期间 key 可能被重新 SET，必须在锁内重新读取
                Long expireAt = ttlMap.get(key);
                if (expireAt != null && now >= expireAt) {
                    memoryDb.remove(key);
                    ttlMap.remove(key);
                    expiredCount++;
                }
            }
        }

        if (expiredCount > 0) {
            log.debug("Active cleanup: scanned {}, expired {}", loop, expiredCount);
        }
        return expiredCount;
    }
}
