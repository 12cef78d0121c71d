package com.layercache.backend;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.layercache.core.CacheObject;
import com.layercache.transaction.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentMap;

/**
 * 本地缓存层
 * 基于 Caffeine 实现，容量与过期策略由 Caffeine 配置决定（W-TinyLFU）
 */
public class LocalCache extends MapBackedCache {

    private static final Logger log = LoggerFactory.getLogger(LocalCache.class);

    private final Cache<Object, CacheObject> cache;

    public LocalCache(String name, Cache<Object, CacheObject> cache, TransactionManager transactionManager) {
        super(name, transactionManager);
        this.cache = cache;
    }

    @Override
    protected ConcurrentMap<Object, CacheObject> store() {
        return cache.asMap();
    }

    /**
     * 走 getIfPresent 以便记录命中率统计
     */
    @Override
    protected CacheObject lookup(Object key) {
        return cache.getIfPresent(key);
    }

    @Override
    protected void write(Object key, CacheObject object) {
        cache.put(key, object);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void flush() {
        cache.invalidateAll();
        log.info("Local cache flushed: {}", name);
    }

    public CacheStats stats() {
        return cache.stats();
    }

    /**
     * 获取命中率
     */
    public double hitRate() {
        return cache.stats().hitRate();
    }

    public Cache<Object, CacheObject> getNativeCache() {
        return cache;
    }
}
