package com.layercache.backend;

import com.layercache.core.CacheObject;
import com.layercache.transaction.TransactionManager;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;

/**
 * 分布式缓存层
 * <p>
 * 生产环境基于 Redisson {@link RMap}（Redis Hash），节点选择与传输由 Redisson 负责；
 * 任意 {@link ConcurrentMap} 也可作为存储，便于单元测试。
 */
@Slf4j
public class DistributedCache extends MapBackedCache {

    private final ConcurrentMap<Object, CacheObject> store;

    public DistributedCache(String name, ConcurrentMap<Object, CacheObject> store,
                            TransactionManager transactionManager) {
        super(name, transactionManager);
        this.store = store;
    }

    /**
     * 基于 Redisson RMap 创建
     */
    public static DistributedCache redisson(String name, RedissonClient redissonClient, String mapName,
                                            Codec codec, TransactionManager transactionManager) {
        RMap<Object, CacheObject> map = redissonClient.getMap(mapName, codec);
        log.info("Distributed cache level created: name={}, map={}", name, mapName);
        return new DistributedCache(name, map, transactionManager);
    }

    @Override
    protected ConcurrentMap<Object, CacheObject> store() {
        return store;
    }

    /**
     * RMap 使用 fastPut，不回传旧值，减少一次反序列化
     */
    @Override
    protected void write(Object key, CacheObject object) {
        if (store instanceof RMap<Object, CacheObject> map) {
            map.fastPut(key, object);
        } else {
            store.put(key, object);
        }
    }

    @Override
    public Set<Object> keys() {
        if (store instanceof RMap<Object, CacheObject> map) {
            return new HashSet<>(map.readAllKeySet());
        }
        return super.keys();
    }

    @Override
    public void flush() {
        super.flush();
        log.info("Distributed cache flushed: {}", name);
    }
}
