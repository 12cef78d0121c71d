package com.layercache.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.layercache.core.CacheObject;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Caffeine 本地层级构建
 * 采用 W-TinyLFU 淘汰策略，每个本地层级一个独立实例
 */
@Component
public class CaffeineCacheFactory {

    private static final Logger log = LoggerFactory.getLogger(CaffeineCacheFactory.class);

    private final MeterRegistry meterRegistry;

    public CaffeineCacheFactory(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public Cache<Object, CacheObject> create(String levelName, LayerCacheProperties.LevelConfig config) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            // 初始容量，避免扩容开销
            .initialCapacity(config.getInitialCapacity())
            .maximumSize(config.getMaximumSize())
            .removalListener((key, value, cause) -> {
                if (cause == RemovalCause.SIZE) {
                    log.debug("Cache evicted due to size: level={}, key={}", levelName, key);
                } else if (cause == RemovalCause.EXPIRED) {
                    log.debug("Cache expired: level={}, key={}", levelName, key);
                }
            });

        if (config.getExpireAfterWrite() != null) {
            builder.expireAfterWrite(config.getExpireAfterWrite());
        }
        if (config.isRecordStats()) {
            builder.recordStats();
        }

        Cache<Object, CacheObject> cache = builder.build();

        // 注册 Micrometer 指标
        CaffeineCacheMetrics.monitor(meterRegistry, cache, levelName);

        log.info("Local cache level initialized: name={}, initialCapacity={}, maximumSize={}, expireAfterWrite={}",
            levelName, config.getInitialCapacity(), config.getMaximumSize(), config.getExpireAfterWrite());
        return cache;
    }
}
