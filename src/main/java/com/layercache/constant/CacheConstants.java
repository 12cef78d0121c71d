package com.layercache.constant;

import java.time.Duration;

/**
 * 缓存相关常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // ==================== 默认配置 ====================

    /** 默认多级缓存名称 */
    public static final String DEFAULT_CACHE_NAME = "layer-cache";

    /** 事务单次锁等待超时 */
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(1);

    /** 事务锁获取次数（不限） */
    public static final int INFINITE_RETRIES = Integer.MAX_VALUE;

    /** 回源引用分隔符：beanName#methodName */
    public static final String FALLBACK_REFERENCE_SEPARATOR = "#";

    // ==================== 监控指标 ====================

    public static final String METRIC_HITS = "layer.cache.hits";
    public static final String METRIC_MISSES = "layer.cache.misses";
    public static final String METRIC_BACKFILLS = "layer.cache.backfills";
    public static final String METRIC_RELOCATIONS = "layer.cache.relocations";
    public static final String METRIC_FALLBACK_LOADS = "layer.cache.fallback.loads";

    public static final String METRIC_TX_ACQUIRE = "layer.cache.transaction.acquire";
    public static final String METRIC_TX_RETRIES = "layer.cache.transaction.retries";
    public static final String METRIC_TX_ABORTS = "layer.cache.transaction.aborts";
    public static final String METRIC_TX_ACTIVE = "layer.cache.transaction.active";

    public static final String TAG_CACHE = "cache";
    public static final String TAG_LEVEL = "level";
}
