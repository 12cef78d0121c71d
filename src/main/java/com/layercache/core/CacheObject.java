package com.layercache.core;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 缓存对象封装（key, value, version）
 * <p>
 * value 为 null 表示显式空值，与"未找到"（整个对象为 null）区分。
 * 每次写入都会生成新对象和新版本号，返回给调用方后只读。
 */
public record CacheObject(Object key, Object value, long version) {

    // 进程内单调递增的版本号，以微秒时间戳为下界
    private static final AtomicLong GENERATION = new AtomicLong();

    public CacheObject {
        Objects.requireNonNull(key, "key");
    }

    /**
     * 由存储层创建新对象并分配新版本号
     */
    public static CacheObject create(Object key, Object value) {
        return new CacheObject(key, value, nextVersion());
    }

    public static long nextVersion() {
        long floor = System.currentTimeMillis() * 1000;
        return GENERATION.updateAndGet(prev -> Math.max(prev + 1, floor));
    }

    public boolean hasValue() {
        return value != null;
    }
}
