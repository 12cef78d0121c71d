package com.layercache.core;

import com.layercache.fallback.Fallback;
import lombok.Builder;
import lombok.Value;

/**
 * 单次缓存操作选项
 * <ul>
 *   <li>returnType - 返回裸值、Key 还是完整对象</li>
 *   <li>level - 仅作用于指定层级（1..N），为空表示全部层级</li>
 *   <li>version - 乐观并发控制的目标版本号</li>
 *   <li>fallback - 全部未命中时的回源函数</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class CacheOptions {

    private static final CacheOptions DEFAULTS = CacheOptions.builder().build();

    @Builder.Default
    ReturnType returnType = ReturnType.VALUE;

    Integer level;

    Long version;

    Fallback fallback;

    public static CacheOptions defaults() {
        return DEFAULTS;
    }

    public static CacheOptions returning(ReturnType returnType) {
        return builder().returnType(returnType).build();
    }

    public static CacheOptions atLevel(int level) {
        return builder().level(level).build();
    }

    public static CacheOptions withVersion(long version) {
        return builder().version(version).build();
    }

    public static CacheOptions withFallback(Fallback fallback) {
        return builder().fallback(fallback).build();
    }

    public boolean hasLevel() {
        return level != null;
    }

    public boolean hasVersion() {
        return version != null;
    }

    public Object select(CacheObject object) {
        return returnType.select(object);
    }
}
