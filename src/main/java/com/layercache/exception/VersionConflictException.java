package com.layercache.exception;

import lombok.Getter;

/**
 * 版本冲突异常（乐观并发控制）
 * 调用方需重新读取后自行决定，不自动重试
 */
@Getter
public class VersionConflictException extends CacheException {

    private final transient Object key;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(Object key, long expectedVersion, long actualVersion) {
        super("version conflict on key " + key + ": expected " + expectedVersion
            + ", actual " + actualVersion);
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
