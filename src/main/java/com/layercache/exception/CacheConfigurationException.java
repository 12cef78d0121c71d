package com.layercache.exception;

/**
 * 缓存配置异常
 * 层级列表为空、层级序号越界、回源引用无法解析时抛出，不做重试
 */
public class CacheConfigurationException extends CacheException {

    public CacheConfigurationException(String message) {
        super(message);
    }

    public CacheConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static CacheConfigurationException unknownLevel(int level, int levelCount) {
        return new CacheConfigurationException(
            "level " + level + " is out of range, expected 1.." + levelCount);
    }
}
