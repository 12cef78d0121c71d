package com.layercache.exception;

import lombok.Getter;

/**
 * Key 不存在异常（getRequired 未命中）
 */
@Getter
public class KeyNotFoundException extends CacheException {

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("key " + key + " not found");
        this.key = key;
    }
}
