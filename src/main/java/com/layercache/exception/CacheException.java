package com.layercache.exception;

/**
 * 缓存异常基类
 * 所有缓存层抛出的业务异常均继承自此类
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
