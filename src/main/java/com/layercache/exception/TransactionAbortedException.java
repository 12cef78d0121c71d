package com.layercache.exception;

import lombok.Getter;

import java.util.List;

/**
 * 事务中止异常
 * 锁获取重试次数耗尽时抛出
 */
@Getter
public class TransactionAbortedException extends CacheException {

    private final transient List<Object> keys;
    private final int attempts;

    public TransactionAbortedException(List<Object> keys, int attempts) {
        super("transaction aborted");
        this.keys = keys;
        this.attempts = attempts;
    }

    public TransactionAbortedException(List<Object> keys, int attempts, Throwable cause) {
        super("transaction aborted", cause);
        this.keys = keys;
        this.attempts = attempts;
    }
}
