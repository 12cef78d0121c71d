package com.layercache.core;

import com.layercache.exception.KeyNotFoundException;
import com.layercache.exception.VersionConflictException;
import com.layercache.transaction.TransactionContext;
import com.layercache.transaction.TransactionManager;
import com.layercache.transaction.TransactionOptions;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 缓存公共实现：getRequired、toMap、事务
 */
public abstract class AbstractCache implements Cache {

    protected final String name;
    protected final TransactionManager transactionManager;

    protected AbstractCache(String name, TransactionManager transactionManager) {
        this.name = name;
        this.transactionManager = transactionManager;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Object getRequired(Object key, CacheOptions opts) {
        CacheObject object = (CacheObject) get(key, opts.toBuilder().returnType(ReturnType.OBJECT).build());
        if (object == null) {
            throw new KeyNotFoundException(key);
        }
        return opts.select(object);
    }

    @Override
    public Map<Object, Object> toMap(CacheOptions opts) {
        return reduce(new HashMap<>(), (acc, object) -> {
            acc.put(object.key(), opts.getReturnType() == ReturnType.OBJECT ? object : object.value());
            return acc;
        });
    }

    @Override
    public <T> T transaction(TransactionOptions opts, Function<TransactionContext, T> body) {
        return transactionManager.execute(opts, body);
    }

    @Override
    public boolean inTransaction(TransactionContext context) {
        return transactionManager.inTransaction(context);
    }

    public TransactionManager getTransactionManager() {
        return transactionManager;
    }

    /**
     * 目标版本与当前对象不一致时抛出版本冲突；Key 不存在时无冲突
     */
    protected static void checkVersion(CacheObject current, CacheOptions opts) {
        if (opts.hasVersion() && current != null && current.version() != opts.getVersion()) {
            throw new VersionConflictException(current.key(), opts.getVersion(), current.version());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + '}';
    }
}
