package com.layercache.backend;

import com.layercache.core.AbstractCache;
import com.layercache.core.CacheObject;
import com.layercache.core.CacheOptions;
import com.layercache.core.ReturnType;
import com.layercache.core.Update;
import com.layercache.core.UpdateResult;
import com.layercache.exception.CacheException;
import com.layercache.transaction.TransactionManager;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 基于 {@link ConcurrentMap} 的单层缓存
 * <p>
 * 读改写操作通过 putIfAbsent / replace / remove(key, old) 的 CAS 循环实现原子性，
 * Caffeine 的 asMap 视图和 Redisson 的 RMap 都提供这组原子操作。
 * 竞争时回调函数可能被调用多次，回调应无副作用。
 */
public abstract class MapBackedCache extends AbstractCache {

    protected MapBackedCache(String name, TransactionManager transactionManager) {
        super(name, transactionManager);
    }

    /**
     * 底层存储
     */
    protected abstract ConcurrentMap<Object, CacheObject> store();

    protected CacheObject lookup(Object key) {
        return store().get(key);
    }

    protected void write(Object key, CacheObject object) {
        store().put(key, object);
    }

    protected CacheObject remove(Object key) {
        return store().remove(key);
    }

    @Override
    public Object get(Object key, CacheOptions opts) {
        return opts.select(lookup(key));
    }

    @Override
    public Object set(Object key, Object value, CacheOptions opts) {
        if (!opts.hasVersion()) {
            CacheObject object = CacheObject.create(key, value);
            write(key, object);
            return opts.select(object);
        }
        while (true) {
            CacheObject current = lookup(key);
            checkVersion(current, opts);
            CacheObject object = CacheObject.create(key, value);
            if (compareAndSet(key, current, object)) {
                return opts.select(object);
            }
        }
    }

    @Override
    public Object delete(Object key, CacheOptions opts) {
        CacheObject removed;
        if (opts.hasVersion()) {
            removed = removeChecked(key, opts);
        } else {
            removed = remove(key);
        }
        return opts.getReturnType() == ReturnType.OBJECT ? removed : key;
    }

    @Override
    public boolean hasKey(Object key) {
        return store().containsKey(key);
    }

    @Override
    public long size() {
        return store().size();
    }

    @Override
    public void flush() {
        store().clear();
    }

    @Override
    public Set<Object> keys() {
        return new HashSet<>(store().keySet());
    }

    @Override
    public <A> A reduce(A acc, BiFunction<A, CacheObject, A> fn) {
        A result = acc;
        for (CacheObject object : store().values()) {
            result = fn.apply(result, object);
        }
        return result;
    }

    @Override
    public long updateCounter(Object key, long amount, CacheOptions opts) {
        while (true) {
            CacheObject current = lookup(key);
            checkVersion(current, opts);
            long base = current == null ? 0L : toCounter(current);
            long next = base + amount;
            if (compareAndSet(key, current, CacheObject.create(key, next))) {
                return next;
            }
        }
    }

    @Override
    public Object pop(Object key, CacheOptions opts) {
        return opts.select(removeChecked(key, opts));
    }

    @Override
    public UpdateResult getAndUpdate(Object key, Function<Object, Update> fn, CacheOptions opts) {
        while (true) {
            CacheObject current = lookup(key);
            checkVersion(current, opts);
            Object currentValue = current == null ? null : current.value();
            Update update = fn.apply(currentValue);

            if (update.isPop()) {
                if (current == null || store().remove(key, current)) {
                    return new UpdateResult(currentValue, null);
                }
                continue;
            }
            CacheObject object = CacheObject.create(key, update.getNewValue());
            if (compareAndSet(key, current, object)) {
                return new UpdateResult(update.getRetained(), opts.select(object));
            }
        }
    }

    @Override
    public Object update(Object key, Object initial, UnaryOperator<Object> fn, CacheOptions opts) {
        while (true) {
            CacheObject current = lookup(key);
            checkVersion(current, opts);
            Object value = current == null ? initial : fn.apply(current.value());
            CacheObject object = CacheObject.create(key, value);
            if (compareAndSet(key, current, object)) {
                return opts.select(object);
            }
        }
    }

    private CacheObject removeChecked(Object key, CacheOptions opts) {
        while (true) {
            CacheObject current = lookup(key);
            if (current == null) {
                return null;
            }
            checkVersion(current, opts);
            if (store().remove(key, current)) {
                return current;
            }
        }
    }

    private boolean compareAndSet(Object key, CacheObject expected, CacheObject object) {
        if (expected == null) {
            return store().putIfAbsent(key, object) == null;
        }
        return store().replace(key, expected, object);
    }

    private static long toCounter(CacheObject current) {
        Object value = current.value();
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new CacheException("value of key " + current.key() + " is not a counter: "
            + value.getClass().getName());
    }
}
