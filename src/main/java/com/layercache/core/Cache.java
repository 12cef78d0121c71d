package com.layercache.core;

import com.layercache.transaction.TransactionContext;
import com.layercache.transaction.TransactionOptions;

import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 统一缓存契约
 * <p>
 * 本地缓存、分布式缓存和多级缓存都实现此接口，
 * 因此多级缓存可以作为另一个多级缓存的某一层。
 * 所有操作都接受 {@link CacheOptions}，其中 returnType 决定返回裸值、Key 还是完整对象。
 */
public interface Cache {

    String name();

    /**
     * 读取缓存，未命中返回 null
     */
    Object get(Object key, CacheOptions opts);

    /**
     * 读取缓存，未命中抛出 {@link com.layercache.exception.KeyNotFoundException}
     */
    Object getRequired(Object key, CacheOptions opts);

    /**
     * 写入缓存，value 为 null 时写入显式空值
     */
    Object set(Object key, Object value, CacheOptions opts);

    /**
     * 删除缓存，返回 Key（returnType 为 OBJECT 时返回被删除的对象）
     */
    Object delete(Object key, CacheOptions opts);

    boolean hasKey(Object key);

    long size();

    void flush();

    Set<Object> keys();

    <A> A reduce(A acc, BiFunction<A, CacheObject, A> fn);

    Map<Object, Object> toMap(CacheOptions opts);

    long updateCounter(Object key, long amount, CacheOptions opts);

    /**
     * 读取后删除
     */
    Object pop(Object key, CacheOptions opts);

    UpdateResult getAndUpdate(Object key, Function<Object, Update> fn, CacheOptions opts);

    /**
     * Key 存在时写入 fn(当前值)，不存在时直接写入 initial
     */
    Object update(Object key, Object initial, UnaryOperator<Object> fn, CacheOptions opts);

    <T> T transaction(TransactionOptions opts, Function<TransactionContext, T> body);

    boolean inTransaction(TransactionContext context);

    // ==================== 默认选项重载 ====================

    default Object get(Object key) {
        return get(key, CacheOptions.defaults());
    }

    default Object getRequired(Object key) {
        return getRequired(key, CacheOptions.defaults());
    }

    default Object set(Object key, Object value) {
        return set(key, value, CacheOptions.defaults());
    }

    default Object delete(Object key) {
        return delete(key, CacheOptions.defaults());
    }

    default Map<Object, Object> toMap() {
        return toMap(CacheOptions.defaults());
    }

    default long updateCounter(Object key) {
        return updateCounter(key, 1, CacheOptions.defaults());
    }

    default long updateCounter(Object key, long amount) {
        return updateCounter(key, amount, CacheOptions.defaults());
    }

    default Object pop(Object key) {
        return pop(key, CacheOptions.defaults());
    }

    default UpdateResult getAndUpdate(Object key, Function<Object, Update> fn) {
        return getAndUpdate(key, fn, CacheOptions.defaults());
    }

    default Object update(Object key, Object initial, UnaryOperator<Object> fn) {
        return update(key, initial, fn, CacheOptions.defaults());
    }

    default <T> T transaction(Function<TransactionContext, T> body) {
        return transaction(TransactionOptions.defaults(), body);
    }
}
