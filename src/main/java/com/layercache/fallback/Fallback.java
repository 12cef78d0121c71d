package com.layercache.fallback;

import java.util.function.Function;

/**
 * 回源函数：全部层级未命中时根据 Key 计算值
 * <p>
 * 返回 null 视为未命中，结果不会写入缓存；抛出的非受检异常原样传递给调用方，
 * 方法引用的目标抛出受检异常时包装为 {@link com.layercache.exception.CacheException}。
 */
@FunctionalInterface
public interface Fallback {

    Object apply(Object key);

    static Fallback of(Function<Object, ?> function) {
        return function::apply;
    }

    /**
     * 按方法名引用回源函数，调用时才解析方法
     *
     * @param target 目标对象，传入 Class 时调用其静态方法
     */
    static Fallback reference(Object target, String methodName) {
        return new MethodReferenceFallback(() -> target, methodName);
    }
}
