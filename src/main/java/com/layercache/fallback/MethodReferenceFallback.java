package com.layercache.fallback;

import com.layercache.exception.CacheConfigurationException;
import com.layercache.exception.CacheException;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.function.Supplier;

/**
 * (目标, 方法名) 形式的回源引用，每次调用时动态解析单参数方法
 */
final class MethodReferenceFallback implements Fallback {

    private final Supplier<Object> targetSupplier;
    private final String methodName;

    MethodReferenceFallback(Supplier<Object> targetSupplier, String methodName) {
        this.targetSupplier = targetSupplier;
        this.methodName = methodName;
    }

    @Override
    public Object apply(Object key) {
        Object target = targetSupplier.get();
        boolean isStatic = target instanceof Class<?>;
        Class<?> type = isStatic ? (Class<?>) target : target.getClass();
        Method method = findMethod(type, isStatic);

        ReflectionUtils.makeAccessible(method);
        try {
            return method.invoke(isStatic ? null : target, key);
        } catch (InvocationTargetException e) {
            // 非受检异常原样抛出，受检异常包装为 CacheException
            Throwable cause = e.getTargetException();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CacheException("fallback " + this + " failed", cause);
        } catch (IllegalAccessException e) {
            throw new CacheConfigurationException("fallback " + this + " is not accessible", e);
        }
    }

    private Method findMethod(Class<?> type, boolean isStatic) {
        Method[] candidates = ReflectionUtils.getUniqueDeclaredMethods(type, m ->
            m.getName().equals(methodName)
                && m.getParameterCount() == 1
                && Modifier.isStatic(m.getModifiers()) == isStatic);
        if (candidates.length == 0) {
            throw new CacheConfigurationException(
                "fallback method " + type.getName() + "#" + methodName + "/1 not found");
        }
        return candidates[0];
    }

    @Override
    public String toString() {
        return "MethodReferenceFallback{" + methodName + '}';
    }
}
