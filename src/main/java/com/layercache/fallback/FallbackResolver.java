package com.layercache.fallback;

import com.layercache.constant.CacheConstants;
import com.layercache.core.CacheOptions;
import com.layercache.exception.CacheConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 回源解析器
 * <p>
 * 优先使用调用方在选项中传入的回源函数，其次使用注册的默认回源。
 * 结果只写入第 1 层，且回源返回 null 时不写入。
 */
@Slf4j
public class FallbackResolver {

    /** 回源结果写入的层级 */
    public static final int POPULATE_LEVEL = 1;

    private static final FallbackResolver NONE = new FallbackResolver(null);

    private final Fallback defaultFallback;

    public FallbackResolver(Fallback defaultFallback) {
        this.defaultFallback = defaultFallback;
    }

    public static FallbackResolver none() {
        return NONE;
    }

    /**
     * 解析 beanName#methodName 形式的引用；beanName 不是容器中的 Bean 时按类名解析静态方法
     * <p>
     * 目标在每次回源时才查找，因此引用可以指向启动后才注册的 Bean。
     */
    public static Fallback fromReference(String reference, BeanFactory beanFactory) {
        String[] parts = StringUtils.split(reference, CacheConstants.FALLBACK_REFERENCE_SEPARATOR);
        if (parts == null || !StringUtils.hasText(parts[0]) || !StringUtils.hasText(parts[1])) {
            throw new CacheConfigurationException(
                "invalid fallback reference '" + reference + "', expected beanName#methodName");
        }
        String targetName = parts[0].trim();
        String methodName = parts[1].trim();
        return new MethodReferenceFallback(() -> lookupTarget(targetName, beanFactory), methodName);
    }

    public boolean isConfigured(CacheOptions opts) {
        return opts.getFallback() != null || defaultFallback != null;
    }

    /**
     * 执行回源，未配置回源或回源返回 null 时返回 empty
     */
    public Optional<Object> load(Object key, CacheOptions opts) {
        Fallback fallback = opts.getFallback() != null ? opts.getFallback() : defaultFallback;
        if (fallback == null) {
            return Optional.empty();
        }
        Object value = fallback.apply(key);
        log.debug("Fallback loaded: key={}, found={}", key, value != null);
        return Optional.ofNullable(value);
    }

    public Fallback getDefaultFallback() {
        return defaultFallback;
    }

    private static Object lookupTarget(String targetName, BeanFactory beanFactory) {
        if (beanFactory != null && beanFactory.containsBean(targetName)) {
            return beanFactory.getBean(targetName);
        }
        try {
            return ClassUtils.forName(targetName, FallbackResolver.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new CacheConfigurationException("fallback target '" + targetName + "' not found", e);
        }
    }
}
