package com.layercache.fallback;

import com.layercache.core.CacheOptions;
import com.layercache.exception.CacheConfigurationException;
import com.layercache.exception.CacheException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.BeanFactory;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * 回源解析器单元测试
 */
@ExtendWith(MockitoExtension.class)
class FallbackResolverTest {

    @Mock
    private BeanFactory beanFactory;

    static class ProductLoader {

        Object load(Object key) {
            return "product:" + key;
        }

        Object fail(Object key) {
            throw new IllegalStateException("db unavailable");
        }

        Object failChecked(Object key) throws IOException {
            throw new IOException("connection reset");
        }

        Object failError(Object key) {
            throw new StackOverflowError("too deep");
        }
    }

    static class StaticLoaders {

        static Object triple(Object key) {
            return (Integer) key * 3;
        }
    }

    @Test
    @DisplayName("未配置回源 - 返回 empty")
    void testNone() {
        FallbackResolver resolver = FallbackResolver.none();

        assertFalse(resolver.isConfigured(CacheOptions.defaults()));
        assertEquals(Optional.empty(), resolver.load(1, CacheOptions.defaults()));
    }

    @Test
    @DisplayName("调用时传入的回源优先于默认回源")
    void testExplicitOverridesDefault() {
        FallbackResolver resolver = new FallbackResolver(key -> "default");

        assertEquals(Optional.of("default"), resolver.load(1, CacheOptions.defaults()));
        assertEquals(Optional.of("explicit"),
            resolver.load(1, CacheOptions.withFallback(key -> "explicit")));
    }

    @Test
    @DisplayName("回源返回 null - 视为未命中")
    void testNullResult() {
        FallbackResolver resolver = new FallbackResolver(key -> null);

        assertTrue(resolver.isConfigured(CacheOptions.defaults()));
        assertTrue(resolver.load(1, CacheOptions.defaults()).isEmpty());
    }

    @Test
    @DisplayName("方法引用 - 实例方法与静态方法")
    void testReference() {
        assertEquals("product:7", Fallback.reference(new ProductLoader(), "load").apply(7));
        assertEquals(21, Fallback.reference(StaticLoaders.class, "triple").apply(7));
    }

    @Test
    @DisplayName("方法引用 - 方法不存在时抛出配置异常")
    void testReference_missingMethod() {
        Fallback fallback = Fallback.reference(new ProductLoader(), "missing");

        assertThrows(CacheConfigurationException.class, () -> fallback.apply(1));
    }

    @Test
    @DisplayName("方法引用 - 目标方法的异常原样抛出")
    void testReference_propagatesException() {
        Fallback fallback = Fallback.reference(new ProductLoader(), "fail");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> fallback.apply(1));
        assertEquals("db unavailable", e.getMessage());
    }

    @Test
    @DisplayName("方法引用 - 目标方法的 Error 原样抛出")
    void testReference_propagatesError() {
        Fallback fallback = Fallback.reference(new ProductLoader(), "failError");

        StackOverflowError e = assertThrows(StackOverflowError.class, () -> fallback.apply(1));
        assertEquals("too deep", e.getMessage());
    }

    @Test
    @DisplayName("方法引用 - 受检异常包装为 CacheException 并保留原因")
    void testReference_wrapsCheckedException() {
        Fallback fallback = Fallback.reference(new ProductLoader(), "failChecked");

        CacheException e = assertThrows(CacheException.class, () -> fallback.apply(1));
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals("connection reset", e.getCause().getMessage());
    }

    @Test
    @DisplayName("Bean 引用 - 调用时从容器查找")
    void testFromReference_bean() {
        when(beanFactory.containsBean("productLoader")).thenReturn(true);
        when(beanFactory.getBean("productLoader")).thenReturn(new ProductLoader());

        Fallback fallback = FallbackResolver.fromReference("productLoader#load", beanFactory);

        verifyNoInteractions(beanFactory);
        assertEquals("product:1", fallback.apply(1));
    }

    @Test
    @DisplayName("类名引用 - 调用静态方法")
    void testFromReference_className() {
        Fallback fallback = FallbackResolver.fromReference(StaticLoaders.class.getName() + "#triple", beanFactory);

        assertEquals(6, fallback.apply(2));
    }

    @Test
    @DisplayName("非法引用格式 - 抛出配置异常")
    void testFromReference_invalid() {
        assertThrows(CacheConfigurationException.class,
            () -> FallbackResolver.fromReference("productLoader", beanFactory));
        assertThrows(CacheConfigurationException.class,
            () -> FallbackResolver.fromReference("#load", beanFactory));
    }

    @Test
    @DisplayName("引用目标不存在 - 回源时抛出配置异常")
    void testFromReference_unknownTarget() {
        Fallback fallback = FallbackResolver.fromReference("noSuchBean#load", beanFactory);

        assertThrows(CacheConfigurationException.class, () -> fallback.apply(1));
    }
}
