package com.layercache.backend;

import com.layercache.core.CacheObject;
import com.layercache.core.CacheOptions;
import com.layercache.core.ReturnType;
import com.layercache.core.Update;
import com.layercache.core.UpdateResult;
import com.layercache.exception.CacheException;
import com.layercache.exception.VersionConflictException;
import com.layercache.fallback.Fallback;
import com.layercache.support.TestCaches;
import com.layercache.transaction.TransactionLockTable;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 本地缓存层单元测试
 */
class LocalCacheTest {

    private LocalCache cache;

    @BeforeEach
    void setUp() {
        cache = TestCaches.local("local", new TransactionLockTable(), new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("缓存写入和读取")
    void testSetAndGet() {
        assertEquals("value", cache.set("key", "value"));
        assertEquals("value", cache.get("key"));
    }

    @Test
    @DisplayName("缓存未命中返回 null")
    void testGetMiss() {
        assertNull(cache.get("non_existent_key"));
        assertFalse(cache.hasKey("non_existent_key"));
    }

    @Test
    @DisplayName("单层缓存忽略回源与层级选项")
    void testGet_ignoresFallbackAndLevel() {
        Fallback fallback = key -> "loaded";

        assertNull(cache.get("key", CacheOptions.withFallback(fallback)));
        assertFalse(cache.hasKey("key"));

        cache.set("key", "value", CacheOptions.atLevel(3));
        assertEquals("value", cache.get("key"));
    }

    @Test
    @DisplayName("每次写入生成更大的版本号")
    void testSet_versionIncreases() {
        CacheObject first = (CacheObject) cache.set("key", "v1", CacheOptions.returning(ReturnType.OBJECT));
        CacheObject second = (CacheObject) cache.set("key", "v2", CacheOptions.returning(ReturnType.OBJECT));

        assertTrue(second.version() > first.version());
        assertEquals(second, cache.get("key", CacheOptions.returning(ReturnType.OBJECT)));
    }

    @Test
    @DisplayName("版本号匹配时写入，不匹配时拒绝")
    void testSet_withVersion() {
        CacheObject current = (CacheObject) cache.set("key", "v1", CacheOptions.returning(ReturnType.OBJECT));

        assertThrows(VersionConflictException.class,
            () -> cache.set("key", "v2", CacheOptions.withVersion(current.version() + 1)));
        assertEquals("v1", cache.get("key"));

        cache.set("key", "v2", CacheOptions.withVersion(current.version()));
        assertEquals("v2", cache.get("key"));
    }

    @Test
    @DisplayName("Key 不存在时版本校验通过")
    void testSet_withVersionOnAbsentKey() {
        assertEquals("v1", cache.set("key", "v1", CacheOptions.withVersion(123L)));
    }

    @Test
    @DisplayName("删除返回 Key 或被删除的对象")
    void testDelete() {
        cache.set("key", "value");

        CacheObject removed = (CacheObject) cache.delete("key", CacheOptions.returning(ReturnType.OBJECT));
        assertEquals("value", removed.value());
        assertFalse(cache.hasKey("key"));

        assertEquals("key", cache.delete("key"));
        assertNull(cache.delete("key", CacheOptions.returning(ReturnType.OBJECT)));
    }

    @Test
    @DisplayName("删除 - 版本冲突时保留")
    void testDelete_versionConflict() {
        cache.set("key", "value");

        assertThrows(VersionConflictException.class, () -> cache.delete("key", CacheOptions.withVersion(-1)));
        assertTrue(cache.hasKey("key"));
    }

    @Test
    @DisplayName("计数器 - 从 0 开始，值为 Long")
    void testUpdateCounter() {
        assertEquals(1L, cache.updateCounter("counter"));
        assertEquals(11L, cache.updateCounter("counter", 10));
        assertEquals(11L, cache.get("counter"));
    }

    @Test
    @DisplayName("计数器 - 非数值抛出异常")
    void testUpdateCounter_notNumber() {
        cache.set("key", "text");

        assertThrows(CacheException.class, () -> cache.updateCounter("key"));
        assertEquals("text", cache.get("key"));
    }

    @Test
    @DisplayName("pop - 读取后删除")
    void testPop() {
        cache.set("key", "value");

        assertEquals("value", cache.pop("key"));
        assertFalse(cache.hasKey("key"));
        assertNull(cache.pop("key"));
    }

    @Test
    @DisplayName("getAndUpdate - 返回保留值与新值")
    void testGetAndUpdate() {
        cache.set("key", 10);

        UpdateResult result = cache.getAndUpdate("key", v -> Update.of("old:" + v, (Integer) v + 1));

        assertEquals(new UpdateResult("old:10", 11), result);
        assertEquals(11, cache.get("key"));

        assertEquals(new UpdateResult(11, null), cache.getAndUpdate("key", v -> Update.pop()));
        assertFalse(cache.hasKey("key"));
    }

    @Test
    @DisplayName("update - Key 不存在时不调用函数")
    void testUpdate() {
        assertEquals("init", cache.update("key", "init", v -> {
            throw new AssertionError("must not be called for absent key");
        }));
        assertEquals("init!", cache.update("key", "init", v -> v + "!"));
    }

    @Test
    @DisplayName("size、keys、toMap 与 flush")
    void testBulkOperations() {
        cache.set("k1", 1);
        cache.set("k2", 2);
        cache.set("k3", 3);

        assertEquals(3, cache.size());
        assertEquals(Set.of("k1", "k2", "k3"), cache.keys());
        assertEquals(Map.of("k1", 1, "k2", 2, "k3", 3), cache.toMap());
        assertEquals(6, (int) cache.reduce(0, (acc, object) -> acc + (Integer) object.value()));

        cache.flush();

        assertEquals(0, cache.size());
        assertTrue(cache.keys().isEmpty());
    }

    @Test
    @DisplayName("命中率统计")
    void testHitRate() {
        cache.set("key", "value");

        cache.get("key");
        cache.get("key");
        cache.get("miss");

        double hitRate = cache.hitRate();
        assertTrue(hitRate > 0.6 && hitRate < 0.7);
    }
}
