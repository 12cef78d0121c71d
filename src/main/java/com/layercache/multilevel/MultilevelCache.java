package com.layercache.multilevel;

import com.layercache.constant.CacheConstants;
import com.layercache.core.AbstractCache;
import com.layercache.core.Cache;
import com.layercache.core.CacheObject;
import com.layercache.core.CacheOptions;
import com.layercache.core.ReturnType;
import com.layercache.core.Update;
import com.layercache.core.UpdateResult;
import com.layercache.exception.CacheConfigurationException;
import com.layercache.fallback.FallbackResolver;
import com.layercache.transaction.TransactionManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 多级缓存协调器
 * <p>
 * 将一次逻辑操作按层级顺序（1..N）下发到各层，层级本身也是完整的缓存，
 * 因此多级缓存可以嵌套作为另一个多级缓存的某一层。
 * <ul>
 *   <li>读：按顺序查找，返回第一个命中；INCLUSIVE 回填更浅的层级，EXCLUSIVE 迁移到第 1 层</li>
 *   <li>写：未指定层级时写入全部层级（EXCLUSIVE 只写一层并清理其他层）</li>
 *   <li>删：未指定层级时删除全部层级</li>
 * </ul>
 * 除各层自身外不持有可变状态，可被并发调用；跨层级不提供原子性，
 * 需要多步一致性时在 {@link #transaction} 中执行。
 * <p>
 * size 为各层之和，不去重（反映实际存储占用）；keys、reduce、toMap 按 Key 去重，浅层优先。
 * flush 逐层执行，中途失败可能只清空部分层级。
 */
public class MultilevelCache extends AbstractCache {

    private static final Logger log = LoggerFactory.getLogger(MultilevelCache.class);

    private static final CacheOptions READ_OBJECT = CacheOptions.returning(ReturnType.OBJECT);

    private final List<Cache> levels;
    private final CacheModel model;
    private final FallbackResolver fallbackResolver;

    // 性能指标
    private final List<Counter> levelHitCounters;
    private final Counter missCounter;
    private final Counter backfillCounter;
    private final Counter relocationCounter;
    private final Counter fallbackLoadCounter;

    public MultilevelCache(String name,
                           List<? extends Cache> levels,
                           CacheModel model,
                           FallbackResolver fallbackResolver,
                           TransactionManager transactionManager,
                           MeterRegistry meterRegistry) {
        super(name, transactionManager);
        if (levels == null || levels.isEmpty()) {
            throw new CacheConfigurationException(
                "levels configuration of cache " + name + " must have at least one level");
        }
        this.levels = List.copyOf(levels);
        this.model = model == null ? CacheModel.INCLUSIVE : model;
        this.fallbackResolver = fallbackResolver == null ? FallbackResolver.none() : fallbackResolver;

        List<Counter> hitCounters = new ArrayList<>(this.levels.size());
        for (int i = 1; i <= this.levels.size(); i++) {
            hitCounters.add(Counter.builder(CacheConstants.METRIC_HITS)
                .description("Multilevel cache hits per level")
                .tag(CacheConstants.TAG_CACHE, name)
                .tag(CacheConstants.TAG_LEVEL, String.valueOf(i))
                .register(meterRegistry));
        }
        this.levelHitCounters = List.copyOf(hitCounters);
        this.missCounter = Counter.builder(CacheConstants.METRIC_MISSES)
            .tag(CacheConstants.TAG_CACHE, name)
            .register(meterRegistry);
        this.backfillCounter = Counter.builder(CacheConstants.METRIC_BACKFILLS)
            .tag(CacheConstants.TAG_CACHE, name)
            .register(meterRegistry);
        this.relocationCounter = Counter.builder(CacheConstants.METRIC_RELOCATIONS)
            .tag(CacheConstants.TAG_CACHE, name)
            .register(meterRegistry);
        this.fallbackLoadCounter = Counter.builder(CacheConstants.METRIC_FALLBACK_LOADS)
            .tag(CacheConstants.TAG_CACHE, name)
            .register(meterRegistry);

        log.info("Multilevel cache initialized: name={}, model={}, levels={}",
            name, this.model, this.levels.stream().map(Cache::name).toList());
    }

    // ==================== 读 ====================

    @Override
    public Object get(Object key, CacheOptions opts) {
        if (opts.hasLevel()) {
            return level(opts.getLevel()).get(key, levelOptions(opts));
        }
        CacheObject object = lookup(key);
        if (object == null) {
            object = loadFallback(key, opts);
        }
        return opts.select(object);
    }

    @Override
    public boolean hasKey(Object key) {
        return levels.stream().anyMatch(level -> level.hasKey(key));
    }

    @Override
    public long size() {
        return levels.stream().mapToLong(Cache::size).sum();
    }

    @Override
    public Set<Object> keys() {
        Set<Object> keys = new HashSet<>();
        for (Cache level : levels) {
            keys.addAll(level.keys());
        }
        return keys;
    }

    /**
     * 按层级顺序折叠，同一个 Key 只折叠一次（浅层优先）
     */
    @Override
    public <A> A reduce(A acc, BiFunction<A, CacheObject, A> fn) {
        Set<Object> seen = new HashSet<>();
        A result = acc;
        for (Cache level : levels) {
            result = level.reduce(result, (a, object) -> seen.add(object.key()) ? fn.apply(a, object) : a);
        }
        return result;
    }

    // ==================== 写 ====================

    @Override
    public Object set(Object key, Object value, CacheOptions opts) {
        verifyVersion(key, opts);
        return opts.select(write(key, value, opts));
    }

    @Override
    public Object delete(Object key, CacheOptions opts) {
        verifyVersion(key, opts);
        CacheObject removed = remove(key, opts);
        return opts.getReturnType() == ReturnType.OBJECT ? removed : key;
    }

    @Override
    public void flush() {
        for (Cache level : levels) {
            level.flush();
        }
        log.info("Multilevel cache flushed: {}", name);
    }

    @Override
    public long updateCounter(Object key, long amount, CacheOptions opts) {
        if (opts.hasLevel()) {
            return level(opts.getLevel()).updateCounter(key, amount, levelOptions(opts));
        }
        verifyVersion(key, opts);
        if (model == CacheModel.EXCLUSIVE) {
            // 先迁移到第 1 层，再在第 1 层计数
            lookup(key);
            return levels.get(0).updateCounter(key, amount, CacheOptions.defaults());
        }
        long first = 0;
        for (int i = 0; i < levels.size(); i++) {
            long value = levels.get(i).updateCounter(key, amount, CacheOptions.defaults());
            if (i == 0) {
                first = value;
            }
        }
        return first;
    }

    @Override
    public Object pop(Object key, CacheOptions opts) {
        if (opts.hasLevel()) {
            return level(opts.getLevel()).pop(key, levelOptions(opts));
        }
        // 版本校验通过前不做回填或迁移，冲突时各层保持原样
        Hit hit = find(key);
        if (hit == null) {
            return null;
        }
        CacheObject current = hit.object();
        checkVersion(current, opts);
        for (Cache level : levels) {
            level.delete(key, CacheOptions.defaults());
        }
        return opts.select(current);
    }

    @Override
    public UpdateResult getAndUpdate(Object key, Function<Object, Update> fn, CacheOptions opts) {
        if (opts.hasLevel()) {
            return level(opts.getLevel()).getAndUpdate(key, fn, levelOptions(opts));
        }
        CacheObject current = found(find(key));
        checkVersion(current, opts);
        Object currentValue = current == null ? null : current.value();
        Update update = fn.apply(currentValue);
        if (update.isPop()) {
            remove(key, opts);
            return new UpdateResult(currentValue, null);
        }
        CacheObject written = write(key, update.getNewValue(), opts);
        return new UpdateResult(update.getRetained(), opts.select(written));
    }

    @Override
    public Object update(Object key, Object initial, UnaryOperator<Object> fn, CacheOptions opts) {
        if (opts.hasLevel()) {
            return level(opts.getLevel()).update(key, initial, fn, levelOptions(opts));
        }
        CacheObject current = found(find(key));
        checkVersion(current, opts);
        Object value = current == null ? initial : fn.apply(current.value());
        return opts.select(write(key, value, opts));
    }

    // ==================== 层级访问 ====================

    /**
     * 获取第 index 层（从 1 开始）
     */
    public Cache level(int index) {
        if (index < 1 || index > levels.size()) {
            throw CacheConfigurationException.unknownLevel(index, levels.size());
        }
        return levels.get(index - 1);
    }

    public List<Cache> getLevels() {
        return levels;
    }

    public CacheModel getModel() {
        return model;
    }

    public FallbackResolver getFallbackResolver() {
        return fallbackResolver;
    }

    // ==================== 内部实现 ====================

    /**
     * 按层级顺序查找，命中深层时按模型回填或迁移
     *
     * @return 第 1 层当前持有的对象；全部未命中返回 null
     */
    private CacheObject lookup(Object key) {
        Hit hit = find(key);
        if (hit == null) {
            return null;
        }
        return hit.index() == 0 ? hit.object() : promote(key, hit.object(), hit.index());
    }

    /**
     * 按层级顺序查找第一个命中，不修改任何层级
     */
    private Hit find(Object key) {
        for (int i = 0; i < levels.size(); i++) {
            CacheObject object = (CacheObject) levels.get(i).get(key, READ_OBJECT);
            if (object != null) {
                levelHitCounters.get(i).increment();
                log.debug("Level {} hit: cache={}, key={}", i + 1, name, key);
                return new Hit(i, object);
            }
        }
        missCounter.increment();
        return null;
    }

    private static CacheObject found(Hit hit) {
        return hit == null ? null : hit.object();
    }

    private CacheObject promote(Object key, CacheObject object, int hitIndex) {
        if (model == CacheModel.EXCLUSIVE) {
            // 先删后写，并发读者可能短暂地在两层都看不到该 Key
            levels.get(hitIndex).delete(key, CacheOptions.defaults());
            CacheObject moved = (CacheObject) levels.get(0).set(key, object.value(), READ_OBJECT);
            relocationCounter.increment();
            log.debug("Relocated key {} from level {} to level 1: cache={}", key, hitIndex + 1, name);
            return moved;
        }
        CacheObject first = null;
        for (int i = 0; i < hitIndex; i++) {
            CacheObject written = (CacheObject) levels.get(i).set(key, object.value(), READ_OBJECT);
            if (first == null) {
                first = written;
            }
        }
        backfillCounter.increment();
        log.debug("Backfilled key {} from level {} into levels 1..{}: cache={}", key, hitIndex + 1, hitIndex, name);
        return first;
    }

    private CacheObject loadFallback(Object key, CacheOptions opts) {
        if (!fallbackResolver.isConfigured(opts)) {
            return null;
        }
        Optional<Object> value = fallbackResolver.load(key, opts);
        if (value.isEmpty()) {
            return null;
        }
        fallbackLoadCounter.increment();
        return (CacheObject) level(FallbackResolver.POPULATE_LEVEL).set(key, value.get(), READ_OBJECT);
    }

    /**
     * 写入选中的层级；EXCLUSIVE 模式下只写一个层级，并先从其他层级删除
     *
     * @return 最浅的被写入层级返回的对象
     */
    private CacheObject write(Object key, Object value, CacheOptions opts) {
        CacheOptions levelOpts = levelOptions(opts, ReturnType.OBJECT);
        if (model == CacheModel.EXCLUSIVE) {
            int target = opts.hasLevel() ? opts.getLevel() : 1;
            Cache targetLevel = level(target);
            if (opts.hasLevel() && opts.hasVersion()) {
                // 清理其他层级前先校验目标层级的版本
                checkVersion((CacheObject) targetLevel.get(key, READ_OBJECT), opts);
            }
            for (Cache other : levels) {
                if (other != targetLevel) {
                    other.delete(key, CacheOptions.defaults());
                }
            }
            return (CacheObject) targetLevel.set(key, value, levelOpts);
        }
        CacheObject first = null;
        for (Cache level : targetLevels(opts)) {
            CacheObject written = (CacheObject) level.set(key, value, levelOpts);
            if (first == null) {
                first = written;
            }
        }
        return first;
    }

    private CacheObject remove(Object key, CacheOptions opts) {
        CacheOptions levelOpts = levelOptions(opts, ReturnType.OBJECT);
        CacheObject first = null;
        for (Cache level : targetLevels(opts)) {
            CacheObject removed = (CacheObject) level.delete(key, levelOpts);
            if (first == null) {
                first = removed;
            }
        }
        return first;
    }

    /**
     * 未指定层级且带版本时，与最浅的持有层级比较；指定层级时交由该层级原子比较
     */
    private void verifyVersion(Object key, CacheOptions opts) {
        if (!opts.hasVersion() || opts.hasLevel()) {
            return;
        }
        for (Cache level : levels) {
            CacheObject current = (CacheObject) level.get(key, READ_OBJECT);
            if (current != null) {
                checkVersion(current, opts);
                return;
            }
        }
    }

    private List<Cache> targetLevels(CacheOptions opts) {
        return opts.hasLevel() ? List.of(level(opts.getLevel())) : levels;
    }

    private static CacheOptions levelOptions(CacheOptions opts) {
        return levelOptions(opts, opts.getReturnType());
    }

    /**
     * 下发到单个层级的选项：去掉层级与回源，只有指定层级时才传递版本号
     */
    private static CacheOptions levelOptions(CacheOptions opts, ReturnType returnType) {
        return CacheOptions.builder()
            .returnType(returnType)
            .version(opts.hasLevel() ? opts.getVersion() : null)
            .build();
    }

    /**
     * 命中的层级下标（从 0 开始）与该层持有的对象
     */
    private record Hit(int index, CacheObject object) {
    }
}
