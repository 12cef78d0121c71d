package com.layercache.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 事务锁表
 * <p>
 * 记录 (命名空间, Key) -> (持有者, 获取时间)。同一个锁表可以被多个缓存实例共享，
 * 不同缓存通过命名空间隔离。整表锁（不指定 Key 的事务）与该命名空间下的任何 Key 锁互斥。
 * 获取与释放在同一把互斥锁下原子完成，等待者通过条件变量唤醒。
 */
public class TransactionLockTable {

    private static final Logger log = LoggerFactory.getLogger(TransactionLockTable.class);

    /** 整表锁的占位 Key */
    private static final Object WHOLE_CACHE = new Object() {
        @Override
        public String toString() {
            return "*";
        }
    };

    /**
     * 规范化的 Key 排序，避免请求重叠 Key 集合的事务互相死锁
     */
    @SuppressWarnings("unchecked")
    public static final Comparator<Object> CANONICAL_ORDER = (a, b) -> {
        if (a.getClass() == b.getClass() && a instanceof Comparable<?>) {
            return ((Comparable<Object>) a).compareTo(b);
        }
        int byType = a.getClass().getName().compareTo(b.getClass().getName());
        if (byType != 0) {
            return byType;
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    };

    private final ConcurrentMap<LockId, LockEntry> locks = new ConcurrentHashMap<>();
    // 每个命名空间当前持有的锁数量，用于判断整表锁是否可获取
    private final Map<String, Integer> heldPerNamespace = new HashMap<>();

    private final ReentrantLock mutex = new ReentrantLock();
    private final Condition released = mutex.newCondition();

    /**
     * 将 Key 去重并排成规范顺序
     */
    public static List<Object> canonicalize(List<Object> keys) {
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }
        return keys.stream().distinct().sorted(CANONICAL_ORDER).toList();
    }

    /**
     * 在超时时间内一次性获取全部锁（全有或全无）
     *
     * @param keys 规范顺序的 Key，为空表示整表锁
     * @return 超时未获取返回 false
     */
    public boolean tryAcquire(String namespace, List<Object> keys, String owner, Duration timeout)
            throws InterruptedException {
        long remaining = timeout.toNanos();
        mutex.lockInterruptibly();
        try {
            while (!isAvailable(namespace, keys)) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = released.awaitNanos(remaining);
            }
            Instant now = Instant.now();
            for (LockId id : lockIds(namespace, keys)) {
                locks.put(id, new LockEntry(owner, now));
            }
            heldPerNamespace.merge(namespace, keys.isEmpty() ? 1 : keys.size(), Integer::sum);
            log.debug("Locks acquired: namespace={}, keys={}, owner={}", namespace, keys, owner);
            return true;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * 按获取顺序的逆序释放锁，只释放 owner 自己持有的
     */
    public void release(String namespace, List<Object> keys, String owner) {
        mutex.lock();
        try {
            List<LockId> ids = lockIds(namespace, keys);
            int releasedCount = 0;
            for (int i = ids.size() - 1; i >= 0; i--) {
                LockId id = ids.get(i);
                LockEntry entry = locks.get(id);
                if (entry != null && entry.owner().equals(owner)) {
                    locks.remove(id);
                    releasedCount++;
                }
            }
            if (releasedCount > 0) {
                int count = releasedCount;
                heldPerNamespace.computeIfPresent(namespace, (ns, held) -> held > count ? held - count : null);
            }
            released.signalAll();
            log.debug("Locks released: namespace={}, keys={}, owner={}", namespace, keys, owner);
        } finally {
            mutex.unlock();
        }
    }

    /**
     * 查询锁的持有者，key 为 null 时查询整表锁
     */
    public Optional<String> ownerOf(String namespace, Object key) {
        LockEntry entry = locks.get(new LockId(namespace, key == null ? WHOLE_CACHE : key));
        return Optional.ofNullable(entry).map(LockEntry::owner);
    }

    public int size() {
        return locks.size();
    }

    private boolean isAvailable(String namespace, List<Object> keys) {
        if (locks.containsKey(new LockId(namespace, WHOLE_CACHE))) {
            return false;
        }
        if (keys.isEmpty()) {
            return heldPerNamespace.getOrDefault(namespace, 0) == 0;
        }
        for (Object key : keys) {
            if (locks.containsKey(new LockId(namespace, key))) {
                return false;
            }
        }
        return true;
    }

    private static List<LockId> lockIds(String namespace, List<Object> keys) {
        if (keys.isEmpty()) {
            return List.of(new LockId(namespace, WHOLE_CACHE));
        }
        return keys.stream().map(key -> new LockId(namespace, key)).toList();
    }

    record LockId(String namespace, Object key) {
    }

    /**
     * 锁持有记录
     */
    public record LockEntry(String owner, Instant acquiredAt) {
    }
}
