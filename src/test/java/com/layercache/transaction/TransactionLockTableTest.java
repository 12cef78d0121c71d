package com.layercache.transaction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 事务锁表单元测试
 */
class TransactionLockTableTest {

    private static final Duration SHORT = Duration.ofMillis(50);

    private TransactionLockTable lockTable;

    @BeforeEach
    void setUp() {
        lockTable = new TransactionLockTable();
    }

    @Test
    @DisplayName("规范顺序 - 去重并排序")
    void testCanonicalize() {
        assertEquals(List.of(1, 2, 3), TransactionLockTable.canonicalize(List.of(3, 1, 2, 1)));
        assertEquals(List.of(), TransactionLockTable.canonicalize(null));
    }

    @Test
    @DisplayName("规范顺序 - 不同类型按类名排序")
    void testCanonicalize_mixedTypes() {
        List<Object> keys = Arrays.asList("b", 2, "a", 1L);

        assertEquals(List.of(2, 1L, "a", "b"), TransactionLockTable.canonicalize(keys));
    }

    @Test
    @DisplayName("获取与释放")
    void testAcquireAndRelease() throws Exception {
        assertTrue(lockTable.tryAcquire("ns", List.of(1, 2), "tx-1", SHORT));

        assertEquals(Optional.of("tx-1"), lockTable.ownerOf("ns", 1));
        assertEquals(2, lockTable.size());

        lockTable.release("ns", List.of(1, 2), "tx-1");

        assertEquals(Optional.empty(), lockTable.ownerOf("ns", 1));
        assertEquals(0, lockTable.size());
    }

    @Test
    @DisplayName("重叠 Key - 等待超时返回 false，且不持有任何锁")
    void testAcquire_overlapTimesOut() throws Exception {
        lockTable.tryAcquire("ns", List.of(2), "tx-1", SHORT);

        assertFalse(lockTable.tryAcquire("ns", List.of(1, 2), "tx-2", SHORT));

        assertEquals(Optional.empty(), lockTable.ownerOf("ns", 1));
        assertEquals(1, lockTable.size());
    }

    @Test
    @DisplayName("不同命名空间互不影响")
    void testAcquire_namespaces() throws Exception {
        assertTrue(lockTable.tryAcquire("a", List.of(1), "tx-1", SHORT));
        assertTrue(lockTable.tryAcquire("b", List.of(1), "tx-2", SHORT));
        assertFalse(lockTable.tryAcquire("b", List.of(), "tx-3", SHORT));
    }

    @Test
    @DisplayName("整表锁与 Key 锁互斥")
    void testAcquire_wholeCache() throws Exception {
        assertTrue(lockTable.tryAcquire("ns", List.of(), "tx-1", SHORT));
        assertEquals(Optional.of("tx-1"), lockTable.ownerOf("ns", null));

        assertFalse(lockTable.tryAcquire("ns", List.of(1), "tx-2", SHORT));

        lockTable.release("ns", List.of(), "tx-1");
        assertTrue(lockTable.tryAcquire("ns", List.of(1), "tx-2", SHORT));
        assertFalse(lockTable.tryAcquire("ns", List.of(), "tx-3", SHORT));
    }

    @Test
    @DisplayName("只释放自己持有的锁")
    void testRelease_onlyOwner() throws Exception {
        lockTable.tryAcquire("ns", List.of(1), "tx-1", SHORT);

        lockTable.release("ns", List.of(1), "tx-2");

        assertEquals(Optional.of("tx-1"), lockTable.ownerOf("ns", 1));
    }

    @Test
    @DisplayName("释放后唤醒等待者")
    void testRelease_wakesWaiter() throws Exception {
        lockTable.tryAcquire("ns", List.of(1), "tx-1", SHORT);
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            lockTable.release("ns", List.of(1), "tx-1");
        });
        releaser.start();

        assertTrue(lockTable.tryAcquire("ns", List.of(1), "tx-2", Duration.ofSeconds(5)));
        assertEquals(Optional.of("tx-2"), lockTable.ownerOf("ns", 1));
        releaser.join();
    }
}
