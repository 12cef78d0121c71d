package com.layercache.transaction;

import com.layercache.constant.CacheConstants;
import com.layercache.exception.TransactionAbortedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * 键级事务管理器
 * <p>
 * 每个缓存实例持有一个，通过共享的 {@link TransactionLockTable} 实现跨事务互斥。
 * 单次尝试在超时时间内等待锁，超时后消耗一次尝试次数并重新获取，次数耗尽抛出
 * {@link TransactionAbortedException}。事务体无论正常返回还是抛出异常，锁都会被释放。
 * <p>
 * 嵌套事务不会被识别为重入：在同一上下文中对相同 Key 再次开启事务会等待自己持有的锁直到中止。
 */
@Slf4j
public class TransactionManager {

    private final String namespace;
    private final TransactionLockTable lockTable;
    private final Duration defaultTimeout;
    private final int defaultRetries;

    private final AtomicInteger activeTransactions = new AtomicInteger();
    private final Timer acquireTimer;
    private final Counter retryCounter;
    private final Counter abortCounter;

    public TransactionManager(String namespace,
                              TransactionLockTable lockTable,
                              MeterRegistry meterRegistry,
                              Duration defaultTimeout,
                              int defaultRetries) {
        this.namespace = namespace;
        this.lockTable = lockTable;
        this.defaultTimeout = defaultTimeout;
        this.defaultRetries = Math.max(1, defaultRetries);

        this.acquireTimer = Timer.builder(CacheConstants.METRIC_TX_ACQUIRE)
            .description("Transaction lock acquisition latency")
            .tag(CacheConstants.TAG_CACHE, namespace)
            .register(meterRegistry);
        this.retryCounter = Counter.builder(CacheConstants.METRIC_TX_RETRIES)
            .description("Transaction lock acquisition retries")
            .tag(CacheConstants.TAG_CACHE, namespace)
            .register(meterRegistry);
        this.abortCounter = Counter.builder(CacheConstants.METRIC_TX_ABORTS)
            .description("Aborted transactions")
            .tag(CacheConstants.TAG_CACHE, namespace)
            .register(meterRegistry);
        Gauge.builder(CacheConstants.METRIC_TX_ACTIVE, activeTransactions, AtomicInteger::get)
            .description("Running transactions")
            .tag(CacheConstants.TAG_CACHE, namespace)
            .register(meterRegistry);
    }

    public TransactionManager(String namespace, TransactionLockTable lockTable, MeterRegistry meterRegistry) {
        this(namespace, lockTable, meterRegistry,
            CacheConstants.DEFAULT_LOCK_TIMEOUT, CacheConstants.INFINITE_RETRIES);
    }

    /**
     * 在锁保护下执行事务体
     */
    public <T> T execute(TransactionOptions opts, Function<TransactionContext, T> body) {
        List<Object> keys = TransactionLockTable.canonicalize(opts.getKeys());
        int retries = opts.getRetries() != null ? Math.max(1, opts.getRetries()) : defaultRetries;
        Duration timeout = opts.getTimeout() != null ? opts.getTimeout() : defaultTimeout;

        TransactionContext context = TransactionContext.begin(namespace, keys);
        acquire(context, retries, timeout);

        context.transitionTo(TransactionState.RUNNING);
        activeTransactions.incrementAndGet();
        boolean committed = false;
        try {
            T result = body.apply(context);
            committed = true;
            return result;
        } finally {
            context.transitionTo(committed ? TransactionState.COMMITTED : TransactionState.ABORTED);
            lockTable.release(namespace, keys, context.getId());
            activeTransactions.decrementAndGet();
            log.debug("Transaction {} finished: {}", context.getId(), context.getState());
        }
    }

    /**
     * 上下文是否处于本缓存的运行中事务
     */
    public boolean inTransaction(TransactionContext context) {
        return context != null
            && context.isRunning()
            && namespace.equals(context.getNamespace());
    }

    public String getNamespace() {
        return namespace;
    }

    public TransactionLockTable getLockTable() {
        return lockTable;
    }

    private void acquire(TransactionContext context, int retries, Duration timeout) {
        List<Object> keys = context.getKeys();
        long start = System.nanoTime();
        for (int attempt = 1; ; attempt++) {
            boolean acquired;
            try {
                acquired = lockTable.tryAcquire(namespace, keys, context.getId(), timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.transitionTo(TransactionState.ABORTED);
                abortCounter.increment();
                throw new TransactionAbortedException(keys, attempt, e);
            }
            if (acquired) {
                acquireTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
                return;
            }
            if (attempt >= retries) {
                context.transitionTo(TransactionState.ABORTED);
                abortCounter.increment();
                log.warn("Transaction aborted: cache={}, keys={}, attempts={}, timeout={}ms",
                    namespace, keys.isEmpty() ? "*" : keys, attempt, timeout.toMillis());
                throw new TransactionAbortedException(keys, attempt);
            }
            retryCounter.increment();
            log.debug("Lock wait timed out, retrying: cache={}, keys={}, attempt={}", namespace, keys, attempt);
        }
    }
}
