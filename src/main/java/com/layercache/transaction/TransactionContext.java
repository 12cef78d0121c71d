package com.layercache.transaction;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 事务上下文，显式传入事务体
 * <p>
 * 仅在事务体执行期间处于 RUNNING 状态，事务结束后
 * {@link #isRunning()} 返回 false，因此泄漏到事务外的上下文不会被误判为"在事务中"。
 */
public final class TransactionContext {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private static final TransactionContext NONE =
        new TransactionContext("none", null, List.of(), TransactionState.NONE);

    private final String id;
    private final String namespace;
    private final List<Object> keys;
    private volatile TransactionState state;

    private TransactionContext(String id, String namespace, List<Object> keys, TransactionState state) {
        this.id = id;
        this.namespace = namespace;
        this.keys = keys;
        this.state = state;
    }

    static TransactionContext begin(String namespace, List<Object> keys) {
        String id = "tx-" + SEQUENCE.incrementAndGet() + "@" + Thread.currentThread().getName();
        return new TransactionContext(id, namespace, keys, TransactionState.ACQUIRING);
    }

    /**
     * 事务外的占位上下文
     */
    public static TransactionContext none() {
        return NONE;
    }

    void transitionTo(TransactionState next) {
        this.state = next;
    }

    public String getId() {
        return id;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * 已加锁的 Key（规范顺序），为空表示整个缓存
     */
    public List<Object> getKeys() {
        return keys;
    }

    public boolean isGlobal() {
        return keys.isEmpty();
    }

    public TransactionState getState() {
        return state;
    }

    public boolean isRunning() {
        return state == TransactionState.RUNNING;
    }

    @Override
    public String toString() {
        return "TransactionContext{id=" + id + ", namespace=" + namespace
            + ", keys=" + keys + ", state=" + state + '}';
    }
}
