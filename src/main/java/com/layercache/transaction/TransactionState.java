package com.layercache.transaction;

/**
 * 事务状态：ACQUIRING -> RUNNING -> (COMMITTED | ABORTED)
 */
public enum TransactionState {

    /** 无事务占位上下文 */
    NONE,
    ACQUIRING,
    RUNNING,
    COMMITTED,
    ABORTED
}
