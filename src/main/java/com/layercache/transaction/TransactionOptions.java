package com.layercache.transaction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * 事务选项
 * <ul>
 *   <li>keys - 需要加锁的 Key，为空表示锁整个缓存</li>
 *   <li>retries - 锁获取的最大尝试次数，为空使用默认值</li>
 *   <li>timeout - 单次尝试的锁等待超时，为空使用默认值</li>
 * </ul>
 */
@Value
@Builder
public class TransactionOptions {

    private static final TransactionOptions DEFAULTS = TransactionOptions.builder().build();

    @Singular
    List<Object> keys;

    Integer retries;

    Duration timeout;

    public static TransactionOptions defaults() {
        return DEFAULTS;
    }

    public static TransactionOptions forKeys(Object... keys) {
        return builder().keys(Arrays.asList(keys)).build();
    }
}
