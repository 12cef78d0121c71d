package com.layercache.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * getAndUpdate 回调的返回值：(保留值, 新值) 或 pop 标记
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Update {

    private static final Update POP = new Update(null, null, true);

    private final Object retained;
    private final Object newValue;
    private final boolean pop;

    public static Update of(Object retained, Object newValue) {
        return new Update(retained, newValue, false);
    }

    /**
     * 删除 Key，getAndUpdate 返回 (当前值, null)
     */
    public static Update pop() {
        return POP;
    }
}
