package com.layercache.core;

/**
 * 操作返回内容：裸值、Key 或完整对象
 */
public enum ReturnType {

    VALUE,
    KEY,
    OBJECT;

    public Object select(CacheObject object) {
        if (object == null) {
            return null;
        }
        return switch (this) {
            case VALUE -> object.value();
            case KEY -> object.key();
            case OBJECT -> object;
        };
    }
}
