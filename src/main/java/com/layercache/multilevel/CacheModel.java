package com.layercache.multilevel;

/**
 * 多级缓存一致性模型
 */
public enum CacheModel {

    /**
     * 包含模式：任一层级的值最终在所有层级都存在，深层命中时回填到更浅的层级
     */
    INCLUSIVE,

    /**
     * 独占模式：一个 Key 同一时刻只存在于一个层级，深层命中时迁移到第 1 层
     */
    EXCLUSIVE
}
