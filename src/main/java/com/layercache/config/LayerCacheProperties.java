package com.layercache.config;

import com.layercache.constant.CacheConstants;
import com.layercache.multilevel.CacheModel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 多级缓存配置属性类
 */
@Data
@Component
@ConfigurationProperties(prefix = "layer-cache")
public class LayerCacheProperties {

    /** 多级缓存名称（同时作为事务锁命名空间） */
    private String name = CacheConstants.DEFAULT_CACHE_NAME;

    /** 一致性模型 */
    private CacheModel model = CacheModel.INCLUSIVE;

    /** 有序层级列表，第 1 个最先读写 */
    private List<LevelConfig> levels = new ArrayList<>();

    /** 默认回源：beanName#methodName */
    private String fallback;

    /** 事务配置 */
    private TransactionConfig transaction = new TransactionConfig();

    /** Redis 配置（存在分布式层级时使用） */
    private RedisConfig redis = new RedisConfig();

    public enum LevelType {
        LOCAL,
        DISTRIBUTED
    }

    @Data
    public static class LevelConfig {
        /** 层级名称，为空时使用 {name}-l{序号} */
        private String name;
        /** 层级类型 */
        private LevelType type = LevelType.LOCAL;
        /** 初始容量（本地层级） */
        private int initialCapacity = 1000;
        /** 最大容量（本地层级） */
        private long maximumSize = 10000;
        /** 写入后过期时间（本地层级），为空不过期 */
        private Duration expireAfterWrite;
        /** 是否开启统计（本地层级） */
        private boolean recordStats = true;
        /** Redis Hash 名称（分布式层级），为空时使用层级名称 */
        private String mapName;
    }

    @Data
    public static class TransactionConfig {
        /** 单次锁等待超时 */
        private Duration timeout = CacheConstants.DEFAULT_LOCK_TIMEOUT;
        /** 锁获取最大尝试次数 */
        private int retries = CacheConstants.INFINITE_RETRIES;
    }

    @Data
    public static class RedisConfig {
        /** 单机地址，如 redis://127.0.0.1:6379 */
        private String address;
        /** 密码 */
        private String password;
        /** 数据库 */
        private int database = 0;
        /** 连接池大小 */
        private int connectionPoolSize = 64;
        /** 命令超时（毫秒） */
        private int timeoutMillis = 3000;
    }
}
