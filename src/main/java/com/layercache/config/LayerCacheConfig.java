package com.layercache.config;

import com.layercache.backend.DistributedCache;
import com.layercache.backend.LocalCache;
import com.layercache.core.Cache;
import com.layercache.exception.CacheConfigurationException;
import com.layercache.fallback.FallbackResolver;
import com.layercache.multilevel.MultilevelCache;
import com.layercache.transaction.TransactionLockTable;
import com.layercache.transaction.TransactionManager;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 多级缓存装配
 * 按 layer-cache.levels 的顺序创建各层级，所有缓存共享同一张事务锁表
 */
@Slf4j
@Configuration
public class LayerCacheConfig {

    @Bean
    public TransactionLockTable transactionLockTable() {
        return new TransactionLockTable();
    }

    @Bean
    public FallbackResolver fallbackResolver(LayerCacheProperties properties, BeanFactory beanFactory) {
        if (!StringUtils.hasText(properties.getFallback())) {
            return FallbackResolver.none();
        }
        log.info("Default fallback registered: {}", properties.getFallback());
        return new FallbackResolver(FallbackResolver.fromReference(properties.getFallback(), beanFactory));
    }

    @Bean
    public MultilevelCache multilevelCache(LayerCacheProperties properties,
                                           TransactionLockTable lockTable,
                                           FallbackResolver fallbackResolver,
                                           CaffeineCacheFactory caffeineCacheFactory,
                                           ObjectProvider<RedissonClient> redissonClient,
                                           ObjectProvider<Codec> codec,
                                           MeterRegistry meterRegistry) {
        List<LayerCacheProperties.LevelConfig> levelConfigs = properties.getLevels();
        if (levelConfigs == null || levelConfigs.isEmpty()) {
            throw new CacheConfigurationException(
                "missing layer-cache.levels configuration, at least one level is required");
        }

        List<Cache> levels = new ArrayList<>(levelConfigs.size());
        for (int i = 0; i < levelConfigs.size(); i++) {
            LayerCacheProperties.LevelConfig config = levelConfigs.get(i);
            String levelName = StringUtils.hasText(config.getName())
                ? config.getName()
                : properties.getName() + "-l" + (i + 1);
            TransactionManager transactionManager = transactionManager(levelName, properties, lockTable, meterRegistry);

            Cache level = switch (config.getType()) {
                case LOCAL -> new LocalCache(levelName,
                    caffeineCacheFactory.create(levelName, config), transactionManager);
                case DISTRIBUTED -> {
                    RedissonClient client = redissonClient.getIfAvailable();
                    if (client == null) {
                        throw new CacheConfigurationException("distributed level " + levelName
                            + " requires layer-cache.redis.address to be configured");
                    }
                    String mapName = StringUtils.hasText(config.getMapName()) ? config.getMapName() : levelName;
                    yield DistributedCache.redisson(levelName, client, mapName, codec.getObject(), transactionManager);
                }
            };
            levels.add(level);
        }

        return new MultilevelCache(properties.getName(), levels, properties.getModel(), fallbackResolver,
            transactionManager(properties.getName(), properties, lockTable, meterRegistry), meterRegistry);
    }

    private static TransactionManager transactionManager(String namespace,
                                                         LayerCacheProperties properties,
                                                         TransactionLockTable lockTable,
                                                         MeterRegistry meterRegistry) {
        LayerCacheProperties.TransactionConfig tx = properties.getTransaction();
        return new TransactionManager(namespace, lockTable, meterRegistry, tx.getTimeout(), tx.getRetries());
    }
}
