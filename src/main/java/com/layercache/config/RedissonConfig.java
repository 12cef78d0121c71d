package com.layercache.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import org.redisson.codec.JsonJacksonCodec;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson 客户端配置
 * 仅在配置了 layer-cache.redis.address 时启用，供分布式层级使用
 */
@Configuration
@ConditionalOnProperty(prefix = "layer-cache.redis", name = "address")
public class RedissonConfig {

    private static final Logger log = LoggerFactory.getLogger(RedissonConfig.class);

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(LayerCacheProperties properties) {
        LayerCacheProperties.RedisConfig redis = properties.getRedis();
        Config config = new Config();
        config.useSingleServer()
            .setAddress(redis.getAddress())
            .setDatabase(redis.getDatabase())
            .setConnectionPoolSize(redis.getConnectionPoolSize())
            .setTimeout(redis.getTimeoutMillis())
            .setPassword(StringUtils.hasText(redis.getPassword()) ? redis.getPassword() : null);

        log.info("Redisson client configured with address: {}", redis.getAddress());
        return Redisson.create(config);
    }

    /**
     * 缓存对象编解码（JSON，带类型信息）
     */
    @Bean
    public Codec cacheObjectCodec(ObjectMapper objectMapper) {
        return new JsonJacksonCodec(objectMapper);
    }
}
