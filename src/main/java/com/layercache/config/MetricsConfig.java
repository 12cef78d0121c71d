package com.layercache.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 监控指标配置
 * 未引入监控后端时使用内存注册表，缓存与事务指标统一带上应用标签
 */
@Configuration
public class MetricsConfig {

    private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry(@Value("${spring.application.name:layer-cache}") String application) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", application);
        log.info("Simple meter registry initialized for application: {}", application);
        return registry;
    }
}
