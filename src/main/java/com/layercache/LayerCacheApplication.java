package com.layercache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 多级缓存服务启动类
 * 按 layer-cache 配置装配多级缓存、回源解析器与事务锁表
 */
@SpringBootApplication
public class LayerCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(LayerCacheApplication.class, args);
    }
}
