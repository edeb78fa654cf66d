package com.wangbin.plc.common.config;

import com.wangbin.plc.core.config.PlcProperties;
import com.wangbin.plc.core.storage.InMemoryTimeSeriesStore;
import com.wangbin.plc.core.storage.RedisTimeSeriesStore;
import com.wangbin.plc.core.storage.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 时序存储选择，由 plc.storage.type 决定
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(prefix = "plc.storage", name = "type", havingValue = "memory", matchIfMissing = true)
    public TimeSeriesStore inMemoryTimeSeriesStore() {
        log.info("使用内存时序存储");
        return new InMemoryTimeSeriesStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "plc.storage", name = "type", havingValue = "redis")
    public TimeSeriesStore redisTimeSeriesStore(StringRedisTemplate stringRedisTemplate, PlcProperties properties) {
        log.info("使用Redis时序存储, 键前缀: {}", properties.getStorage().getKeyPrefix());
        return new RedisTimeSeriesStore(stringRedisTemplate, properties.getStorage().getKeyPrefix());
    }
}
