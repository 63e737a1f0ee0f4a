package com.drawdownwatch.monitor.application.config;

import com.drawdownwatch.monitor.domain.cache.CacheStore;
import com.drawdownwatch.monitor.infrastructure.memory.InMemoryCacheStore;
import com.drawdownwatch.monitor.infrastructure.redis.RedisCacheStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Configuration
public class CacheStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "drawdown.cache", name = "store", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(StringRedisTemplate redisTemplate) {
        return new RedisCacheStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "drawdown.cache", name = "store", havingValue = "memory")
    public CacheStore inMemoryCacheStore(Clock clock) {
        return new InMemoryCacheStore(clock);
    }
}
