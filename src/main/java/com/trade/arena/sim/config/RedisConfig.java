package com.trade.arena.sim.config;

import com.trade.arena.sim.core.FastStateStore;
import com.trade.arena.sim.core.RedisFastStateStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(name = "arena.redis.enabled", havingValue = "true")
public class RedisConfig {

    // connection factory comes from spring.data.redis.* auto-configuration
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }

    @Bean
    public FastStateStore fastStateStore(StringRedisTemplate template,
                                         @Value("${arena.redis.key-prefix:arena:}") String prefix) {
        return new RedisFastStateStore(template, prefix);
    }
}
