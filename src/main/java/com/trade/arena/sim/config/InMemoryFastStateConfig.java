package com.trade.arena.sim.config;

import com.trade.arena.sim.core.FastStateStore;
import com.trade.arena.sim.core.InMemoryFastStateStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(name = "arena.redis.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryFastStateConfig {

    @Bean
    public FastStateStore fastStateStore(Clock clock,
                                         @Value("${arena.redis.key-prefix:arena:}") String prefix) {
        return new InMemoryFastStateStore(prefix, clock);
    }
}
