package com.trade.arena.sim.test.core;

import com.trade.arena.sim.core.FastStateStore;
import com.trade.arena.sim.core.RedisFastStateStore;
import com.trade.arena.sim.test.BaseContainers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RedisFastStateStoreIT extends BaseContainers {

    @Autowired
    FastStateStore fast;

    @Test
    void redisBackedWhenEnabled() {
        assertThat(fast).isInstanceOf(RedisFastStateStore.class);
    }

    @Test
    void markerIsClaimedOnce() {
        String key = "it:reset:weekly:" + System.nanoTime();

        assertThat(fast.setIfAbsent(key, "running", Duration.ofMinutes(1))).isTrue();
        assertThat(fast.setIfAbsent(key, "running", Duration.ofMinutes(1))).isFalse();

        fast.put(key, "done", Duration.ofMinutes(1));
        assertThat(fast.get(key)).contains("done");

        fast.delete(key);
        assertThat(fast.get(key)).isEmpty();
    }
}
