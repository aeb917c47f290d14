package com.trade.arena.sim.test.core;

import com.trade.arena.sim.core.InMemoryFastStateStore;
import com.trade.arena.sim.test.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryFastStateStoreTest {

    private static final Instant START = Instant.parse("2024-03-04T00:00:00Z");

    @Test
    void entriesExpireAfterTtl() {
        MutableClock clock = new MutableClock(START);
        InMemoryFastStateStore store = new InMemoryFastStateStore("t:", clock);

        store.put("token", "abc", Duration.ofMinutes(5));
        assertThat(store.get("token")).contains("abc");

        clock.advance(Duration.ofMinutes(5));
        assertThat(store.get("token")).isEmpty();
    }

    @Test
    void setIfAbsentClaimsOnlyOnce() {
        MutableClock clock = new MutableClock(START);
        InMemoryFastStateStore store = new InMemoryFastStateStore("t:", clock);

        assertThat(store.setIfAbsent("reset:weekly:2024-03-04", "running", Duration.ofDays(3))).isTrue();
        assertThat(store.setIfAbsent("reset:weekly:2024-03-04", "running", Duration.ofDays(3))).isFalse();

        store.delete("reset:weekly:2024-03-04");
        assertThat(store.setIfAbsent("reset:weekly:2024-03-04", "running", Duration.ofDays(3))).isTrue();
    }

    @Test
    void expiredClaimCanBeTakenAgain() {
        MutableClock clock = new MutableClock(START);
        InMemoryFastStateStore store = new InMemoryFastStateStore("t:", clock);

        store.setIfAbsent("k", "a", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(11));

        assertThat(store.setIfAbsent("k", "b", Duration.ofSeconds(10))).isTrue();
        assertThat(store.get("k")).contains("b");
    }

    @Test
    void zeroTtlNeverExpires() {
        MutableClock clock = new MutableClock(START);
        InMemoryFastStateStore store = new InMemoryFastStateStore(null, clock);

        store.put("k", "v", Duration.ZERO);
        clock.advance(Duration.ofDays(365));

        assertThat(store.get("k")).contains("v");
    }
}
