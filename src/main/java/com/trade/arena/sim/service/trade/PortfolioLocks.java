package com.trade.arena.sim.service.trade;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per user id. Orders of the same user serialize; different users never contend.
 * <p>
 * An entry lives only while someone holds or waits for it: holders are counted inside
 * {@code compute}, and the last release removes the entry.
 */
@Component
public class PortfolioLocks {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int holders; // only touched inside compute for this key
    }

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    /**
     * Blocks until the user's lock is held. Always pair with {@link Lease#release()} in a finally block.
     */
    public Lease acquire(String userId) {
        Entry entry = locks.compute(userId, (id, cur) -> {
            Entry e = cur == null ? new Entry() : cur;
            e.holders++;
            return e;
        });
        entry.lock.lock();
        return new Lease(userId, entry);
    }

    /**
     * Users with a held or awaited lock.
     */
    public int activeUsers() {
        return locks.size();
    }

    private void release(String userId, Entry entry) {
        entry.lock.unlock();
        locks.computeIfPresent(userId, (id, cur) -> {
            if (cur != entry) return cur;
            return --cur.holders == 0 ? null : cur;
        });
    }

    public final class Lease {
        private final String userId;
        private final Entry entry;
        private boolean released;

        private Lease(String userId, Entry entry) {
            this.userId = userId;
            this.entry = entry;
        }

        public void release() {
            if (released) return;
            released = true;
            PortfolioLocks.this.release(userId, entry);
        }
    }
}
