package com.trade.arena.sim.service.quote;

import com.trade.arena.sim.common.exception.ExternalProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide spacing between outbound quote-provider requests.
 * <p>
 * Callers queue on a fair lock that is held across the wait, so the n-th caller dispatches no
 * earlier than {@code interval} after the (n-1)-th, whatever thread they run on.
 */
@Slf4j
@Component
public class RequestThrottle {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final long intervalNanos;

    // nanoTime of the previous dispatch; guarded by lock
    private long lastDispatch;
    private boolean dispatched;

    public RequestThrottle(@Value("${arena.quote.min-interval-ms:1000}") long minIntervalMs) {
        if (minIntervalMs < 0) throw new IllegalArgumentException("min interval must be >= 0");
        this.intervalNanos = TimeUnit.MILLISECONDS.toNanos(minIntervalMs);
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }

    /**
     * Blocks until this caller may dispatch, then records the dispatch time.
     */
    public void acquire() {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalProviderException("Interrupted while waiting for the request throttle", e);
        }
        try {
            if (dispatched) {
                long waitNanos = lastDispatch + intervalNanos - System.nanoTime();
                if (waitNanos > 0) {
                    log.debug("Throttling quote request for {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                }
            }
            lastDispatch = System.nanoTime();
            dispatched = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalProviderException("Interrupted while waiting for the request throttle", e);
        } finally {
            lock.unlock();
        }
    }
}
