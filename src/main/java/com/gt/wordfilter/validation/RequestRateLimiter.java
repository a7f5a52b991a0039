package com.gt.wordfilter.validation;

import com.gt.wordfilter.exception.ExternalServiceUnavailableException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Enforces a minimum spacing between requests to the external dictionary.
 *
 * <p>Each caller atomically reserves the next free time slot and then sleeps until it arrives.
 * Callers never hold a lock while waiting, so the only serialization between unrelated lookups is
 * the spacing itself. A caller whose slot would be further away than {@code maxQueueWait} is
 * refused straight away instead of queueing indefinitely.
 */
public class RequestRateLimiter {

    private final long minIntervalNanos;
    private final long maxQueueWaitNanos;
    private final AtomicLong nextFreeSlot;

    public RequestRateLimiter(Duration minInterval, Duration maxQueueWait) {
        this.minIntervalNanos = minInterval.toNanos();
        this.maxQueueWaitNanos = maxQueueWait.toNanos();
        this.nextFreeSlot = new AtomicLong(System.nanoTime());
    }

    /**
     * Blocks until the caller may issue its request.
     *
     * @throws ExternalServiceUnavailableException if the wait would exceed the configured maximum
     * @throws InterruptedException if interrupted while waiting for the reserved slot
     */
    public void acquire() throws InterruptedException {
        long now = System.nanoTime();
        long slot;

        while (true) {
            long free = nextFreeSlot.get();
            slot = free - now > 0 ? free : now;

            if (slot - now > maxQueueWaitNanos) {
                throw new ExternalServiceUnavailableException("rate limit queue is full, next request slot is "
                        + TimeUnit.NANOSECONDS.toMillis(slot - now) + " ms away");
            }
            if (nextFreeSlot.compareAndSet(free, slot + minIntervalNanos)) {
                break;
            }
        }

        long waitNanos = slot - now;
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    public Duration getMinInterval() {
        return Duration.ofNanos(minIntervalNanos);
    }
}
