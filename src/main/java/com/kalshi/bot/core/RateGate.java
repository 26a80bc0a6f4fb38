package com.kalshi.bot.core;

import com.kalshi.bot.error.RateGateTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by every outbound exchange call.
 *
 * <p>Callers reserve their slot under a short lock and sleep outside it, so
 * slots are granted in arrival order and nobody waits on a sleeping holder.
 * A reservation that would wait longer than {@code maxWait} is refused.
 */
@Slf4j
public class RateGate {

    private final double permitsPerSecond;
    private final double maxBurst;
    private final long intervalNanos;
    private final long maxWaitNanos;
    private final LongSupplier nanoClock;

    private double storedPermits = 0.0;
    private long nextFreeNanos;

    public RateGate(double permitsPerSecond, int maxBurst, Duration maxWait) {
        this(permitsPerSecond, maxBurst, maxWait, System::nanoTime);
    }

    RateGate(double permitsPerSecond, int maxBurst, Duration maxWait, LongSupplier nanoClock) {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("permitsPerSecond must be positive");
        }
        this.permitsPerSecond = permitsPerSecond;
        this.maxBurst = Math.max(1, maxBurst);
        this.intervalNanos = (long) (1_000_000_000.0 / permitsPerSecond);
        this.maxWaitNanos = maxWait.toNanos();
        this.nanoClock = nanoClock;
        this.nextFreeNanos = nanoClock.getAsLong();
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws RateGateTimeoutException if the wait would exceed the ceiling or
     *                                  the thread is interrupted while waiting
     */
    public void acquire() {
        long waitNanos = reserve();
        if (waitNanos <= 0) {
            return;
        }
        try {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RateGateTimeoutException("Interrupted while waiting for a rate permit");
        }
    }

    private synchronized long reserve() {
        long now = nanoClock.getAsLong();
        if (now > nextFreeNanos) {
            storedPermits = Math.min(maxBurst, storedPermits + (double) (now - nextFreeNanos) / intervalNanos);
            nextFreeNanos = now;
        }

        long waitNanos = nextFreeNanos - now;
        if (waitNanos > maxWaitNanos) {
            log.warn("[RATE-GATE] Permit refused: wait {}ms exceeds ceiling {}ms",
                    TimeUnit.NANOSECONDS.toMillis(waitNanos), TimeUnit.NANOSECONDS.toMillis(maxWaitNanos));
            throw new RateGateTimeoutException("Rate permit wait of " + TimeUnit.NANOSECONDS.toMillis(waitNanos)
                    + "ms exceeds ceiling of " + TimeUnit.NANOSECONDS.toMillis(maxWaitNanos) + "ms");
        }

        double fromStore = Math.min(1.0, storedPermits);
        storedPermits -= fromStore;
        nextFreeNanos += (long) ((1.0 - fromStore) * intervalNanos);
        return waitNanos;
    }

    public double getPermitsPerSecond() {
        return permitsPerSecond;
    }
}
