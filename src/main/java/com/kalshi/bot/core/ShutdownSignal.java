package com.kalshi.bot.core;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide cancellation token. Loops wait on it instead of sleeping so a
 * shutdown request wakes them immediately.
 */
@Component
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void trigger() {
        latch.countDown();
    }

    public boolean isTriggered() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout}.
     *
     * @return true if shutdown was requested (or the thread interrupted)
     */
    public boolean await(Duration timeout) {
        try {
            return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
