package com.mimecast.warden.loop;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative stop request shared between the shutdown hook and the loop.
 * <p>The loop checks it between wake-ups and between pipeline steps. Backoff waits end early.
 */
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Requests a stop.
     */
    public void request() {
        latch.countDown();
    }

    public boolean isRequested() {
        return latch.getCount() == 0;
    }

    /**
     * Waits for the duration or until a stop is requested.
     *
     * @param duration Maximum wait.
     * @throws InterruptedException Interrupted.
     */
    public void sleep(Duration duration) throws InterruptedException {
        latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }
}
