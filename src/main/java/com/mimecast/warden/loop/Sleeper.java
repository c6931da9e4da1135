package com.mimecast.warden.loop;

import java.time.Duration;

/**
 * Waits between reconnect attempts.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps.
     *
     * @param duration Delay.
     * @throws InterruptedException Interrupted.
     */
    void sleep(Duration duration) throws InterruptedException;
}
