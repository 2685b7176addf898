package com.wildfire.resolution.fetch;

import java.time.Duration;

/**
 * Waits between retry attempts. Tests substitute a recording implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
