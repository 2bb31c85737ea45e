package com.skein.transport;

import java.time.Duration;

/**
 * Blocking wait used between reconnection attempts; replaced by a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
