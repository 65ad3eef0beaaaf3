package com.finbrain.infrastructure.ai.resilience;

import java.time.Duration;

/**
 * Blocking pause between retry attempts. Replaced in tests so no real time passes.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
