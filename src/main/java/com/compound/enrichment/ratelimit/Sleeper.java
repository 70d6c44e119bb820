package com.compound.enrichment.ratelimit;

import java.time.Duration;

/**
 * Blocks the calling thread. Abstracted so that tests can advance a fake clock instead.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
}
