package io.ration.ratelimit;

/**
 * Blocks the calling thread while a bucket refills. Swappable so tests can advance a fake clock instead.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;

    static Sleeper system() { return Thread::sleep; }
}
