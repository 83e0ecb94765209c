package com.trophykit.core.util;

import java.time.Duration;

/** Backoff wait seam. Interruption aborts the wait and must be propagated. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
