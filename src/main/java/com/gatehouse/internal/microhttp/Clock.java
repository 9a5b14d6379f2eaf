package com.gatehouse.internal.microhttp;

/**
 * Monotonic time source for {@link Scheduler}.
 */
interface Clock {

    long nanoTime();

}
