package org.ember.compiler.frontend.expansion;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Source of the numbers that keep compiler-introduced names apart. Safe to share between
 * compilation units running on different threads.
 */
public final class UniqueCounter {

    private final AtomicLong next;

    public UniqueCounter() {
        this(1);
    }

    /**
     * @param start The first number handed out. Tests pass a fixed start to get stable names.
     */
    public UniqueCounter(long start) {
        this.next = new AtomicLong(start);
    }

    public long next() {
        return next.getAndIncrement();
    }
}
