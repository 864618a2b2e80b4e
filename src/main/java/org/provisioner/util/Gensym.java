package org.provisioner.util;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates symbols which are unique within this JVM, e.g. {@code nv1234}.
 */
public final class Gensym {
    private static final AtomicLong COUNTER = new AtomicLong();

    private Gensym() {
    }

    public static String next(String prefix) {
        return prefix + COUNTER.incrementAndGet();
    }
}
