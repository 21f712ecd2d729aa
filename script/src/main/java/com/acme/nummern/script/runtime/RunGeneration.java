package com.acme.nummern.script.runtime;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic run counter. A result is applied only if its token is still the
 * latest one handed out.
 */
public final class RunGeneration {
    private final AtomicLong current = new AtomicLong();

    public long bump() {
        return current.incrementAndGet();
    }

    public long token() {
        return current.get();
    }

    public boolean matches(long token) {
        return current.get() == token;
    }
}
