package com.oniongateway.core.util;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps a value that must not appear in logs or operator-facing messages while
 * safe logging is on. Redaction happens in {@link #toString()}, so call sites
 * simply pass the wrapper to the logger.
 *
 * @param <T> wrapped type
 */
public final class Sensitive<T> {

    public static final String SCRUBBED = "[scrubbed]";

    private static final AtomicBoolean SAFE_LOGGING = new AtomicBoolean(true);

    private final T value;

    private Sensitive(T value) {
        this.value = value;
    }

    public static <T> Sensitive<T> of(T value) {
        return new Sensitive<>(value);
    }

    /**
     * Turns redaction on or off for the whole process. Only meant for debugging
     * a service that is not exposed to real users.
     */
    public static void setSafeLogging(boolean enabled) {
        SAFE_LOGGING.set(enabled);
    }

    public static boolean isSafeLogging() {
        return SAFE_LOGGING.get();
    }

    public T unwrap() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sensitive)) {
            return false;
        }
        return Objects.equals(value, ((Sensitive<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return SAFE_LOGGING.get() ? SCRUBBED : String.valueOf(value);
    }
}
