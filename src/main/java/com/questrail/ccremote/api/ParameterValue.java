package com.questrail.ccremote.api;

import java.util.NoSuchElementException;
import java.util.OptionalInt;

/**
 * ParameterValue
 * -----------------------------------------------------------------------------
 * {@code ParameterValue} is the last-known value of one parameter address.
 *
 * This type is intentionally TERNARY-like rather than a bare {@code int}. The
 * device cannot be queried, so a parameter that has never been written has no
 * known value. Zero is a perfectly valid control value and must never stand in
 * for "never set".
 *
 * <h2>The Two Shapes</h2>
 * <ul>
 *   <li>{@link #UNKNOWN} – the address has never been written in this session</li>
 *   <li>{@code known(v)} – the address was last written with {@code v} (0–127)</li>
 * </ul>
 *
 * <h2>Why Not OptionalInt or null</h2>
 * Observers receive this value on registration as well as on every write, and
 * the store uses {@link #UNKNOWN} as the bootstrap sentinel for a write that
 * sends nothing. A named type keeps that intent explicit at every call site.
 */
public final class ParameterValue
{
    /**
     * The value of an address that has never been written.
     */
    public static final ParameterValue UNKNOWN = new ParameterValue(-1);

    private static final ParameterValue[] CACHE = new ParameterValue[128];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new ParameterValue(i);
        }
    }

    private final int value;

    private ParameterValue(int value) {
        this.value = value;
    }

    /**
     * Returns the known value {@code v}.
     *
     * @throws IllegalArgumentException if {@code v} is outside 0–127
     */
    public static ParameterValue known(int v) {
        if (v < 0 || v >= CACHE.length) {
            throw new IllegalArgumentException("Parameter value must be in range 0–127 (was " + v + ")");
        }
        return CACHE[v];
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Returns the known value.
     *
     * @throws NoSuchElementException if this value is {@link #UNKNOWN}
     */
    public int value() {
        if (!isKnown()) {
            throw new NoSuchElementException("Parameter value is unknown");
        }
        return value;
    }

    public OptionalInt asOptionalInt() {
        return isKnown() ? OptionalInt.of(value) : OptionalInt.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterValue that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return isKnown() ? Integer.toString(value) : "UNKNOWN";
    }
}
