package com.questrail.ccremote.api;

/**
 * Strongly typed representation of a control-change parameter address.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * The address is the protocol's addressing unit: the controller number carried
 * in the second byte of every control-change message. It keys all per-parameter
 * state (cached values, observers, presets). Treating it as a raw {@code int}
 * would allow accidental mixing with values, which share the same numeric space.
 * </p>
 *
 * <h2>Protocol constraints</h2>
 * <ul>
 *   <li>Valid addresses are {@code 0}–{@code 127} (inclusive)</li>
 *   <li>Instances are immutable and cached; {@code of(n) == of(n)}</li>
 * </ul>
 *
 * <h2>Layering note</h2>
 * <p>
 * This type has no knowledge of wire encoding or transport. Lower layers convert
 * it to a byte via {@link #value()}.
 * </p>
 */
public final class ParameterAddress implements Comparable<ParameterAddress>
{
    /**
     * Minimum valid address.
     */
    public static final int MIN_VALUE = 0;

    /**
     * Maximum valid address.
     */
    public static final int MAX_VALUE = 127;

    private static final ParameterAddress[] CACHE = new ParameterAddress[MAX_VALUE + 1];

    static {
        for (int i = MIN_VALUE; i <= MAX_VALUE; i++) {
            CACHE[i] = new ParameterAddress(i);
        }
    }

    private final int value;

    private ParameterAddress(int value) {
        this.value = value;
    }

    /**
     * Returns the {@code ParameterAddress} for the given numeric value.
     *
     * @param value the address value (0–127 inclusive)
     * @return the address instance
     * @throws IllegalArgumentException if the value is outside the valid range
     */
    public static ParameterAddress of(int value) {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Parameter address must be in range "
                            + MIN_VALUE + "–" + MAX_VALUE
                            + " (was " + value + ")"
            );
        }
        return CACHE[value];
    }

    /**
     * Returns the numeric address value (0–127).
     */
    public int value() {
        return value;
    }

    @Override
    public int compareTo(ParameterAddress other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterAddress that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return "CC " + value;
    }
}
