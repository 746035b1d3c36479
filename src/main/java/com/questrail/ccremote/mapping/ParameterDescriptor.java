package com.questrail.ccremote.mapping;

import com.questrail.ccremote.api.ConfigInvalidException;
import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.ParameterValue;
import com.questrail.ccremote.format.ProtocolValues;
import com.questrail.ccremote.format.ValueFormatter;

import java.util.Objects;

/**
 * ParameterDescriptor
 * -----------------------------------------------------------------------------
 * Static description of one continuously adjustable device parameter: its
 * display name, wire address, valid range, default value and formatter.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code range} lies within 0–127 (enforced by {@link ValueRange})</li>
 *   <li>{@code defaultValue} lies within {@code range}</li>
 * </ul>
 * A violation rejects construction with {@link ConfigInvalidException}.
 *
 * <p>Descriptors are created once and never persisted; only their
 * address/value pairs are.</p>
 */
public record ParameterDescriptor(
        String name,
        ParameterAddress address,
        ValueRange range,
        int defaultValue,
        ValueFormatter formatter
) {
    /** Rendered in place of a value that has never been set. */
    public static final String UNKNOWN_TEXT = "???";

    public ParameterDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(formatter, "formatter");
        if (!range.contains(defaultValue)) {
            throw new ConfigInvalidException(
                    name + ": default " + defaultValue + " outside [" + range.min() + ", " + range.max() + "]");
        }
    }

    /**
     * Full-range descriptor.
     *
     * @throws ConfigInvalidException if {@code address} or {@code defaultValue}
     *         falls outside the protocol space
     */
    public static ParameterDescriptor of(String name, int address, int defaultValue, ValueFormatter formatter) {
        return of(name, address, ValueRange.FULL, defaultValue, formatter);
    }

    public static ParameterDescriptor of(String name, int address, ValueRange range,
                                         int defaultValue, ValueFormatter formatter) {
        if (address < ParameterAddress.MIN_VALUE || address > ParameterAddress.MAX_VALUE) {
            throw new ConfigInvalidException(name + ": address " + address + " outside 0–127");
        }
        return new ParameterDescriptor(name, ParameterAddress.of(address), range, defaultValue, formatter);
    }

    public static ParameterDescriptor percent(String name, int address, int defaultValue, int maxPercent) {
        return of(name, address, defaultValue, ValueFormatter.percent(maxPercent));
    }

    /**
     * Bilateral parameters rest at the midpoint.
     */
    public static ParameterDescriptor bilateral(String name, int address, int extreme) {
        return of(name, address, ProtocolValues.MIDPOINT, ValueFormatter.bilateral(extreme));
    }

    public static ParameterDescriptor linear(String name, int address, double min, double max, int defaultValue) {
        return of(name, address, defaultValue, ValueFormatter.linear(min, max));
    }

    public static ParameterDescriptor noteRange(String name, int address, int defaultValue) {
        return of(name, address, defaultValue, ValueFormatter.noteName());
    }

    public String format(int value) {
        return formatter.format(value);
    }

    /**
     * {@code "<name> (CC <address>): <value> (min: <min>, max: <max>)"}, with
     * {@value #UNKNOWN_TEXT} for an unknown value.
     */
    public String label(ParameterValue value) {
        Objects.requireNonNull(value, "value");
        String current = value.isKnown() ? format(value.value()) : UNKNOWN_TEXT;
        return name + " (CC " + address.value() + "): " + current
                + " (min: " + format(range.min()) + ", max: " + format(range.max()) + ")";
    }

    public String defaultLabel() {
        return "Default (" + format(defaultValue) + ")";
    }
}
