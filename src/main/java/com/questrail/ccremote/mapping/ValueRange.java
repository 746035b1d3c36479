package com.questrail.ccremote.mapping;

import com.questrail.ccremote.api.ConfigInvalidException;
import com.questrail.ccremote.format.ProtocolValues;

/**
 * Inclusive range of raw values a control may take.
 *
 * <p>Both bounds lie in the protocol value space (0–127) and {@code min <= max}.</p>
 */
public record ValueRange(int min, int max)
{
    public static final ValueRange FULL = new ValueRange(ProtocolValues.MIN, ProtocolValues.MAX);

    public ValueRange {
        if (!ProtocolValues.isValid(min)) {
            throw new ConfigInvalidException("min must be between 0 and 127 (was " + min + ")");
        }
        if (!ProtocolValues.isValid(max)) {
            throw new ConfigInvalidException("max must be between 0 and 127 (was " + max + ")");
        }
        if (min > max) {
            throw new ConfigInvalidException("min " + min + " exceeds max " + max);
        }
    }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }
}
