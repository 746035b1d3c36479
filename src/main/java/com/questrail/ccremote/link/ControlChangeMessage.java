package com.questrail.ccremote.link;

import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.format.ProtocolValues;

import java.util.Objects;

/**
 * A 3-byte control-change message: {@code [0xB0 | channel, address, value]}.
 *
 * <p>This is the only message kind this controller sends.</p>
 */
public record ControlChangeMessage(int channel, ParameterAddress address, int value)
{
    /** Control-change status nibble. */
    public static final int STATUS = 0xB0;

    /** Encoded length in bytes. */
    public static final int LENGTH = 3;

    public ControlChangeMessage {
        if (channel < 0 || channel > 15) {
            throw new IllegalArgumentException("MIDI channel must be 0–15 (was " + channel + ")");
        }
        Objects.requireNonNull(address, "address");
        if (!ProtocolValues.isValid(value)) {
            throw new IllegalArgumentException("Control value must be 0–127 (was " + value + ")");
        }
    }

    public byte[] encode() {
        return new byte[] {
                (byte) (STATUS | channel),
                (byte) address.value(),
                (byte) value
        };
    }
}
