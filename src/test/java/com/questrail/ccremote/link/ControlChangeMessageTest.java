package com.questrail.ccremote.link;

import com.questrail.ccremote.api.ParameterAddress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ControlChangeMessageTest
{
    @Test
    void encodesStatusAddressValue() {
        assertArrayEquals(new byte[] {(byte) 0xB0, 7, 127},
                new ControlChangeMessage(0, ParameterAddress.of(7), 127).encode());
        assertArrayEquals(new byte[] {(byte) 0xBF, 0, 0},
                new ControlChangeMessage(15, ParameterAddress.of(0), 0).encode());
    }

    @Test
    void rejectsOutOfRangeValueAndChannel() {
        ParameterAddress cc7 = ParameterAddress.of(7);

        assertThrows(IllegalArgumentException.class, () -> new ControlChangeMessage(0, cc7, 128));
        assertThrows(IllegalArgumentException.class, () -> new ControlChangeMessage(0, cc7, -1));
        assertThrows(IllegalArgumentException.class, () -> new ControlChangeMessage(16, cc7, 0));
    }
}
