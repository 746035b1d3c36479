package com.questrail.ccremote.api;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ParameterValueTest
{
    @Test
    void zeroIsKnownAndDistinctFromUnknown() {
        ParameterValue zero = ParameterValue.known(0);

        assertTrue(zero.isKnown());
        assertFalse(ParameterValue.UNKNOWN.isKnown());
        assertNotEquals(ParameterValue.UNKNOWN, zero);
        assertEquals(OptionalInt.of(0), zero.asOptionalInt());
        assertEquals(OptionalInt.empty(), ParameterValue.UNKNOWN.asOptionalInt());
    }

    @Test
    void unknownHasNoValue() {
        assertThrows(NoSuchElementException.class, ParameterValue.UNKNOWN::value);
    }

    @Test
    void knownValuesAreRangeChecked() {
        assertEquals(127, ParameterValue.known(127).value());
        assertThrows(IllegalArgumentException.class, () -> ParameterValue.known(-1));
        assertThrows(IllegalArgumentException.class, () -> ParameterValue.known(128));
    }

    @Test
    void addressesAreRangeCheckedAndOrdered() {
        assertEquals(ParameterAddress.of(7), ParameterAddress.of(7));
        assertTrue(ParameterAddress.of(5).compareTo(ParameterAddress.of(7)) < 0);
        assertEquals("CC 7", ParameterAddress.of(7).toString());
        assertThrows(IllegalArgumentException.class, () -> ParameterAddress.of(-1));
        assertThrows(IllegalArgumentException.class, () -> ParameterAddress.of(128));
    }
}
