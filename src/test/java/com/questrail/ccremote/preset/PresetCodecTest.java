package com.questrail.ccremote.preset;

import com.questrail.ccremote.api.ParameterAddress;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PresetCodecTest
{
    private final PresetCodec codec = new PresetCodec();

    @Test
    void decodesAddressKeyedObject() {
        assertEquals(Map.of(ParameterAddress.of(5), 10, ParameterAddress.of(127), 0),
                codec.decode("{\"127\": 0, \"5\": 10}"));
    }

    @Test
    void emptyObjectIsEmptyPreset() {
        assertTrue(codec.decode("{}").isEmpty());
        assertEquals("{}", codec.encode(Map.of()));
    }

    @Test
    void rejectsOutOfRangeEntries() {
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"128\": 1}"));
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"5\": 128}"));
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"5\": -1}"));
    }

    @Test
    void rejectsValuesThatOnlyCoerceToIntegers() {
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"5\": 10.9}"));
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"5\": 10.0}"));
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"7\": \"20\"}"));
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"7\": \"\"}"));
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"5\": 10.9, \"7\": \"20\"}"));
    }

    @Test
    void rejectsMalformedText() {
        assertThrows(PresetStorageException.class, () -> codec.decode("[1, 2]"));
        assertThrows(PresetStorageException.class, () -> codec.decode("{\"volume\": 1}"));
        assertThrows(PresetStorageException.class, () -> codec.decode("{"));
    }
}
