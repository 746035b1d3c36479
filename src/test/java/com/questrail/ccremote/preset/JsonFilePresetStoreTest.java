package com.questrail.ccremote.preset;

import com.questrail.ccremote.api.ParameterAddress;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JsonFilePresetStoreTest
{
    @TempDir
    Path dir;

    @Test
    void missingFileIsEmptyStore() {
        JsonFilePresetStore store = new JsonFilePresetStore(dir.resolve("presets.json"));

        assertTrue(store.keys().isEmpty());
        assertEquals(Optional.empty(), store.get("Lead"));
        assertFalse(Files.exists(store.file()));
    }

    @Test
    void presetsSurviveANewInstance() {
        Path file = dir.resolve("nested").resolve("presets.json");
        PresetRepository first = new PresetRepository(new JsonFilePresetStore(file));
        first.save("Lead", Map.of(ParameterAddress.of(7), 100));
        first.save("Pad", Map.of(ParameterAddress.of(5), 3));
        first.delete("Pad");

        PresetRepository second = new PresetRepository(new JsonFilePresetStore(file));

        assertEquals(List.of("Lead"), second.list());
        assertEquals(Map.of(ParameterAddress.of(7), 100), second.load("Lead").orElseThrow().values());
    }

    @Test
    void writesLeaveNoTemporaryFilesBehind() throws Exception {
        Path file = dir.resolve("presets.json");
        JsonFilePresetStore store = new JsonFilePresetStore(file);
        store.put("a", "{}");
        store.put("b", "{}");

        try (var files = Files.list(dir)) {
            assertEquals(List.of(file), files.toList());
        }
        assertEquals(Set.of("a", "b"), store.keys());
    }

    @Test
    void unreadableFileFailsWithStorageException() throws Exception {
        Path file = dir.resolve("presets.json");
        Files.writeString(file, "this is not json");

        JsonFilePresetStore store = new JsonFilePresetStore(file);

        assertThrows(PresetStorageException.class, store::keys);
    }
}
