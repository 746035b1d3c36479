package com.questrail.ccremote.preset;

import java.util.Optional;
import java.util.Set;

/**
 * Durable string key/value storage for serialized presets.
 *
 * <p>Keys are preset names; values are opaque serialized mappings. Writes are
 * upserts; removing an absent key is a no-op. Any method may fail with
 * {@link PresetStorageException} when the backing storage does.</p>
 */
public interface PresetStore
{
    Optional<String> get(String key);

    void put(String key, String value);

    void remove(String key);

    Set<String> keys();
}
