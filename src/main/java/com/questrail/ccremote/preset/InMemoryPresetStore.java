package com.questrail.ccremote.preset;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Non-durable {@link PresetStore}; contents are lost with the instance.
 */
public final class InMemoryPresetStore implements PresetStore
{
    private final Map<String, String> entries = new HashMap<>();

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public synchronized void put(String key, String value) {
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public synchronized void remove(String key) {
        entries.remove(Objects.requireNonNull(key, "key"));
    }

    @Override
    public synchronized Set<String> keys() {
        return Set.copyOf(entries.keySet());
    }
}
