package com.questrail.ccremote.preset;

import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.ParameterController;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PresetRepository
 * -----------------------------------------------------------------------------
 * Saves, lists, loads and deletes named presets in a {@link PresetStore}.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>{@link #save} is an upsert; confirming an overwrite is the UI's job</li>
 *   <li>{@link #list} is lexicographic by name</li>
 *   <li>{@link #load} of an unknown name is {@link Optional#empty()}, not an error</li>
 *   <li>{@link #delete} of an unknown name is a no-op</li>
 * </ul>
 *
 * Loading never applies a preset. Use {@link PresetRestorer} for that.
 *
 * <h2>Names</h2>
 * Names are trimmed before use; a blank name is rejected.
 */
public final class PresetRepository
{
    private final PresetStore store;
    private final PresetCodec codec;

    public PresetRepository(PresetStore store) {
        this(store, new PresetCodec());
    }

    public PresetRepository(PresetStore store, PresetCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public void save(String name, Map<ParameterAddress, Integer> values) {
        Objects.requireNonNull(values, "values");
        store.put(normalize(name), codec.encode(values));
    }

    /**
     * Saves every currently known value of {@code controller}.
     *
     * @return the saved preset
     */
    public Preset saveCurrent(String name, ParameterController controller) {
        Objects.requireNonNull(controller, "controller");
        Preset preset = Preset.of(normalize(name), controller.getAllKnownValues());
        save(preset.name(), preset.values());
        return preset;
    }

    public List<String> list() {
        return store.keys().stream().sorted().toList();
    }

    public boolean exists(String name) {
        return store.get(normalize(name)).isPresent();
    }

    public Optional<Preset> load(String name) {
        String key = normalize(name);
        return store.get(key).map(text -> new Preset(key, codec.decode(text)));
    }

    public void delete(String name) {
        store.remove(normalize(name));
    }

    private static String normalize(String name) {
        Objects.requireNonNull(name, "name");
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Preset name must not be blank");
        }
        return trimmed;
    }
}
