package com.questrail.ccremote.preset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * {@link PresetStore} persisted as a single JSON object file,
 * {@code {"<name>": "<serialized preset>", ...}}.
 *
 * <h2>Durability</h2>
 * The file is read once, on first access. Every mutation rewrites it through a
 * temporary sibling file that is then moved over the target, so a crash never
 * leaves a half-written store. A missing file is an empty store.
 *
 * <h2>Threading</h2>
 * All methods are synchronized on the instance. Two instances pointing at the
 * same file do not see each other's writes.
 */
public final class JsonFilePresetStore implements PresetStore
{
    private static final Logger log = LoggerFactory.getLogger(JsonFilePresetStore.class);

    private static final TypeReference<TreeMap<String, String>> FILE_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    private TreeMap<String, String> entries;

    public JsonFilePresetStore(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonFilePresetStore(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(entries().get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        TreeMap<String, String> updated = new TreeMap<>(entries());
        updated.put(key, value);
        persist(updated);
    }

    @Override
    public synchronized void remove(String key) {
        Objects.requireNonNull(key, "key");
        if (!entries().containsKey(key)) {
            return;
        }

        TreeMap<String, String> updated = new TreeMap<>(entries());
        updated.remove(key);
        persist(updated);
    }

    @Override
    public synchronized Set<String> keys() {
        return Set.copyOf(entries().keySet());
    }

    private TreeMap<String, String> entries() {
        if (entries == null) {
            entries = read();
        }
        return entries;
    }

    private TreeMap<String, String> read() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, String> loaded = mapper.readValue(file.toFile(), FILE_TYPE);
            log.debug("Loaded {} presets from {}", loaded == null ? 0 : loaded.size(), file);
            return loaded == null ? new TreeMap<>() : loaded;
        } catch (IOException e) {
            throw new PresetStorageException("Failed to read presets from " + file, e);
        }
    }

    /**
     * Writes {@code updated} and adopts it as the current state only once the
     * file is in place.
     */
    private void persist(Map<String, String> updated) {
        Path parent = file.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), updated);
                move(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new PresetStorageException("Failed to write presets to " + file, e);
        }
        entries = new TreeMap<>(updated);
    }

    private void move(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
