package com.questrail.ccremote.config;

import com.questrail.ccremote.api.ConfigInvalidException;
import com.questrail.ccremote.log.MessageLog;
import com.questrail.ccremote.observability.CcRemoteObservabilitySink;
import com.questrail.ccremote.observability.NullObservabilitySink;
import com.questrail.ccremote.preset.InMemoryPresetStore;
import com.questrail.ccremote.preset.JsonFilePresetStore;
import com.questrail.ccremote.preset.PresetStore;
import com.questrail.ccremote.store.ParameterStore;
import com.questrail.ccremote.time.SystemWallClock;
import com.questrail.ccremote.time.WallClock;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for controller sessions.
 */
public record CcRemoteConfig(
    int logCapacity,
    int midiChannel,
    int maxDeferredWrites,
    Optional<Path> presetFile,
    CcRemoteObservabilitySink observabilitySink,
    WallClock wallClock
) {
    public CcRemoteConfig {
        if (logCapacity < 1) {
            throw new ConfigInvalidException("logCapacity must be >= 1 (was " + logCapacity + ")");
        }
        if (midiChannel < 0 || midiChannel > 15) {
            throw new ConfigInvalidException("midiChannel must be 0-15 (was " + midiChannel + ")");
        }
        if (maxDeferredWrites < 0) {
            throw new ConfigInvalidException("maxDeferredWrites must be >= 0 (was " + maxDeferredWrites + ")");
        }
        Objects.requireNonNull(presetFile, "presetFile");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    public static CcRemoteConfig defaults() {
        return builder().build();
    }

    /**
     * Preset storage for this configuration: file-backed when a preset file is
     * configured, in memory otherwise.
     */
    public PresetStore createPresetStore() {
        return presetFile.<PresetStore>map(JsonFilePresetStore::new).orElseGet(InMemoryPresetStore::new);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int logCapacity = MessageLog.DEFAULT_CAPACITY;
        private int midiChannel = 0;
        private int maxDeferredWrites = ParameterStore.DEFAULT_MAX_DEFERRED_WRITES;
        private Path presetFile;
        private CcRemoteObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withLogCapacity(int logCapacity) {
            this.logCapacity = logCapacity;
            return this;
        }

        public Builder withMidiChannel(int midiChannel) {
            this.midiChannel = midiChannel;
            return this;
        }

        public Builder withMaxDeferredWrites(int maxDeferredWrites) {
            this.maxDeferredWrites = maxDeferredWrites;
            return this;
        }

        public Builder withPresetFile(Path presetFile) {
            this.presetFile = presetFile;
            return this;
        }

        public Builder withObservabilitySink(CcRemoteObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public CcRemoteConfig build() {
            return new CcRemoteConfig(
                logCapacity,
                midiChannel,
                maxDeferredWrites,
                Optional.ofNullable(presetFile),
                observabilitySink,
                wallClock);
        }
    }
}
