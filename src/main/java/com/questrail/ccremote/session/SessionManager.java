package com.questrail.ccremote.session;

import com.questrail.ccremote.api.LinkUnavailableException;
import com.questrail.ccremote.config.CcRemoteConfig;
import com.questrail.ccremote.link.DeviceHandle;
import com.questrail.ccremote.link.DeviceLink;
import com.questrail.ccremote.link.InboundChannel;
import com.questrail.ccremote.link.OutboundChannel;
import com.questrail.ccremote.log.MessageLog;
import com.questrail.ccremote.observability.SessionEvent;
import com.questrail.ccremote.preset.Preset;
import com.questrail.ccremote.preset.PresetRepository;
import com.questrail.ccremote.preset.PresetRestorer;
import com.questrail.ccremote.preset.RestoreReport;
import com.questrail.ccremote.store.ParameterStore;

import java.util.Objects;
import java.util.Optional;

/**
 * SessionManager
 * =============================================================================
 * Composition root and lifecycle owner for device sessions and presets.
 *
 * <h2>One session at a time</h2>
 * {@link #open(DeviceHandle)} fully closes the active session (if any) before
 * opening the new device's channels, so two sessions never share a channel.
 * Each session gets a fresh {@link MessageLog}, {@link DeviceLink} and
 * {@link ParameterStore}; cached values do not carry over.
 *
 * <h2>Presets</h2>
 * Presets outlive sessions. The repository is built once from the
 * configuration and restores target whichever session is active.
 */
public final class SessionManager implements AutoCloseable
{
    private final CcRemoteConfig config;
    private final PresetRepository presets;
    private final PresetRestorer restorer;

    private final Object lock = new Object();
    private ControllerSession current;

    public SessionManager(CcRemoteConfig config) {
        this(config, new PresetRepository(config.createPresetStore()));
    }

    public SessionManager(CcRemoteConfig config, PresetRepository presets) {
        this.config = Objects.requireNonNull(config, "config");
        this.presets = Objects.requireNonNull(presets, "presets");
        this.restorer = new PresetRestorer(config.observabilitySink());
    }

    /**
     * Closes the active session, then opens {@code device}.
     *
     * @throws LinkUnavailableException if either channel cannot be opened; the
     *         previous session stays closed, and on this or any other failure
     *         while wiring the session every channel already opened and the
     *         device are released
     */
    public ControllerSession open(DeviceHandle device) {
        Objects.requireNonNull(device, "device");

        synchronized (lock) {
            closeCurrentLocked();

            OutboundChannel outbound = null;
            InboundChannel inbound = null;
            try {
                outbound = device.openOutbound();
                inbound = device.openInbound();

                MessageLog log = new MessageLog(config.logCapacity());
                DeviceLink link = new DeviceLink(outbound, inbound, log,
                        config.midiChannel(), config.wallClock(), config.observabilitySink());
                ParameterStore store = new ParameterStore(link,
                        config.observabilitySink(), config.wallClock(), config.maxDeferredWrites());

                current = new ControllerSession(device, link, store,
                        config.observabilitySink(), config.wallClock());
            } catch (RuntimeException e) {
                releaseAfterFailedOpen(inbound, e);
                releaseAfterFailedOpen(outbound, e);
                releaseAfterFailedOpen(device, e);
                throw e;
            }

            config.observabilitySink().onSessionEvent(
                    new SessionEvent(config.wallClock().now(), SessionEvent.Type.OPENED, device.name()));
            return current;
        }
    }

    public Optional<ControllerSession> current() {
        synchronized (lock) {
            return Optional.ofNullable(current);
        }
    }

    public PresetRepository presets() {
        return presets;
    }

    /**
     * Saves the active session's known values under {@code name}.
     *
     * @throws LinkUnavailableException if no session is open
     */
    public Preset savePreset(String name) {
        return presets.saveCurrent(name, requireSession().store());
    }

    /**
     * Loads {@code name} and applies it to the active session.
     *
     * @return the restore outcome, or empty if no such preset exists
     * @throws LinkUnavailableException if no session is open
     */
    public Optional<RestoreReport> restorePreset(String name) {
        ControllerSession session = requireSession();
        return presets.load(name).map(p -> restorer.apply(p, session.store()));
    }

    private ControllerSession requireSession() {
        synchronized (lock) {
            if (current == null) {
                throw new LinkUnavailableException("No device session is open");
            }
            return current;
        }
    }

    /**
     * Closes the active session, if any. Idempotent.
     */
    @Override
    public void close() {
        synchronized (lock) {
            closeCurrentLocked();
        }
    }

    private static void releaseAfterFailedOpen(AutoCloseable resource, RuntimeException failure) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            failure.addSuppressed(e);
        }
    }

    private void closeCurrentLocked() {
        if (current != null) {
            current.close();
            current = null;
        }
    }
}
