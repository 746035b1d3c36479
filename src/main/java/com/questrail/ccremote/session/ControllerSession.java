package com.questrail.ccremote.session;

import com.questrail.ccremote.link.DeviceHandle;
import com.questrail.ccremote.link.DeviceLink;
import com.questrail.ccremote.log.MessageLog;
import com.questrail.ccremote.observability.CcRemoteObservabilitySink;
import com.questrail.ccremote.observability.LinkErrorEvent;
import com.questrail.ccremote.observability.SessionEvent;
import com.questrail.ccremote.store.ParameterStore;
import com.questrail.ccremote.time.WallClock;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One open device: the store, link and message log built for it, and the
 * handle they were opened from.
 *
 * <p>This object is passed explicitly to whatever needs parameter access; there
 * is no global "current session". Closing it closes the store (and with it the
 * link and both channels), then the device handle.</p>
 */
public final class ControllerSession implements AutoCloseable
{
    private final DeviceHandle device;
    private final DeviceLink link;
    private final ParameterStore store;
    private final CcRemoteObservabilitySink sink;
    private final WallClock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ControllerSession(DeviceHandle device,
                      DeviceLink link,
                      ParameterStore store,
                      CcRemoteObservabilitySink sink,
                      WallClock clock) {
        this.device = Objects.requireNonNull(device, "device");
        this.link = Objects.requireNonNull(link, "link");
        this.store = Objects.requireNonNull(store, "store");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String deviceName() {
        return device.name();
    }

    public ParameterStore store() {
        return store;
    }

    public MessageLog messageLog() {
        return link.messageLog();
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        store.close();
        try {
            device.close();
        } catch (RuntimeException e) {
            sink.onLinkError(new LinkErrorEvent(clock.now(), "Failed to close device " + device.name(), e));
        }
        sink.onSessionEvent(new SessionEvent(clock.now(), SessionEvent.Type.CLOSED, device.name()));
    }
}
