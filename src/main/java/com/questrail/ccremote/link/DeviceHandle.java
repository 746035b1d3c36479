package com.questrail.ccremote.link;

import com.questrail.ccremote.api.LinkUnavailableException;

/**
 * An openable device, as yielded by {@link DeviceDiscovery}.
 *
 * <p>Each open call either returns a usable channel or fails with
 * {@link LinkUnavailableException}. The handle itself owns whatever device
 * resources back the channels and releases them on {@link #close()}.</p>
 */
public interface DeviceHandle extends AutoCloseable
{
    /**
     * Human-readable name, for device pickers and logs.
     */
    String name();

    OutboundChannel openOutbound();

    InboundChannel openInbound();

    /**
     * Releases the device. Idempotent; channels opened from it must already
     * be closed or are closed by this call.
     */
    @Override
    void close();
}
