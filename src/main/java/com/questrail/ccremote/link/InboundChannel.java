package com.questrail.ccremote.link;

/**
 * Readable half of a device connection.
 *
 * <p>Delivery happens on a transport-owned thread, asynchronously with respect
 * to outbound writes.</p>
 */
public interface InboundChannel extends AutoCloseable
{
    /**
     * Routes all subsequently received bytes to {@code receiver}. Replaces any
     * previously connected receiver.
     */
    void connect(InboundReceiver receiver);

    /**
     * Stops delivery and releases the channel. Must be safe to call more than once.
     */
    @Override
    void close();
}
