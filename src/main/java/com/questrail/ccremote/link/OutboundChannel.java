package com.questrail.ccremote.link;

import java.io.IOException;

/**
 * Writable half of a device connection.
 *
 * <p>Implementations perform transport I/O only. They do not encode, log, or
 * retry.</p>
 */
public interface OutboundChannel extends AutoCloseable
{
    /**
     * Writes one complete message.
     *
     * @throws IOException if the transport rejected the write
     */
    void send(byte[] message) throws IOException;

    /**
     * Releases the channel. Must be safe to call more than once.
     */
    @Override
    void close();
}
