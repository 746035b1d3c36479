package com.questrail.ccremote.link;

/**
 * Callback sink for {@link InboundChannel}.
 */
public interface InboundReceiver
{
    /**
     * Called with bytes exactly as received. The array is owned by the callee.
     */
    void onBytes(byte[] payload);

    /**
     * Called when the channel fails while receiving.
     */
    void onReceiveError(Throwable cause);
}
