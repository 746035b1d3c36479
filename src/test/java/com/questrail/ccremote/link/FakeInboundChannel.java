package com.questrail.ccremote.link;

import java.util.Objects;

/**
 * Test-only {@link InboundChannel} that lets tests inject received bytes.
 */
public final class FakeInboundChannel implements InboundChannel {

    private volatile InboundReceiver receiver;
    private volatile RuntimeException connectFailure;
    private int closeCount;

    @Override
    public void connect(InboundReceiver receiver) {
        RuntimeException failure = connectFailure;
        if (failure != null) {
            throw failure;
        }
        this.receiver = Objects.requireNonNull(receiver, "receiver");
    }

    @Override
    public synchronized void close() {
        closeCount++;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /** Every subsequent {@link #connect} throws {@code e}. */
    public void failOnConnect(RuntimeException e) {
        this.connectFailure = e;
    }

    public void inject(byte... payload) {
        InboundReceiver r = receiver;
        if (r == null) {
            throw new IllegalStateException("No receiver connected");
        }
        r.onBytes(payload);
    }

    public void injectError(Throwable cause) {
        InboundReceiver r = receiver;
        if (r == null) {
            throw new IllegalStateException("No receiver connected");
        }
        r.onReceiveError(cause);
    }

    public boolean isConnected() {
        return receiver != null;
    }

    public synchronized int closeCount() {
        return closeCount;
    }
}
