package com.questrail.ccremote.link;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Test-only {@link OutboundChannel} that records writes and can be told to
 * reject them.
 */
public final class FakeOutboundChannel implements OutboundChannel {

    private final List<byte[]> sent = new ArrayList<>();
    private IOException failure;
    private int failAfter = -1;
    private int closeCount;

    @Override
    public synchronized void send(byte[] message) throws IOException {
        Objects.requireNonNull(message, "message");
        if (failure != null && (failAfter < 0 || sent.size() >= failAfter)) {
            IOException e = failure;
            if (failAfter >= 0) {
                failure = null;
                failAfter = -1;
            }
            throw e;
        }
        sent.add(message.clone());
    }

    @Override
    public synchronized void close() {
        closeCount++;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /** Every subsequent write fails with {@code e}; {@code null} heals the channel. */
    public synchronized void failWith(IOException e) {
        this.failure = e;
        this.failAfter = -1;
    }

    /** Exactly one write fails: the one attempted once {@code n} writes have succeeded. */
    public synchronized void failOnceAfter(int n, IOException e) {
        this.failure = e;
        this.failAfter = n;
    }

    public synchronized List<byte[]> sent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public synchronized int closeCount() {
        return closeCount;
    }
}
