package com.questrail.ccremote.link;

import com.questrail.ccremote.api.LinkUnavailableException;

/**
 * Test-only {@link DeviceHandle} over fake channels.
 */
public final class FakeDeviceHandle implements DeviceHandle {

    private final String name;
    private final FakeOutboundChannel outbound = new FakeOutboundChannel();
    private final FakeInboundChannel inbound = new FakeInboundChannel();

    private boolean outboundUnavailable;
    private boolean inboundUnavailable;
    private int closeCount;

    public FakeDeviceHandle(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public OutboundChannel openOutbound() {
        if (outboundUnavailable) {
            throw new LinkUnavailableException("Failed to open device's MIDI input port.");
        }
        return outbound;
    }

    @Override
    public InboundChannel openInbound() {
        if (inboundUnavailable) {
            throw new LinkUnavailableException("Failed to open device's MIDI output port.");
        }
        return inbound;
    }

    @Override
    public synchronized void close() {
        closeCount++;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public FakeDeviceHandle withOutboundUnavailable() {
        this.outboundUnavailable = true;
        return this;
    }

    public FakeDeviceHandle withInboundUnavailable() {
        this.inboundUnavailable = true;
        return this;
    }

    public FakeOutboundChannel outbound() {
        return outbound;
    }

    public FakeInboundChannel inbound() {
        return inbound;
    }

    public synchronized int closeCount() {
        return closeCount;
    }
}
