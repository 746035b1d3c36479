package com.questrail.ccremote.link.udp.netty;

import com.questrail.ccremote.api.LinkUnavailableException;
import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.link.DeviceLink;
import com.questrail.ccremote.log.MessageDirection;
import com.questrail.ccremote.log.MessageLog;
import com.questrail.ccremote.log.MessageLogEntry;
import com.questrail.ccremote.observability.NullObservabilitySink;
import com.questrail.ccremote.time.SystemWallClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loopback tests against a plain datagram socket standing in for the network
 * MIDI bridge.
 */
class NettyUdpDeviceHandleTest
{
    private DatagramSocket bridge;
    private NettyUdpDeviceHandle handle;

    @BeforeEach
    void setUp() throws Exception {
        InetAddress loopback = InetAddress.getLoopbackAddress();
        bridge = new DatagramSocket(0, loopback);
        bridge.setSoTimeout(5_000);
        handle = new NettyUdpDeviceHandle("bridge",
                new InetSocketAddress(loopback, 0),
                new InetSocketAddress(loopback, bridge.getLocalPort()));
    }

    @AfterEach
    void tearDown() {
        handle.close();
        bridge.close();
    }

    @Test
    void sendsOneControlChangePerDatagram() throws Exception {
        MessageLog log = new MessageLog();
        DeviceLink link = new DeviceLink(handle.openOutbound(), handle.openInbound(), log, 0,
                SystemWallClock.INSTANCE, NullObservabilitySink.INSTANCE);

        link.sendParameterChange(ParameterAddress.of(7), 127);

        DatagramPacket packet = new DatagramPacket(new byte[16], 16);
        bridge.receive(packet);
        assertArrayEquals(new byte[] {(byte) 0xB0, 7, 127},
                Arrays.copyOf(packet.getData(), packet.getLength()));
        assertEquals(1, log.size());
        link.close();
    }

    @Test
    void receivedDatagramsAreLogged() throws Exception {
        MessageLog log = new MessageLog();
        CountDownLatch received = new CountDownLatch(1);
        log.setObserver(e -> {
            if (e.direction() == MessageDirection.RECEIVED) {
                received.countDown();
            }
        });
        DeviceLink link = new DeviceLink(handle.openOutbound(), handle.openInbound(), log, 0,
                SystemWallClock.INSTANCE, NullObservabilitySink.INSTANCE);

        byte[] payload = {(byte) 0x90, 60, 100};
        bridge.send(new DatagramPacket(payload, payload.length, handle.localAddress()));

        assertTrue(received.await(5, TimeUnit.SECONDS));
        List<MessageLogEntry> entries = log.snapshot();
        assertEquals("90 3C 64", entries.get(entries.size() - 1).toHexString());
        link.close();
    }

    @Test
    void closedHandleCannotBeOpened() {
        handle.close();

        assertThrows(LinkUnavailableException.class, handle::openOutbound);
    }
}
