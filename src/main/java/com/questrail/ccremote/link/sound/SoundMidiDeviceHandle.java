package com.questrail.ccremote.link.sound;

import com.questrail.ccremote.api.LinkUnavailableException;
import com.questrail.ccremote.link.DeviceHandle;
import com.questrail.ccremote.link.InboundChannel;
import com.questrail.ccremote.link.InboundReceiver;
import com.questrail.ccremote.link.OutboundChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.midi.InvalidMidiDataException;
import javax.sound.midi.MidiDevice;
import javax.sound.midi.MidiMessage;
import javax.sound.midi.MidiUnavailableException;
import javax.sound.midi.Receiver;
import javax.sound.midi.ShortMessage;
import javax.sound.midi.Transmitter;
import java.io.IOException;
import java.util.Objects;

/**
 * {@link DeviceHandle} backed by {@code javax.sound.midi}.
 *
 * <h2>Port pairing</h2>
 * Java Sound usually reports a hardware interface as two {@link MidiDevice}s
 * sharing one name: one that accepts {@link Receiver}s (we write to it) and one
 * that provides {@link Transmitter}s (we read from it). Either side may be
 * absent; opening a missing side fails with {@link LinkUnavailableException}.
 *
 * <h2>Containment rule</h2>
 * Java Sound types do not escape this package. Outbound payloads must be
 * 3-byte short messages; inbound messages are delivered as raw bytes.
 */
public final class SoundMidiDeviceHandle implements DeviceHandle
{
    private static final Logger log = LoggerFactory.getLogger(SoundMidiDeviceHandle.class);

    private final String name;
    private final MidiDevice receiverSide;
    private final MidiDevice transmitterSide;

    SoundMidiDeviceHandle(String name, MidiDevice receiverSide, MidiDevice transmitterSide) {
        this.name = Objects.requireNonNull(name, "name");
        this.receiverSide = receiverSide;
        this.transmitterSide = transmitterSide;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public OutboundChannel openOutbound() {
        if (receiverSide == null) {
            throw new LinkUnavailableException("Device '" + name + "' has no MIDI input port");
        }
        try {
            open(receiverSide);
            return new ReceiverChannel(receiverSide.getReceiver());
        } catch (MidiUnavailableException e) {
            throw new LinkUnavailableException("Failed to open device's MIDI input port: " + name, e);
        }
    }

    @Override
    public InboundChannel openInbound() {
        if (transmitterSide == null) {
            throw new LinkUnavailableException("Device '" + name + "' has no MIDI output port");
        }
        try {
            open(transmitterSide);
            return new TransmitterChannel(transmitterSide.getTransmitter());
        } catch (MidiUnavailableException e) {
            throw new LinkUnavailableException("Failed to open device's MIDI output port: " + name, e);
        }
    }

    private static void open(MidiDevice device) throws MidiUnavailableException {
        if (!device.isOpen()) {
            device.open();
        }
    }

    @Override
    public void close() {
        if (receiverSide != null && receiverSide.isOpen()) {
            receiverSide.close();
        }
        if (transmitterSide != null && transmitterSide != receiverSide && transmitterSide.isOpen()) {
            transmitterSide.close();
        }
    }

    @Override
    public String toString() {
        return "SoundMidiDeviceHandle[" + name + "]";
    }

    private static final class ReceiverChannel implements OutboundChannel
    {
        private final Receiver receiver;

        ReceiverChannel(Receiver receiver) {
            this.receiver = receiver;
        }

        @Override
        public void send(byte[] message) throws IOException {
            if (message.length != 3) {
                throw new IOException("Only 3-byte short messages are supported (got " + message.length + ")");
            }
            try {
                ShortMessage m = new ShortMessage(message[0] & 0xFF, message[1] & 0xFF, message[2] & 0xFF);
                receiver.send(m, -1);
            } catch (InvalidMidiDataException | IllegalStateException e) {
                throw new IOException(e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            receiver.close();
        }
    }

    private static final class TransmitterChannel implements InboundChannel
    {
        private final Transmitter transmitter;

        TransmitterChannel(Transmitter transmitter) {
            this.transmitter = transmitter;
        }

        @Override
        public void connect(InboundReceiver target) {
            Objects.requireNonNull(target, "target");
            transmitter.setReceiver(new Receiver() {
                @Override
                public void send(MidiMessage message, long timeStamp) {
                    // timeStamp is device time in microseconds, not wall time.
                    try {
                        target.onBytes(message.getMessage());
                    } catch (RuntimeException e) {
                        log.warn("Inbound MIDI delivery failed", e);
                        target.onReceiveError(e);
                    }
                }

                @Override
                public void close() {
                }
            });
        }

        @Override
        public void close() {
            transmitter.close();
        }
    }
}
