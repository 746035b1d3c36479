package com.questrail.ccremote.link;

import com.questrail.ccremote.api.LinkUnavailableException;
import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.TransportWriteException;
import com.questrail.ccremote.log.MessageLog;
import com.questrail.ccremote.log.MessageLogEntry;
import com.questrail.ccremote.observability.CcRemoteObservabilitySink;
import com.questrail.ccremote.observability.LinkErrorEvent;
import com.questrail.ccremote.time.WallClock;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * DeviceLink
 * =============================================================================
 * Owns the outbound and inbound channel of one device session and is the only
 * place where control-change messages are encoded and logged.
 *
 * <h2>Outbound path</h2>
 * <pre>
 *   sendParameterChange(address, value)
 *        → ControlChangeMessage.encode()
 *            → OutboundChannel.send(...)
 *                → MessageLog.append(SENT)   (only after a successful write)
 * </pre>
 *
 * <h2>Inbound path</h2>
 * Bytes arriving on the inbound channel are appended to the log as
 * {@code RECEIVED} entries verbatim. They are never parsed, never block the
 * sender, and never raise to anyone: failures on this path go to the
 * observability sink.
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>{@link LinkUnavailableException}: no outbound channel (closed link)</li>
 *   <li>{@link TransportWriteException}: the channel rejected the write</li>
 * </ul>
 * In both cases nothing is logged as sent, and the caller must not update any
 * cached state.
 */
public final class DeviceLink implements AutoCloseable
{
    private final MessageLog log;
    private final int channel;
    private final WallClock clock;
    private final CcRemoteObservabilitySink sink;

    private final Object sendLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile OutboundChannel outbound;
    private volatile InboundChannel inbound;

    /**
     * @param outbound open outbound channel; {@code null} yields a link on which
     *                 every send fails with {@link LinkUnavailableException}
     * @param inbound  open inbound channel; may be {@code null} for send-only devices
     */
    public DeviceLink(OutboundChannel outbound,
                      InboundChannel inbound,
                      MessageLog log,
                      int channel,
                      WallClock clock,
                      CcRemoteObservabilitySink sink) {
        if (channel < 0 || channel > 15) {
            throw new IllegalArgumentException("MIDI channel must be 0–15 (was " + channel + ")");
        }
        this.outbound = outbound;
        this.inbound = inbound;
        this.log = Objects.requireNonNull(log, "log");
        this.channel = channel;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = Objects.requireNonNull(sink, "sink");

        if (inbound != null) {
            inbound.connect(new LoggingReceiver());
        }
    }

    /**
     * Encodes and writes {@code [0xB0 | channel, address, value]}, then logs it
     * as sent.
     *
     * @throws IllegalArgumentException if {@code value} is outside 0–127
     * @throws LinkUnavailableException if the link has no outbound channel
     * @throws TransportWriteException if the write failed
     */
    public void sendParameterChange(ParameterAddress address, int value) {
        byte[] message = new ControlChangeMessage(channel, address, value).encode();

        synchronized (sendLock) {
            OutboundChannel out = outbound;
            if (out == null) {
                throw new LinkUnavailableException("No outbound channel open for " + address);
            }
            try {
                out.send(message);
            } catch (IOException | RuntimeException e) {
                throw new TransportWriteException("Error sending MIDI " + address + ": " + e.getMessage(), e);
            }
        }

        append(MessageLogEntry.sent(message, clock.now()));
    }

    public MessageLog messageLog() {
        return log;
    }

    public boolean isOpen() {
        return !closed.get() && outbound != null;
    }

    /**
     * Releases both channels. Idempotent; failures while closing are reported
     * to the sink, never thrown.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        OutboundChannel out;
        synchronized (sendLock) {
            out = outbound;
            outbound = null;
        }
        InboundChannel in = inbound;
        inbound = null;

        closeQuietly(out, "outbound");
        closeQuietly(in, "inbound");
    }

    private void closeQuietly(AutoCloseable c, String which) {
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (Exception e) {
            sink.onLinkError(new LinkErrorEvent(clock.now(), "Failed to close " + which + " channel", e));
        }
    }

    private void append(MessageLogEntry entry) {
        log.append(entry);
        sink.onMessageLogged(entry);
    }

    /**
     * Logs inbound traffic verbatim. Runs on the transport's delivery thread.
     */
    private final class LoggingReceiver implements InboundReceiver
    {
        @Override
        public void onBytes(byte[] payload) {
            if (closed.get() || payload == null) {
                return;
            }
            try {
                append(MessageLogEntry.received(payload, clock.now()));
            } catch (RuntimeException e) {
                sink.onLinkError(new LinkErrorEvent(clock.now(), "Failed to log inbound message", e));
            }
        }

        @Override
        public void onReceiveError(Throwable cause) {
            sink.onLinkError(new LinkErrorEvent(clock.now(), "Inbound channel error", cause));
        }
    }
}
