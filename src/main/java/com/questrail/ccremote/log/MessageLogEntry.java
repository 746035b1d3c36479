package com.questrail.ccremote.log;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One observed wire message: its direction, the raw bytes exactly as they
 * crossed the channel, and the wall-clock time it was logged.
 *
 * <p>The payload is copied on the way in and on the way out; entries are
 * immutable.</p>
 */
public record MessageLogEntry(MessageDirection direction, byte[] bytes, Instant timestamp)
{
    public MessageLogEntry {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(timestamp, "timestamp");
        bytes = Objects.requireNonNull(bytes, "bytes").clone();
    }

    public static MessageLogEntry sent(byte[] bytes, Instant timestamp) {
        return new MessageLogEntry(MessageDirection.SENT, bytes, timestamp);
    }

    public static MessageLogEntry received(byte[] bytes, Instant timestamp) {
        return new MessageLogEntry(MessageDirection.RECEIVED, bytes, timestamp);
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    /**
     * Upper-case hex bytes separated by single spaces, e.g. {@code "B0 07 7F"}.
     */
    public String toHexString() {
        StringBuilder sb = new StringBuilder(bytes.length * 3);
        for (int i = 0; i < bytes.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format("%02X", bytes[i] & 0xFF));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageLogEntry that)) return false;
        return direction == that.direction
                && Arrays.equals(bytes, that.bytes)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, Arrays.hashCode(bytes), timestamp);
    }

    @Override
    public String toString() {
        return "MessageLogEntry[" + direction + " " + toHexString() + " @ " + timestamp + "]";
    }
}
