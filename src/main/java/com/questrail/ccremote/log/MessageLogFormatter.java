package com.questrail.ccremote.log;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders log entries one per line as {@code "[2024/05/01 12:00:00.000] > B0 07 7F"}.
 */
public final class MessageLogFormatter
{
    /** Rendered for a log with no entries. */
    public static final String EMPTY_TEXT = "<No MIDI logs available>";

    private final DateTimeFormatter timestampFormat;

    public MessageLogFormatter() {
        this(ZoneId.systemDefault());
    }

    public MessageLogFormatter(ZoneId zone) {
        this.timestampFormat = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss.SSS")
                .withZone(Objects.requireNonNull(zone, "zone"));
    }

    public String format(MessageLogEntry entry) {
        return "[" + timestampFormat.format(entry.timestamp()) + "] "
                + entry.direction().arrow() + " " + entry.toHexString();
    }

    public String format(Collection<MessageLogEntry> entries) {
        if (entries.isEmpty()) {
            return EMPTY_TEXT;
        }
        return entries.stream().map(this::format).collect(Collectors.joining("\n"));
    }
}
