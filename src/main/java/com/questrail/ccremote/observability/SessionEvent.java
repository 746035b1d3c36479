package com.questrail.ccremote.observability;

import java.time.Instant;

/**
 * Record representing a session lifecycle transition.
 */
public record SessionEvent(
    Instant timestamp,
    Type type,
    String deviceName
) {
    public enum Type { OPENED, CLOSED }
}
