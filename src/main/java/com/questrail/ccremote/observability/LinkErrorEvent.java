package com.questrail.ccremote.observability;

import java.time.Instant;

/**
 * Record representing a failure on the device link that was not surfaced to
 * a caller, or that the caller already received and the sink should also see.
 */
public record LinkErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
