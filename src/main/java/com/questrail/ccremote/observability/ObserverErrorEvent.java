package com.questrail.ccremote.observability;

import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.ParameterValue;

import java.time.Instant;

/**
 * Record representing a parameter observer that threw while being notified.
 * The write that triggered the notification had already completed.
 */
public record ObserverErrorEvent(
    Instant timestamp,
    ParameterAddress address,
    ParameterValue value,
    RuntimeException cause
) {
}
