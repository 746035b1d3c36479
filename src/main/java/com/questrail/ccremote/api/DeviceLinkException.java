package com.questrail.ccremote.api;

/**
 * Base type for failures to deliver a control-change message to the device.
 *
 * <p>These are transport defects surfaced to the immediate caller. They never
 * leave cached parameter state modified.</p>
 */
public abstract class DeviceLinkException extends RuntimeException
{
    protected DeviceLinkException(String message) {
        super(message);
    }

    protected DeviceLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
