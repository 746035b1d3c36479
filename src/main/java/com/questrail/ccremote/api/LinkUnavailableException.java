package com.questrail.ccremote.api;

/**
 * Indicates that no outbound channel is open: the link was never opened, has
 * been closed, or the device could not be opened.
 */
public final class LinkUnavailableException extends DeviceLinkException
{
    public LinkUnavailableException(String message) {
        super(message);
    }

    public LinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
