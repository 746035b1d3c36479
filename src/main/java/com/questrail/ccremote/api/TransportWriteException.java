package com.questrail.ccremote.api;

/**
 * Indicates that the outbound channel rejected a write.
 */
public final class TransportWriteException extends DeviceLinkException
{
    public TransportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
