package com.questrail.ccremote.preset;

/**
 * Indicates that durable preset storage could not be read or written, or held
 * data that does not decode to a valid address/value mapping.
 */
public final class PresetStorageException extends RuntimeException
{
    public PresetStorageException(String message) {
        super(message);
    }

    public PresetStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
