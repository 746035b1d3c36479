package com.questrail.ccremote.api;

/**
 * Indicates a construction-time violation in a parameter descriptor, value
 * range, catalog or runtime configuration.
 *
 * <p>This is not recoverable: the offending object is never created.</p>
 */
public final class ConfigInvalidException extends IllegalArgumentException
{
    public ConfigInvalidException(String message) {
        super(message);
    }
}
