package com.questrail.ccremote.log;

/**
 * Direction of a logged wire message, relative to this controller.
 */
public enum MessageDirection
{
    /** Written to the device. */
    SENT(">"),

    /** Received from the device, logged verbatim. */
    RECEIVED("<");

    private final String arrow;

    MessageDirection(String arrow) {
        this.arrow = arrow;
    }

    public String arrow() {
        return arrow;
    }
}
