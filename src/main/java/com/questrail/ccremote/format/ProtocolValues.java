package com.questrail.ccremote.format;

/**
 * Numeric constants of the control-change value space.
 */
public final class ProtocolValues
{
    /** Smallest value a control-change message can carry. */
    public static final int MIN = 0;

    /** Largest value a control-change message can carry. */
    public static final int MAX = 127;

    /** Rest value of bilateral and offset controls. */
    public static final int MIDPOINT = 64;

    private ProtocolValues() {
    }

    public static boolean isValid(int value) {
        return value >= MIN && value <= MAX;
    }
}
