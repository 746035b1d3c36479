package com.questrail.ccremote.format;

import com.questrail.ccremote.api.ConfigInvalidException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * ValueFormatter
 * -----------------------------------------------------------------------------
 * Maps a raw control value (0–127) to the text a human reads next to the
 * control.
 *
 * <h2>Closed variant set</h2>
 * The mapping kinds are fixed and exhaustive, so this is a sealed interface
 * whose permitted implementations are the nested records below. Each variant is
 * fully determined by its record components and carries no mutable state.
 *
 * <h2>Contract</h2>
 * {@link #format(int)} is pure and total over {@link ProtocolValues#MIN}–
 * {@link ProtocolValues#MAX}. Behavior for values outside that domain is
 * undefined; callers guard with the descriptor's valid range. Decimal output
 * always uses {@link Locale#ROOT}.
 */
public sealed interface ValueFormatter
        permits ValueFormatter.Percent,
                ValueFormatter.BilateralPercent,
                ValueFormatter.Linear,
                ValueFormatter.NoteName,
                ValueFormatter.SemitoneOffset,
                ValueFormatter.Custom
{
    String format(int rawValue);

    static Percent percent(int maxPercent) {
        return new Percent(0, maxPercent);
    }

    static BilateralPercent bilateral(int extreme) {
        return new BilateralPercent(extreme, ProtocolValues.MIDPOINT);
    }

    static Linear linear(double min, double max) {
        return new Linear(min, max, "");
    }

    static NoteName noteName() {
        return NoteName.INSTANCE;
    }

    static SemitoneOffset semitones() {
        return new SemitoneOffset(" semitones");
    }

    static Custom custom(IntFunction<String> function) {
        return new Custom(function);
    }

    /**
     * {@code round(raw / 127 * (maxPercent - minPercent)) + minPercent}, rendered
     * as {@code "<n>%"}.
     */
    record Percent(int minPercent, int maxPercent) implements ValueFormatter
    {
        @Override
        public String format(int rawValue) {
            double ratio = rawValue / (double) ProtocolValues.MAX;
            long percent = Math.round(ratio * (maxPercent - minPercent)) + minPercent;
            return percent + "%";
        }
    }

    /**
     * Signed percentage around a rest value {@code center}. Below the center
     * scales toward {@code -extreme}, above it toward {@code +extreme}; the
     * center itself is exactly {@code "0.00%"}.
     */
    record BilateralPercent(int extreme, int center) implements ValueFormatter
    {
        public BilateralPercent {
            if (center <= ProtocolValues.MIN || center >= ProtocolValues.MAX) {
                throw new ConfigInvalidException(
                        "Bilateral center must be strictly inside the value range (was " + center + ")");
            }
        }

        @Override
        public String format(int rawValue) {
            final double percent;
            if (rawValue < center) {
                percent = -extreme * (1 - rawValue / (double) center);
            }
            else if (rawValue > center) {
                percent = extreme * ((rawValue - center) / (double) (ProtocolValues.MAX - center));
            }
            else {
                percent = 0.0;
            }
            return String.format(Locale.ROOT, "%.2f%%", percent);
        }
    }

    /**
     * Affine map of 0–127 onto {@code [min, max]}, two decimals, followed by
     * {@code unit} (may be empty).
     */
    record Linear(double min, double max, String unit) implements ValueFormatter
    {
        public Linear {
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public String format(int rawValue) {
            double actual = rawValue / (double) ProtocolValues.MAX * (max - min) + min;
            return String.format(Locale.ROOT, "%.2f", actual) + unit;
        }
    }

    /**
     * Note name and octave, C-1 (0) through G9 (127).
     * <p>
     * The pitch-class table mixes sharps and flats exactly as the hardware's own
     * display does.
     */
    record NoteName() implements ValueFormatter
    {
        static final NoteName INSTANCE = new NoteName();

        public static final List<String> PITCH_CLASSES =
                List.of("C", "C#", "D", "Eb", "E", "F", "F#", "G", "Ab", "A", "Bb", "B");

        @Override
        public String format(int rawValue) {
            return PITCH_CLASSES.get(rawValue % 12) + (rawValue / 12 - 1);
        }
    }

    /**
     * Signed offset from the midpoint: 0 is -64, 64 is 0, 127 is +63.
     */
    record SemitoneOffset(String unit) implements ValueFormatter
    {
        public SemitoneOffset {
            Objects.requireNonNull(unit, "unit");
        }

        @Override
        public String format(int rawValue) {
            return (rawValue - ProtocolValues.MIDPOINT) + unit;
        }
    }

    /**
     * Escape hatch for one-off renderings. The function must be pure.
     */
    record Custom(IntFunction<String> function) implements ValueFormatter
    {
        public Custom {
            Objects.requireNonNull(function, "function");
        }

        @Override
        public String format(int rawValue) {
            return function.apply(rawValue);
        }
    }
}
