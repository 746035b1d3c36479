package com.questrail.ccremote.format;

import com.questrail.ccremote.api.ConfigInvalidException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueFormatterTest
{
    @Test
    void percentScalesAcrossTheFullDomainAndRounds() {
        ValueFormatter f = ValueFormatter.percent(100);

        assertEquals("0%", f.format(0));
        assertEquals("50%", f.format(64));   // 50.39
        assertEquals("100%", f.format(127));
    }

    @Test
    void percentHonoursOffsetAndLargeMaximum() {
        assertEquals("101%", ValueFormatter.percent(1600).format(8)); // 100.79
        assertEquals("1600%", ValueFormatter.percent(1600).format(127));
        assertEquals("-50%", new ValueFormatter.Percent(-50, 50).format(0));
        assertEquals("50%", new ValueFormatter.Percent(-50, 50).format(127));
    }

    @Test
    void bilateralCenterIsExactlyZeroWhateverTheExtreme() {
        for (int extreme : new int[] {1, 100, 200, 400, 800, 12345}) {
            assertEquals("0.00%", ValueFormatter.bilateral(extreme).format(64), "extreme " + extreme);
        }
        assertEquals("0.00%", new ValueFormatter.BilateralPercent(400, 32).format(32));
    }

    @Test
    void bilateralScalesEachSideIndependently() {
        ValueFormatter f = ValueFormatter.bilateral(400);

        assertEquals("-400.00%", f.format(0));
        assertEquals("-200.00%", f.format(32));
        assertEquals("203.17%", f.format(96));
        assertEquals("400.00%", f.format(127));
    }

    @Test
    void bilateralCenterMustBeInsideTheDomain() {
        assertThrows(ConfigInvalidException.class, () -> new ValueFormatter.BilateralPercent(100, 0));
        assertThrows(ConfigInvalidException.class, () -> new ValueFormatter.BilateralPercent(100, 127));
    }

    @Test
    void linearMapsOntoArbitraryRangeWithTwoDecimals() {
        ValueFormatter f = ValueFormatter.linear(0.0, 2.0);

        assertEquals("0.00", f.format(0));
        assertEquals("2.00", f.format(127));
        assertEquals("0.83", ValueFormatter.linear(0.0, 0.83).format(127));
        assertEquals("-1.00", ValueFormatter.linear(-1.0, 1.0).format(0));
    }

    @Test
    void linearAppendsUnit() {
        ValueFormatter f = new ValueFormatter.Linear(0.0, 32.0, "Hz");

        assertEquals("32.00Hz", f.format(127));
        assertEquals("0.00Hz", f.format(0));
    }

    @Test
    void noteNamesUseTheDeviceSpellingTable() {
        ValueFormatter f = ValueFormatter.noteName();

        assertEquals("C3", f.format(48));
        assertEquals("C#3", f.format(49));
        assertEquals("Eb3", f.format(51));
        assertEquals("Ab3", f.format(56));
        assertEquals("Bb3", f.format(58));
        assertEquals("C-1", f.format(0));
        assertEquals("C2", f.format(36));
        assertEquals("C7", f.format(96));
        assertEquals("G9", f.format(127));
    }

    @Test
    void semitoneOffsetIsSignedAroundTheMidpoint() {
        ValueFormatter f = ValueFormatter.semitones();

        assertEquals("-64 semitones", f.format(0));
        assertEquals("0 semitones", f.format(64));
        assertEquals("63 semitones", f.format(127));
    }

    @Test
    void customDelegatesToFunction() {
        ValueFormatter f = ValueFormatter.custom(v -> v == 0 ? "off" : "on");

        assertEquals("off", f.format(0));
        assertEquals("on", f.format(1));
    }

    @Test
    void variantsWithEqualParametersAreEqual() {
        assertEquals(ValueFormatter.bilateral(400), ValueFormatter.bilateral(400));
        assertNotEquals(ValueFormatter.bilateral(400), ValueFormatter.bilateral(200));
        assertSame(ValueFormatter.noteName(), ValueFormatter.noteName());
    }
}
