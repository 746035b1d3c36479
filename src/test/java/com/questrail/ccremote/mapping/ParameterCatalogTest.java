package com.questrail.ccremote.mapping;

import com.questrail.ccremote.api.ConfigInvalidException;
import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.ParameterValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParameterCatalogTest
{
    @Test
    void thereminiCatalogHasEveryPageInOrder() {
        ParameterCatalog catalog = ThereminiParameters.catalog();

        assertEquals(
                List.of("Volume & Range", "Pitch Correction", "Waveform", "Filter",
                        "Volume Antenna", "Pitch Antenna", "Scan/Wavetable", "Delay"),
                catalog.pages().stream().map(ParameterPage::title).toList());
    }

    @Test
    void thereminiCatalogResolvesSlidersAndChoices() {
        ParameterCatalog catalog = ThereminiParameters.catalog();

        ParameterDescriptor transpose = catalog.descriptor(ParameterAddress.of(102)).orElseThrow();
        assertEquals(64, transpose.defaultValue());
        assertEquals("0 semitones", transpose.format(64));

        ChoiceParameter waveform = catalog.choice(ParameterAddress.of(90)).orElseThrow();
        assertEquals("Super Saw", waveform.format(2));
        assertEquals(7, waveform.labels().size());

        assertEquals(22, catalog.choice(ParameterAddress.of(85)).orElseThrow().labels().size());
        assertEquals("32.00Hz", catalog.format(ParameterAddress.of(9), 127));
        assertEquals("0.00%", catalog.format(ParameterAddress.of(29), 64));
    }

    @Test
    void formatFallsBackToRawNumberOutsideCatalog() {
        ParameterCatalog catalog = ThereminiParameters.catalog();

        assertTrue(catalog.descriptor(ParameterAddress.of(1)).isEmpty());
        assertEquals("42", catalog.format(ParameterAddress.of(1), 42));
    }

    @Test
    void addressMayBelongToOnlyOneControl() {
        ParameterPage a = ParameterPage.sliders("A", ParameterDescriptor.percent("X", 7, 0, 100));
        ParameterPage b = ParameterPage.sliders("B", ParameterDescriptor.percent("Y", 7, 0, 100));

        assertThrows(ConfigInvalidException.class, () -> new ParameterCatalog(List.of(a, b)));
        assertThrows(ConfigInvalidException.class, () -> ParameterPage.sliders("C",
                ParameterDescriptor.percent("X", 7, 0, 100),
                ParameterDescriptor.percent("Y", 7, 0, 100)));
    }

    @Test
    void choiceParameterMapsIndexToValue() {
        ChoiceParameter root = ChoiceParameter.of("Root Note", 86, "C", "C#", "D");

        assertEquals(2, root.valueOf(2));
        assertThrows(IndexOutOfBoundsException.class, () -> root.valueOf(3));
        assertEquals("C#", root.format(1));
        assertEquals("9", root.format(9));
        assertEquals("???", root.format(ParameterValue.UNKNOWN));
        assertEquals("Root Note (CC 86)", root.heading());
    }

    @Test
    void choiceParameterNeedsAtLeastOneLabel() {
        assertThrows(ConfigInvalidException.class, () -> ChoiceParameter.of("Empty", 1));
    }
}
