package com.questrail.ccremote.mapping;

import com.questrail.ccremote.format.ValueFormatter;

import java.util.List;

import static com.questrail.ccremote.mapping.ParameterDescriptor.bilateral;
import static com.questrail.ccremote.mapping.ParameterDescriptor.linear;
import static com.questrail.ccremote.mapping.ParameterDescriptor.noteRange;
import static com.questrail.ccremote.mapping.ParameterDescriptor.percent;

/**
 * Control map of the Moog Theremini, as exposed over its MIDI CC implementation.
 */
public final class ThereminiParameters
{
    private ThereminiParameters() {
    }

    public static ParameterCatalog catalog() {
        return new ParameterCatalog(List.of(
                volumeAndRange(),
                pitchCorrection(),
                waveform(),
                filter(),
                volumeAntenna(),
                pitchAntenna(),
                scan(),
                delay()
        ));
    }

    static ParameterPage volumeAndRange() {
        return ParameterPage.sliders("Volume & Range",
                percent("Master Volume", 7, 127, 100),
                noteRange("Low Note", 87, 12 * 3),   // C2
                noteRange("High Note", 88, 12 * 8),  // C7
                ParameterDescriptor.of("Transpose", 102, 64, ValueFormatter.semitones()));
    }

    static ParameterPage pitchCorrection() {
        return new ParameterPage("Pitch Correction",
                List.of(percent("Pitch Correction", 84, 0, 100)),
                List.of(
                        ChoiceParameter.of("Root Note", 86,
                                "C", "C#", "D", "D#", "E", "F", "F#", "G", "G#", "A", "A#", "B"),
                        ChoiceParameter.of("Scale", 85,
                                "Chromatic", "Ionian", "Dorian", "Phrygian", "Lydian", "Mixolydian", "Aeolian",
                                "Locrian", "Maj Blues", "Min Blues", "Dim", "Maj Penta", "Min Penta", "Spanish",
                                "Gypsy", "Arabian", "Egyptian", "Ryukyu", "Wholetone", "Maj 3rd", "Min 3rd", "5th")));
    }

    static ParameterPage waveform() {
        return new ParameterPage("Waveform",
                List.of(),
                List.of(ChoiceParameter.of("Waveform", 90,
                        "Sine", "Triangle", "Super Saw", "Animoog 1", "Animoog 2", "Animoog 3", "Etherwave")));
    }

    static ParameterPage filter() {
        return new ParameterPage("Filter",
                List.of(
                        percent("Filter Cutoff", 74, 0, 100),
                        percent("Filter Resonance", 71, 0, 100)),
                List.of(ChoiceParameter.of("Filter Type", 80,
                        "Bypass", "Lowpass", "Bandpass", "Highpass", "Notch", "Animoog 3", "Etherwave")));
    }

    static ParameterPage volumeAntenna() {
        return ParameterPage.sliders("Volume Antenna",
                bilateral("Filter Cutoff", 27, 100),
                bilateral("Filter Resonance", 28, 200),
                percent("Volume", 26, 8, 1600),
                bilateral("Wavetable Scan Amount", 25, 400),
                bilateral("Wavetable Scan Frequency", 23, 400));
    }

    static ParameterPage pitchAntenna() {
        return ParameterPage.sliders("Pitch Antenna",
                bilateral("Filter Cutoff Pitch Tracking", 29, 800),
                bilateral("Filter Resonance", 30, 400),
                bilateral("Wavetable Scan Amount", 24, 400),
                bilateral("Wavetable Scan Frequency", 22, 400));
    }

    static ParameterPage scan() {
        return ParameterPage.sliders("Scan/Wavetable",
                ParameterDescriptor.of("Wavetable Scan Rate", 9, 0, new ValueFormatter.Linear(0.0, 32.0, "Hz")),
                linear("Scan Amount", 20, 0.0, 2.0, 0),
                linear("Scan Position", 21, 0.0, 2.0, 0));
    }

    static ParameterPage delay() {
        return ParameterPage.sliders("Delay",
                linear("Delay Time", 12, 0.0, 0.83, 0),
                percent("Delay Feedback", 14, 0, 100),
                percent("Effect Mix", 91, 0, 100));
    }
}
