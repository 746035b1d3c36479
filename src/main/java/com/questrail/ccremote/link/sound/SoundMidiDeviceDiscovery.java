package com.questrail.ccremote.link.sound;

import com.questrail.ccremote.link.DeviceDiscovery;
import com.questrail.ccremote.link.DeviceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sound.midi.MidiDevice;
import javax.sound.midi.MidiSystem;
import javax.sound.midi.MidiUnavailableException;
import javax.sound.midi.Sequencer;
import javax.sound.midi.Synthesizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates hardware MIDI ports through {@link MidiSystem}.
 *
 * <p>Software sequencers and synthesizers are skipped. Ports are paired by
 * name into one {@link SoundMidiDeviceHandle} per physical device.</p>
 */
public final class SoundMidiDeviceDiscovery implements DeviceDiscovery
{
    private static final Logger log = LoggerFactory.getLogger(SoundMidiDeviceDiscovery.class);

    @Override
    public List<DeviceHandle> discover() {
        Map<String, MidiDevice[]> byName = new LinkedHashMap<>();

        for (MidiDevice.Info info : MidiSystem.getMidiDeviceInfo()) {
            final MidiDevice device;
            try {
                device = MidiSystem.getMidiDevice(info);
            } catch (MidiUnavailableException | IllegalArgumentException e) {
                log.debug("Skipping unavailable MIDI device {}", info.getName(), e);
                continue;
            }
            if (device instanceof Sequencer || device instanceof Synthesizer) {
                continue;
            }

            MidiDevice[] sides = byName.computeIfAbsent(info.getName(), n -> new MidiDevice[2]);
            if (device.getMaxReceivers() != 0 && sides[0] == null) {
                sides[0] = device;
            }
            if (device.getMaxTransmitters() != 0 && sides[1] == null) {
                sides[1] = device;
            }
        }

        List<DeviceHandle> handles = new ArrayList<>();
        byName.forEach((name, sides) -> {
            if (sides[0] != null || sides[1] != null) {
                handles.add(new SoundMidiDeviceHandle(name, sides[0], sides[1]));
            }
        });
        return handles;
    }
}
