package com.questrail.ccremote.preset;

import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.ParameterController;
import com.questrail.ccremote.observability.CcRemoteObservabilitySink;
import com.questrail.ccremote.observability.NullObservabilitySink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Applies a preset by writing each of its values through a
 * {@link ParameterController}.
 *
 * <p>Best effort: a failed write is recorded against its address and the
 * remaining writes still run. Writes go out in address order.</p>
 */
public final class PresetRestorer
{
    private final CcRemoteObservabilitySink sink;

    public PresetRestorer() {
        this(NullObservabilitySink.INSTANCE);
    }

    public PresetRestorer(CcRemoteObservabilitySink sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public RestoreReport apply(Preset preset, ParameterController controller) {
        Objects.requireNonNull(preset, "preset");
        Objects.requireNonNull(controller, "controller");

        List<ParameterAddress> applied = new ArrayList<>();
        Map<ParameterAddress, RuntimeException> failures = new TreeMap<>();

        preset.values().forEach((address, value) -> {
            try {
                controller.write(address, value);
                applied.add(address);
            } catch (RuntimeException e) {
                failures.put(address, e);
            }
        });

        RestoreReport report = RestoreReport.of(preset.name(), applied, failures);
        sink.onRestoreCompleted(report);
        return report;
    }
}
