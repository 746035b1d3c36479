package com.questrail.ccremote.preset;

import com.questrail.ccremote.api.ParameterAddress;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of applying a preset: which addresses were written and which failed.
 *
 * <p>A restore is a sequence of independent writes, not a transaction, so a
 * partial outcome is normal on a flaky link.</p>
 */
public record RestoreReport(
        String presetName,
        List<ParameterAddress> applied,
        SortedMap<ParameterAddress, RuntimeException> failures
) {
    public RestoreReport {
        Objects.requireNonNull(presetName, "presetName");
        applied = List.copyOf(applied);
        failures = Collections.unmodifiableSortedMap(new TreeMap<>(failures));
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    public static RestoreReport of(String presetName,
                                   List<ParameterAddress> applied,
                                   Map<ParameterAddress, RuntimeException> failures) {
        return new RestoreReport(presetName, applied, new TreeMap<>(failures));
    }
}
