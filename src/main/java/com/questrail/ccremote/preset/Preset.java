package com.questrail.ccremote.preset;

import com.questrail.ccremote.api.ParameterAddress;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A named snapshot of known parameter values.
 *
 * <p>Only addresses that were known when the snapshot was taken are present;
 * parameters never touched in the session are silently absent.</p>
 */
public record Preset(String name, SortedMap<ParameterAddress, Integer> values)
{
    public Preset {
        Objects.requireNonNull(name, "name");
        values = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(values, "values")));
    }

    public static Preset of(String name, Map<ParameterAddress, Integer> values) {
        return new Preset(name, new TreeMap<>(values));
    }
}
