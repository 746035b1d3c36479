package com.questrail.ccremote.mapping;

import com.questrail.ccremote.api.ConfigInvalidException;
import com.questrail.ccremote.api.ParameterAddress;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One titled group of controls, rendered by the UI as a tab.
 *
 * <p>No address appears twice within a page.</p>
 */
public record ParameterPage(String title, List<ParameterDescriptor> sliders, List<ChoiceParameter> choices)
{
    public ParameterPage {
        Objects.requireNonNull(title, "title");
        sliders = List.copyOf(Objects.requireNonNull(sliders, "sliders"));
        choices = List.copyOf(Objects.requireNonNull(choices, "choices"));

        Set<ParameterAddress> seen = new HashSet<>();
        for (ParameterDescriptor d : sliders) {
            if (!seen.add(d.address())) {
                throw new ConfigInvalidException(title + ": duplicate address " + d.address());
            }
        }
        for (ChoiceParameter c : choices) {
            if (!seen.add(c.address())) {
                throw new ConfigInvalidException(title + ": duplicate address " + c.address());
            }
        }
    }

    public static ParameterPage sliders(String title, ParameterDescriptor... sliders) {
        return new ParameterPage(title, List.of(sliders), List.of());
    }
}
