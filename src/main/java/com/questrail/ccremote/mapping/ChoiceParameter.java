package com.questrail.ccremote.mapping;

import com.questrail.ccremote.api.ConfigInvalidException;
import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.ParameterValue;

import java.util.List;
import java.util.Objects;

/**
 * A parameter chosen from a fixed list of labels (waveform, scale, filter type).
 *
 * <p>Choosing the label at index {@code i} writes the raw value {@code i}.</p>
 */
public record ChoiceParameter(String name, ParameterAddress address, List<String> labels)
{
    public ChoiceParameter {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(address, "address");
        labels = List.copyOf(Objects.requireNonNull(labels, "labels"));
        if (labels.isEmpty()) {
            throw new ConfigInvalidException(name + ": at least one choice required");
        }
        if (labels.size() > 128) {
            throw new ConfigInvalidException(name + ": at most 128 choices (was " + labels.size() + ")");
        }
    }

    public static ChoiceParameter of(String name, int address, String... labels) {
        return new ChoiceParameter(name, ParameterAddress.of(address), List.of(labels));
    }

    /**
     * Raw value for the label at {@code index}.
     *
     * @throws IndexOutOfBoundsException if there is no such label
     */
    public int valueOf(int index) {
        Objects.checkIndex(index, labels.size());
        return index;
    }

    /**
     * Label for a raw value; values past the last label render as the number.
     */
    public String format(int value) {
        return value >= 0 && value < labels.size() ? labels.get(value) : Integer.toString(value);
    }

    public String heading() {
        return name + " (CC " + address.value() + ")";
    }

    public String format(ParameterValue value) {
        return value.isKnown() ? format(value.value()) : ParameterDescriptor.UNKNOWN_TEXT;
    }
}
