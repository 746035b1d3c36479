package com.questrail.ccremote.preset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.format.ProtocolValues;

import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Serializes an address/value mapping as a JSON object keyed by the numeric
 * address, e.g. {@code {"5":10,"7":20}}.
 */
public final class PresetCodec
{
    private static final TypeReference<TreeMap<Integer, Integer>> WIRE_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public PresetCodec() {
        this(strictMapper());
    }

    public PresetCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Mapper that refuses to coerce fractional numbers or strings into values,
     * so damaged stored data is reported instead of silently repaired.
     */
    static ObjectMapper strictMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        mapper.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail);
        return mapper;
    }

    public String encode(Map<ParameterAddress, Integer> values) {
        TreeMap<Integer, Integer> wire = new TreeMap<>();
        values.forEach((address, value) -> {
            if (!ProtocolValues.isValid(value)) {
                throw new IllegalArgumentException("Value for " + address + " outside 0–127: " + value);
            }
            wire.put(address.value(), value);
        });
        try {
            return mapper.writeValueAsString(wire);
        } catch (JsonProcessingException e) {
            throw new PresetStorageException("Failed to serialize preset", e);
        }
    }

    /**
     * @throws PresetStorageException if {@code text} is not a JSON object of
     *         in-range integer addresses to in-range integer values
     */
    public SortedMap<ParameterAddress, Integer> decode(String text) {
        final TreeMap<Integer, Integer> wire;
        try {
            wire = mapper.readValue(text, WIRE_TYPE);
        } catch (JsonProcessingException e) {
            throw new PresetStorageException("Malformed preset data", e);
        }

        SortedMap<ParameterAddress, Integer> values = new TreeMap<>();
        if (wire == null) {
            return values;
        }
        for (Map.Entry<Integer, Integer> e : wire.entrySet()) {
            Integer address = e.getKey();
            Integer value = e.getValue();
            if (address == null || address < ParameterAddress.MIN_VALUE || address > ParameterAddress.MAX_VALUE) {
                throw new PresetStorageException("Preset address out of range: " + address);
            }
            if (value == null || !ProtocolValues.isValid(value)) {
                throw new PresetStorageException("Preset value out of range for address " + address + ": " + value);
            }
            values.put(ParameterAddress.of(address), value);
        }
        return values;
    }
}
