package com.questrail.ccremote.mapping;

import com.questrail.ccremote.api.ConfigInvalidException;
import com.questrail.ccremote.api.ParameterAddress;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ParameterCatalog
 * -----------------------------------------------------------------------------
 * The universe of controllable parameters of one device, grouped in pages.
 *
 * <h2>Why this exists</h2>
 * Descriptors are constructed per screen, but presets and the store only know
 * addresses. The catalog is the lookup from an address back to the descriptor
 * (or choice list) that knows how to render it, e.g. when listing the contents
 * of a saved preset.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Each address belongs to exactly one control across all pages</li>
 *   <li>Page order is preserved</li>
 * </ul>
 */
public final class ParameterCatalog
{
    private final List<ParameterPage> pages;
    private final Map<ParameterAddress, ParameterDescriptor> sliders = new LinkedHashMap<>();
    private final Map<ParameterAddress, ChoiceParameter> choices = new LinkedHashMap<>();

    public ParameterCatalog(List<ParameterPage> pages) {
        this.pages = List.copyOf(Objects.requireNonNull(pages, "pages"));

        for (ParameterPage page : this.pages) {
            for (ParameterDescriptor d : page.sliders()) {
                requireUnused(page, d.address());
                sliders.put(d.address(), d);
            }
            for (ChoiceParameter c : page.choices()) {
                requireUnused(page, c.address());
                choices.put(c.address(), c);
            }
        }
    }

    private void requireUnused(ParameterPage page, ParameterAddress address) {
        if (sliders.containsKey(address) || choices.containsKey(address)) {
            throw new ConfigInvalidException(
                    "Address " + address + " on page '" + page.title() + "' is already assigned");
        }
    }

    public List<ParameterPage> pages() {
        return pages;
    }

    public Optional<ParameterDescriptor> descriptor(ParameterAddress address) {
        return Optional.ofNullable(sliders.get(address));
    }

    public Optional<ChoiceParameter> choice(ParameterAddress address) {
        return Optional.ofNullable(choices.get(address));
    }

    /**
     * Human-readable value for {@code address}, falling back to the raw number
     * for addresses outside the catalog.
     */
    public String format(ParameterAddress address, int value) {
        ParameterDescriptor d = sliders.get(address);
        if (d != null) {
            return d.format(value);
        }
        ChoiceParameter c = choices.get(address);
        if (c != null) {
            return c.format(value);
        }
        return Integer.toString(value);
    }
}
