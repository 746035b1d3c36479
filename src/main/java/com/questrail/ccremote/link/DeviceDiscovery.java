package com.questrail.ccremote.link;

import java.util.List;

/**
 * Enumerates devices currently available for opening.
 *
 * <p>Discovery is best-effort: a failing scan yields an empty list. Callers
 * that want live updates poll.</p>
 */
@FunctionalInterface
public interface DeviceDiscovery
{
    List<DeviceHandle> discover();
}
