package com.questrail.ccremote.api;

import java.util.SortedMap;

/**
 * ParameterController
 * -----------------------------------------------------------------------------
 * {@code ParameterController} is the semantic façade the UI layer talks to when
 * it changes or renders device parameters.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Sending parameter changes to the device (INTENT)</li>
 *   <li>Caching the last value sent per address, since the device cannot be
 *       queried (the cache is the only source of truth)</li>
 *   <li>Fanning out value changes to one observer per address</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Wire encoding or transport</li>
 *   <li>Rendering values for humans (see {@code ParameterDescriptor})</li>
 *   <li>Persisting presets</li>
 * </ul>
 *
 * <h2>Unknown Is a Real State</h2>
 * Every address starts {@link ParameterValue#UNKNOWN}. The only transition is
 * {@code UNKNOWN → known(v)} through {@link #write}; there is no way back.
 *
 * <h2>Failure Semantics</h2>
 * A write whose transmission fails leaves the cache untouched and notifies no
 * observer. The controller remains usable after a failure.
 *
 * <h2>Limitations</h2>
 * One observer per address, last registration wins. Multiple widgets observing
 * the same address at the same time are not supported.
 */
public interface ParameterController extends AutoCloseable
{
    /**
     * Transmits {@code value} for {@code address}, then caches it and notifies
     * the address's observer.
     * <p>
     * Writing {@link ParameterValue#UNKNOWN} transmits nothing and leaves the
     * cache as it is; the observer is re-notified with the cached value.
     *
     * @throws LinkUnavailableException if no link is open
     * @throws TransportWriteException if the link rejected the message
     */
    void write(ParameterAddress address, ParameterValue value);

    /**
     * Convenience for {@code write(address, ParameterValue.known(value))}.
     */
    default void write(ParameterAddress address, int value) {
        write(address, ParameterValue.known(value));
    }

    /**
     * Replaces the observer slot for {@code address} and immediately invokes
     * the observer once with the current cached value (possibly unknown).
     */
    void registerObserver(ParameterAddress address, ParameterObserver observer);

    /**
     * Empties the observer slot for {@code address}, if occupied.
     */
    void clearObserver(ParameterAddress address);

    ParameterValue getCachedValue(ParameterAddress address);

    /**
     * Returns every address with a known value, ordered by address.
     * Unknown addresses are omitted.
     */
    SortedMap<ParameterAddress, Integer> getAllKnownValues();

    /**
     * Releases the underlying link. Idempotent.
     */
    @Override
    void close();
}
