package com.questrail.ccremote.api;

/**
 * Callback slot for one parameter address.
 *
 * <p>Invoked synchronously on the writing thread: once on registration with the
 * current cached value, then once per successful write to the address.</p>
 *
 * <p>A runtime exception thrown here does not reach the writer; the controller
 * reports it to its observability sink.</p>
 */
@FunctionalInterface
public interface ParameterObserver
{
    void onValue(ParameterAddress address, ParameterValue value);
}
