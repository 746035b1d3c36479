package com.questrail.ccremote.observability;

import com.questrail.ccremote.log.MessageLogEntry;
import com.questrail.ccremote.preset.RestoreReport;

/**
 * Main interface for receiving controller observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run synchronously on the thread that produced the event and
 * must not throw.</p>
 */
public interface CcRemoteObservabilitySink {
    /**
     * Called for every message appended to the session's message log.
     * @param entry the logged message
     */
    void onMessageLogged(MessageLogEntry entry);

    /**
     * Called when the device link fails to send, fails to receive, or drops work.
     * @param event the error details
     */
    void onLinkError(LinkErrorEvent event);

    /**
     * Called when a parameter observer throws. The write it was notified of
     * stands.
     * @param event the failing address, value and exception
     */
    void onObserverError(ObserverErrorEvent event);

    /**
     * Called when a session is opened or closed.
     * @param event the lifecycle event
     */
    void onSessionEvent(SessionEvent event);

    /**
     * Called after a preset has been applied.
     * @param report per-address outcome
     */
    void onRestoreCompleted(RestoreReport report);
}
