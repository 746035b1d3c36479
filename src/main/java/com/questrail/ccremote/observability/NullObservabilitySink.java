package com.questrail.ccremote.observability;

import com.questrail.ccremote.log.MessageLogEntry;
import com.questrail.ccremote.preset.RestoreReport;

/**
 * No-op implementation of CcRemoteObservabilitySink.
 */
public final class NullObservabilitySink implements CcRemoteObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMessageLogged(MessageLogEntry entry) {}

    @Override
    public void onLinkError(LinkErrorEvent event) {}

    @Override
    public void onObserverError(ObserverErrorEvent event) {}

    @Override
    public void onSessionEvent(SessionEvent event) {}

    @Override
    public void onRestoreCompleted(RestoreReport report) {}
}
