package com.questrail.ccremote.observability;

import com.questrail.ccremote.log.MessageLogEntry;
import com.questrail.ccremote.preset.RestoreReport;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements CcRemoteObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onMessageLogged(MessageLogEntry entry) {
        events.add(entry);
    }

    @Override
    public synchronized void onLinkError(LinkErrorEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onObserverError(ObserverErrorEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSessionEvent(SessionEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onRestoreCompleted(RestoreReport report) {
        events.add(report);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }
}
