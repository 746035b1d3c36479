package com.questrail.ccremote.observability;

import com.questrail.ccremote.log.MessageLogEntry;
import com.questrail.ccremote.preset.RestoreReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CcRemoteObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements CcRemoteObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onMessageLogged(MessageLogEntry entry) {
        if (log.isDebugEnabled()) {
            log.debug("MIDI {} {}", entry.direction().arrow(), entry.toHexString());
        }
    }

    @Override
    public void onLinkError(LinkErrorEvent event) {
        log.error("Link error: {}", event.message(), event.cause());
    }

    @Override
    public void onObserverError(ObserverErrorEvent event) {
        log.warn("Observer for {} failed on {}", event.address(), event.value(), event.cause());
    }

    @Override
    public void onSessionEvent(SessionEvent event) {
        log.info("Session {}: {}", event.type(), event.deviceName());
    }

    @Override
    public void onRestoreCompleted(RestoreReport report) {
        if (report.isComplete()) {
            log.info("Preset '{}' restored: {} parameters", report.presetName(), report.applied().size());
            return;
        }
        log.warn("Preset '{}' partially restored: {} applied, {} failed {}",
            report.presetName(),
            report.applied().size(),
            report.failures().size(),
            report.failures().keySet());
    }
}
