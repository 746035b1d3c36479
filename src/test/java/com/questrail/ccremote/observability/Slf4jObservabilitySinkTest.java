package com.questrail.ccremote.observability;

import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.ParameterValue;
import com.questrail.ccremote.api.TransportWriteException;
import com.questrail.ccremote.log.MessageLogEntry;
import com.questrail.ccremote.preset.RestoreReport;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jObservabilitySinkTest
{
    @Test
    void acceptsEveryEventKind() {
        Slf4jObservabilitySink sink = new Slf4jObservabilitySink();

        assertDoesNotThrow(() -> {
            sink.onMessageLogged(MessageLogEntry.sent(new byte[] {(byte) 0xB0, 7, 1}, Instant.EPOCH));
            sink.onLinkError(new LinkErrorEvent(Instant.EPOCH, "write failed",
                    new TransportWriteException("boom", null)));
            sink.onLinkError(new LinkErrorEvent(Instant.EPOCH, "no cause", null));
            sink.onObserverError(new ObserverErrorEvent(Instant.EPOCH, ParameterAddress.of(7),
                    ParameterValue.known(1), new IllegalStateException("view detached")));
            sink.onSessionEvent(new SessionEvent(Instant.EPOCH, SessionEvent.Type.OPENED, "Theremini"));
            sink.onRestoreCompleted(RestoreReport.of("Lead",
                    List.of(ParameterAddress.of(5)),
                    Map.of(ParameterAddress.of(6), new TransportWriteException("boom", null))));
        });
    }
}
