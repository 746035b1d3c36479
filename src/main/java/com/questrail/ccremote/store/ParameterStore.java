package com.questrail.ccremote.store;

import com.questrail.ccremote.api.DeviceLinkException;
import com.questrail.ccremote.api.ParameterAddress;
import com.questrail.ccremote.api.ParameterController;
import com.questrail.ccremote.api.ParameterObserver;
import com.questrail.ccremote.api.ParameterValue;
import com.questrail.ccremote.link.DeviceLink;
import com.questrail.ccremote.mapping.ChoiceParameter;
import com.questrail.ccremote.mapping.ParameterDescriptor;
import com.questrail.ccremote.observability.CcRemoteObservabilitySink;
import com.questrail.ccremote.observability.LinkErrorEvent;
import com.questrail.ccremote.observability.ObserverErrorEvent;
import com.questrail.ccremote.time.WallClock;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * ParameterStore
 * -----------------------------------------------------------------------------
 * The central {@link ParameterController}: last-known value per address, one
 * observer slot per address, and the write path to the {@link DeviceLink}.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Sends a write through the link <em>before</em> touching the cache, so
 *       a failed send leaves no trace (no cache update, no notification)</li>
 *   <li>Caches successful writes; addresses start {@link ParameterValue#UNKNOWN}</li>
 *   <li>Notifies the address's observer synchronously, exactly once per write
 *       and once on registration</li>
 * </ul>
 * An observer that throws is reported through
 * {@link CcRemoteObservabilitySink#onObserverError}. The write still returns
 * normally because the device and the cache already hold the new value.
 *
 * <h2>Threading model</h2>
 * Every write (send, cache update, notification) runs under one private
 * monitor, so at most one write is in flight and observers are never invoked
 * concurrently.
 *
 * <h2>Reentrant writes</h2>
 * Observers commonly react to a value by writing. Java monitors are reentrant,
 * so such writes run on the same thread inside the notification:
 * <ul>
 *   <li>a write to a <em>different</em> address executes immediately (nested)</li>
 *   <li>a write to the address <em>being notified</em> is deferred and runs
 *       after the outermost write's notification returns, in FIFO order</li>
 * </ul>
 * At most {@code maxDeferredWrites} deferred writes run per outermost write;
 * the rest are dropped and reported to the sink. A deferred write that fails
 * is reported to the sink, because its caller has already returned.
 */
public final class ParameterStore implements ParameterController
{
    /** Deferred self-writes processed per outermost write when not configured. */
    public static final int DEFAULT_MAX_DEFERRED_WRITES = 16;

    private final Object lock = new Object();

    private final DeviceLink link;
    private final CcRemoteObservabilitySink sink;
    private final WallClock clock;
    private final int maxDeferredWrites;

    private final ParameterValue[] values = new ParameterValue[ParameterAddress.MAX_VALUE + 1];
    private final ParameterObserver[] observers = new ParameterObserver[ParameterAddress.MAX_VALUE + 1];

    /** Addresses whose observer is currently on the stack. */
    private final Set<ParameterAddress> notifying = new HashSet<>();
    private final ArrayDeque<PendingWrite> deferred = new ArrayDeque<>();
    private int depth;

    private volatile boolean closed;

    public ParameterStore(DeviceLink link,
                          CcRemoteObservabilitySink sink,
                          WallClock clock,
                          int maxDeferredWrites) {
        this.link = Objects.requireNonNull(link, "link");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxDeferredWrites < 0) {
            throw new IllegalArgumentException("maxDeferredWrites must be >= 0");
        }
        this.maxDeferredWrites = maxDeferredWrites;
        Arrays.fill(values, ParameterValue.UNKNOWN);
    }

    @Override
    public void write(ParameterAddress address, ParameterValue value) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(value, "value");

        synchronized (lock) {
            if (notifying.contains(address)) {
                deferred.addLast(new PendingWrite(address, value));
                return;
            }

            boolean outermost = depth == 0;
            try {
                applyLocked(address, value);
            } finally {
                if (outermost) {
                    drainDeferredLocked();
                }
            }
        }
    }

    /**
     * Writes the descriptor's default value.
     */
    public void writeDefault(ParameterDescriptor descriptor) {
        write(descriptor.address(), descriptor.defaultValue());
    }

    /**
     * Writes the value of the choice at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the choice has no such index
     */
    public void select(ChoiceParameter choice, int index) {
        write(choice.address(), choice.valueOf(index));
    }

    @Override
    public void registerObserver(ParameterAddress address, ParameterObserver observer) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(observer, "observer");

        synchronized (lock) {
            observers[address.value()] = observer;

            boolean outermost = depth == 0;
            try {
                notifyLocked(address);
            } finally {
                if (outermost) {
                    drainDeferredLocked();
                }
            }
        }
    }

    @Override
    public void clearObserver(ParameterAddress address) {
        Objects.requireNonNull(address, "address");
        synchronized (lock) {
            observers[address.value()] = null;
        }
    }

    @Override
    public ParameterValue getCachedValue(ParameterAddress address) {
        Objects.requireNonNull(address, "address");
        synchronized (lock) {
            return values[address.value()];
        }
    }

    @Override
    public SortedMap<ParameterAddress, Integer> getAllKnownValues() {
        SortedMap<ParameterAddress, Integer> known = new TreeMap<>();
        synchronized (lock) {
            for (int i = 0; i < values.length; i++) {
                if (values[i].isKnown()) {
                    known.put(ParameterAddress.of(i), values[i].value());
                }
            }
        }
        return Collections.unmodifiableSortedMap(known);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the link. Idempotent. Cached values stay readable; writes of known
     * values fail with {@code LinkUnavailableException}.
     */
    @Override
    public void close() {
        closed = true;
        link.close();
    }

    // -------------------------------------------------------------------------
    // Internals (lock held)
    // -------------------------------------------------------------------------

    private void applyLocked(ParameterAddress address, ParameterValue value) {
        if (value.isKnown()) {
            // Throws on failure; nothing below runs.
            link.sendParameterChange(address, value.value());
            values[address.value()] = value;
        }
        notifyLocked(address);
    }

    private void notifyLocked(ParameterAddress address) {
        ParameterObserver observer = observers[address.value()];
        if (observer == null) {
            return;
        }

        notifying.add(address);
        depth++;
        ParameterValue value = values[address.value()];
        try {
            observer.onValue(address, value);
        } catch (RuntimeException e) {
            // The write has already been sent and cached.
            sink.onObserverError(new ObserverErrorEvent(clock.now(), address, value, e));
        } finally {
            depth--;
            notifying.remove(address);
        }
    }

    private void drainDeferredLocked() {
        int processed = 0;
        while (!deferred.isEmpty()) {
            if (processed == maxDeferredWrites) {
                int dropped = deferred.size();
                deferred.clear();
                sink.onLinkError(new LinkErrorEvent(clock.now(),
                        "Dropped " + dropped + " deferred writes after " + maxDeferredWrites
                                + " (observer keeps rewriting its own address)",
                        null));
                return;
            }
            PendingWrite w = deferred.pollFirst();
            processed++;
            try {
                applyLocked(w.address(), w.value());
            } catch (DeviceLinkException e) {
                sink.onLinkError(new LinkErrorEvent(clock.now(),
                        "Deferred write to " + w.address() + " failed", e));
            }
        }
    }

    private record PendingWrite(ParameterAddress address, ParameterValue value) {
    }
}
