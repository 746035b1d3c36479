package com.questrail.ccremote.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * MessageLog
 * =============================================================================
 * Bounded, insertion-ordered record of wire traffic in both directions.
 *
 * <h2>Eviction</h2>
 * The log holds at most {@link #capacity()} entries. Publishing to a full log
 * drops the oldest entry.
 *
 * <h2>Observer-before-visibility</h2>
 * A single observer slot receives every appended entry <em>before</em> the
 * entry becomes visible through {@link #snapshot()}. A snapshot taken from
 * inside the observer therefore does not contain the entry being delivered.
 * This ordering is part of the contract: observers that render the full log on
 * an empty snapshot and then append the delivered entry rely on it.
 *
 * <h2>Threading</h2>
 * Outbound appends happen on the writer's thread and inbound appends on the
 * transport's delivery thread. Appends enter one FIFO queue; whichever thread
 * finds the queue idle becomes its drainer and delivers and publishes entries
 * one at a time until the queue is empty. Consequently:
 * <ul>
 *   <li>the observer is never invoked concurrently with itself, and sees
 *       entries in append order</li>
 *   <li>{@link #append} never waits for another thread's observer call; an
 *       entry appended while delivery is busy is handed to the busy thread and
 *       becomes visible once that thread reaches it</li>
 *   <li>{@link #snapshot()} takes no lock; it reads an immutable list that is
 *       republished after each delivery</li>
 * </ul>
 * An uncontended append delivers and publishes on the caller's thread before
 * returning.
 */
public final class MessageLog
{
    private static final Logger log = LoggerFactory.getLogger(MessageLog.class);

    /** Capacity used when none is configured. */
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;

    /** Guards {@link #pending} and {@link #draining}. */
    private final Object queueLock = new Object();
    private final ArrayDeque<MessageLogEntry> pending = new ArrayDeque<>();
    private boolean draining;

    private volatile List<MessageLogEntry> visible = List.of();
    private volatile Consumer<MessageLogEntry> observer;

    public MessageLog() {
        this(DEFAULT_CAPACITY);
    }

    public MessageLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1 (was " + capacity + ")");
        }
        this.capacity = capacity;
    }

    /**
     * Queues {@code entry} for delivery to the observer (if any) and then
     * publication, evicting the oldest entry if the log is full.
     */
    public void append(MessageLogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        synchronized (queueLock) {
            pending.addLast(entry);
            if (draining) {
                return;
            }
            draining = true;
        }
        drain();
    }

    /**
     * Returns the current entries, oldest first. The returned list is an
     * immutable copy and does not track later appends.
     */
    public List<MessageLogEntry> snapshot() {
        return visible;
    }

    /**
     * Replaces the observer slot. {@code null} empties it.
     */
    public void setObserver(Consumer<MessageLogEntry> observer) {
        this.observer = observer;
    }

    public int size() {
        return visible.size();
    }

    public int capacity() {
        return capacity;
    }

    private void drain() {
        while (true) {
            MessageLogEntry next;
            synchronized (queueLock) {
                next = pending.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            deliver(next);
            publish(next);
        }
    }

    private void deliver(MessageLogEntry entry) {
        Consumer<MessageLogEntry> o = observer;
        if (o == null) {
            return;
        }
        try {
            o.accept(entry);
        } catch (RuntimeException e) {
            // The drainer may be delivering other threads' entries; keep going.
            log.warn("Message log observer failed on {}", entry, e);
        }
    }

    /** Only the current drainer calls this. */
    private void publish(MessageLogEntry entry) {
        List<MessageLogEntry> current = visible;
        int from = current.size() == capacity ? 1 : 0;
        List<MessageLogEntry> next = new ArrayList<>(capacity);
        next.addAll(current.subList(from, current.size()));
        next.add(entry);
        visible = Collections.unmodifiableList(next);
    }
}
