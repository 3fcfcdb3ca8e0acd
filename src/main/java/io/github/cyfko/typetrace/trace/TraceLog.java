package io.github.cyfko.typetrace.trace;

import io.github.cyfko.typetrace.model.ConstructionEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Process-wide, append-only log of cell construction events.
 * <p>
 * Append order is program order. Events are never removed; callers interested in a window of
 * activity take a {@linkplain #size() mark} first and read {@link #since(int)} afterwards.
 * </p>
 *
 * <pre>{@code
 * int mark = TraceLog.global().size();
 * DynamicArray.filled(5, 1.3);
 * List<ConstructionEvent> events = TraceLog.global().since(mark);   // 10 events
 * }</pre>
 */
public final class TraceLog {

    private static final TraceLog GLOBAL = new TraceLog();

    private final List<ConstructionEvent> events = new ArrayList<>();

    private TraceLog() {
    }

    public static TraceLog global() {
        return GLOBAL;
    }

    synchronized void append(ConstructionEvent event) {
        events.add(event);
    }

    public synchronized int size() {
        return events.size();
    }

    /**
     * @return a snapshot of every event recorded so far
     */
    public synchronized List<ConstructionEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns a snapshot of the events recorded at or after position {@code mark}.
     *
     * @throws IndexOutOfBoundsException if {@code mark} is negative or beyond the log size
     */
    public synchronized List<ConstructionEvent> since(int mark) {
        Objects.checkFromToIndex(mark, events.size(), events.size());
        return List.copyOf(events.subList(mark, events.size()));
    }
}
